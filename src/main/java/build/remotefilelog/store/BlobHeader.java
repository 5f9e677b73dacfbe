// Copyright 2026 The Buildfarm Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.remotefilelog.store;

/**
 * The parsed prefix of a blob record.
 *
 * @param offset index of the first content byte, just past the header
 * @param size length of the content that follows the header
 * @param flags revision flags carried by the header, 0 when absent
 */
public record BlobHeader(int offset, long size, int flags) {}
