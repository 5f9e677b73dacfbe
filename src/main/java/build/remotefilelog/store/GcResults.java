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

import static java.lang.String.format;

import build.remotefilelog.common.Size;
import java.util.Locale;

/**
 * Totals from one garbage collection sweep.
 *
 * @param examined files walked, including those that vanished before they could be inspected
 * @param removed files deleted by this sweep
 * @param originalSize bytes held by the inspected files before the sweep
 * @param finalSize bytes held by the files the sweep kept
 */
public record GcResults(long examined, long removed, long originalSize, long finalSize) {
  @Override
  public String toString() {
    return format(
        Locale.ROOT,
        "removed %d of %d files (%.2f GB to %.2f GB)",
        removed,
        examined,
        Size.bytesToGbFraction(originalSize),
        Size.bytesToGbFraction(finalSize));
  }
}
