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

/** The parts of a repository's history needed to map stored name hashes back to file names. */
public interface RepositoryHistory {
  /** Every file name in the newest snapshot. */
  Iterable<String> latestManifest();

  /**
   * The names touched by each change, newest change first. Consumers stop iterating as soon as
   * they have what they need, so implementations should produce changes lazily.
   */
  Iterable<? extends Iterable<String>> changesNewestFirst();
}
