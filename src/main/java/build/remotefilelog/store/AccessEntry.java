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

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;

/**
 * A file that survived the first garbage collection pass, ordered for eviction. Access times
 * collide on filesystems with coarse clocks, so ties go to the file that was walked first.
 */
record AccessEntry(Instant accessTime, Path path, long size, long sequence)
    implements Comparable<AccessEntry> {
  private static final Comparator<AccessEntry> EVICTION_ORDER =
      Comparator.comparing(AccessEntry::accessTime).thenComparingLong(AccessEntry::sequence);

  @Override
  public int compareTo(AccessEntry other) {
    return EVICTION_ORDER.compare(this, other);
  }
}
