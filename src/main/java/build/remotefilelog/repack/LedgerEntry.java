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

package build.remotefilelog.repack;

import com.google.common.hash.HashCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** One file revision known to a {@link Ledger}, with what has been done to it so far. */
@Getter
@Setter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerEntry {
  @EqualsAndHashCode.Include private final String filename;
  @EqualsAndHashCode.Include private final HashCode node;

  private boolean dataSource = false;
  private boolean historySource = false;
  private boolean dataRepacked = false;
  private boolean historyRepacked = false;
  private boolean gced = false;

  public LedgerEntry(String filename, HashCode node) {
    this.filename = filename;
    this.node = node;
  }

  /** Whether the store that marked this entry may drop its copy. */
  public boolean isReclaimable() {
    return gced || (dataRepacked && historyRepacked);
  }
}
