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
import java.util.Collection;

/**
 * Bookkeeping shared between the stores being repacked and the repack that consumes them. Stores
 * mark what they hold and the repack flags what it moved or collected, after which each store
 * drops the entries it no longer needs to keep.
 *
 * <p>Sources are compared by identity.
 */
public interface Ledger {
  void markDataEntry(Object source, String filename, HashCode node);

  void markHistoryEntry(Object source, String filename, HashCode node);

  /** Entries marked by {@code source}, empty if it marked none. */
  Collection<LedgerEntry> entriesFrom(Object source);
}
