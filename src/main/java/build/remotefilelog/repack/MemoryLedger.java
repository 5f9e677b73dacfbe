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

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/** A {@link Ledger} held in memory for the duration of a single repack. */
public class MemoryLedger implements Ledger {
  private record Key(String filename, HashCode node) {}

  private final Map<Key, LedgerEntry> entries = new LinkedHashMap<>();
  private final Map<Object, Set<LedgerEntry>> sources = new IdentityHashMap<>();

  @Override
  public synchronized void markDataEntry(Object source, String filename, HashCode node) {
    LedgerEntry entry = getOrCreateEntry(filename, node);
    entry.setDataSource(true);
    addToSource(source, entry);
  }

  @Override
  public synchronized void markHistoryEntry(Object source, String filename, HashCode node) {
    LedgerEntry entry = getOrCreateEntry(filename, node);
    entry.setHistorySource(true);
    addToSource(source, entry);
  }

  @Override
  public synchronized Collection<LedgerEntry> entriesFrom(Object source) {
    Set<LedgerEntry> marked = sources.get(source);
    return marked == null ? ImmutableList.of() : ImmutableList.copyOf(marked);
  }

  public synchronized @Nullable LedgerEntry getEntry(String filename, HashCode node) {
    return entries.get(new Key(filename, node));
  }

  public synchronized Collection<LedgerEntry> getEntries() {
    return ImmutableList.copyOf(entries.values());
  }

  private LedgerEntry getOrCreateEntry(String filename, HashCode node) {
    return entries.computeIfAbsent(new Key(filename, node), k -> new LedgerEntry(filename, node));
  }

  private void addToSource(Object source, LedgerEntry entry) {
    sources.computeIfAbsent(source, s -> new LinkedHashSet<>()).add(entry);
  }
}
