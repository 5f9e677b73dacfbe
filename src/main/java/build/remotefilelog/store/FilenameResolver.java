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

import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashCode;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * Recovers the file names behind name hashes found in a store. The newest manifest resolves most
 * names in one pass; whatever remains is looked for in the names touched by each change, newest
 * first, until every hash is resolved or history runs out. Hashes that are never seen are left out
 * of the result.
 */
@Log
public class FilenameResolver {
  private final RepositoryHistory history;

  public FilenameResolver(RepositoryHistory history) {
    this.history = history;
  }

  public Map<HashCode, String> resolve(Set<HashCode> nameHashes) {
    if (nameHashes.isEmpty()) {
      return ImmutableMap.of();
    }
    Map<HashCode, String> filenames = new HashMap<>();
    Set<HashCode> missing = new HashSet<>(nameHashes);

    for (String filename : history.latestManifest()) {
      match(filename, missing, filenames);
    }

    if (missing.isEmpty()) {
      return filenames;
    }

    Iterator<? extends Iterable<String>> changes = history.changesNewestFirst().iterator();
    while (!missing.isEmpty() && changes.hasNext()) {
      for (String filename : changes.next()) {
        match(filename, missing, filenames);
      }
    }

    if (!missing.isEmpty()) {
      log.log(Level.FINE, format("could not resolve %d file names", missing.size()));
    }
    return filenames;
  }

  private static void match(String filename, Set<HashCode> missing, Map<HashCode, String> found) {
    HashCode nameHash = StoreKey.hashName(filename);
    if (missing.remove(nameHash)) {
      found.put(nameHash, filename);
    }
  }
}
