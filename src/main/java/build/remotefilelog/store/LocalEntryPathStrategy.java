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

import com.google.common.hash.HashCode;
import java.nio.file.Path;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Layout of a store owned by a single repository: {@code <root>/<namehash>/<node>}. The root is
 * the repository's own data directory, so no repository partition or bucketing is needed.
 */
class LocalEntryPathStrategy implements EntryPathStrategy {
  private static final Pattern HASH = Pattern.compile("[0-9a-f]{40}");

  private final Path root;

  LocalEntryPathStrategy(Path root) {
    this.root = root;
  }

  @Override
  public Path getRoot() {
    return root;
  }

  @Override
  public Path getRepoCachePath() {
    return root;
  }

  @Override
  public String getKey(StoreKey key) {
    return key.nameHash() + "/" + key.node();
  }

  @Override
  public @Nullable HashedKey parseKey(Path path) {
    Path parent = path.getParent();
    if (parent == null
        || parent.getFileName() == null
        || !HASH.matcher(path.getFileName().toString()).matches()
        || !HASH.matcher(parent.getFileName().toString()).matches()) {
      return null;
    }
    return new HashedKey(
        HashCode.fromString(parent.getFileName().toString()),
        HashCode.fromString(path.getFileName().toString()));
  }
}
