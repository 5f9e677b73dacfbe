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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import com.google.common.hash.HashCode;
import java.nio.file.Path;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Layout of a cache shared by many repositories on a machine:
 * {@code <root>/<reponame>/<namehash[0:2]>/<namehash[2:]>/<node>}. Bucketing by the first byte of
 * the name hash keeps any single directory from collecting every file of a large repository.
 */
class SharedEntryPathStrategy implements EntryPathStrategy {
  private static final Pattern BUCKET = Pattern.compile("[0-9a-f]{2}");
  private static final Pattern BUCKET_REMAINDER = Pattern.compile("[0-9a-f]{38}");
  private static final Pattern NODE = Pattern.compile("[0-9a-f]{40}");

  private final Path root;
  private final String repoName;

  SharedEntryPathStrategy(Path root, String repoName) {
    checkArgument(!Strings.isNullOrEmpty(repoName), "shared stores require a repository name");
    this.root = root;
    this.repoName = repoName;
  }

  @Override
  public Path getRoot() {
    return root;
  }

  @Override
  public Path getRepoCachePath() {
    return root.resolve(repoName);
  }

  @Override
  public String getKey(StoreKey key) {
    String nameHash = key.nameHash().toString();
    return String.join(
        "/", repoName, nameHash.substring(0, 2), nameHash.substring(2), key.node().toString());
  }

  @Override
  public @Nullable HashedKey parseKey(Path path) {
    Path remainder = path.getParent();
    Path bucket = remainder == null ? null : remainder.getParent();
    if (bucket == null
        || !NODE.matcher(path.getFileName().toString()).matches()
        || !BUCKET_REMAINDER.matcher(remainder.getFileName().toString()).matches()
        || !BUCKET.matcher(bucket.getFileName().toString()).matches()) {
      return null;
    }
    return new HashedKey(
        HashCode.fromString(bucket.getFileName().toString() + remainder.getFileName()),
        HashCode.fromString(path.getFileName().toString()));
  }
}
