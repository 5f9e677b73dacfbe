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
import javax.annotation.Nullable;

/** Maps keys to their location beneath a store root, and back. */
interface EntryPathStrategy {
  Path getRoot();

  /** The directory holding this store's entries, and nothing else's. */
  Path getRepoCachePath();

  /** The '/' separated path of a key relative to the root. */
  String getKey(StoreKey key);

  default Path getPath(StoreKey key) {
    return getRoot().resolve(getKey(key));
  }

  /** The inverse of {@link #getPath}, or null if {@code path} is not laid out like an entry. */
  @Nullable
  HashedKey parseKey(Path path);
}
