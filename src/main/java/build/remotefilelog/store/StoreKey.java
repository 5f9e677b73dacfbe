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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

/** A file revision as requested by callers: the logical path and the revision's node. */
public record StoreKey(String name, HashCode node) {
  public static final int NODE_BYTES = 20;

  public StoreKey {
    checkNotNull(name);
    checkArgument(
        node.bits() == NODE_BYTES * 8, "node must be %s bytes: %s", NODE_BYTES, node);
  }

  public static StoreKey of(String name, String hexNode) {
    return new StoreKey(name, HashCode.fromString(hexNode));
  }

  /** The hash that stands in for a file name in the on-disk layout. */
  @SuppressWarnings("deprecation")
  public static HashCode hashName(String name) {
    return Hashing.sha1().hashString(name, UTF_8);
  }

  public HashCode nameHash() {
    return hashName(name);
  }

  @Override
  public String toString() {
    return name + ":" + node;
  }
}
