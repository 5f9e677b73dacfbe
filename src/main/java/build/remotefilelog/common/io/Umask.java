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

package build.remotefilelog.common.io;

import java.nio.file.FileSystem;
import javax.annotation.Nullable;

/**
 * A process umask applied for the lifetime of a try-with-resources block.
 *
 * <pre>{@code
 * try (Umask umask = Umask.set(root.getFileSystem(), 0002)) {
 *   // create group writable files
 * }
 * }</pre>
 *
 * <p>The umask is process-wide; the previous value is restored on close regardless of how the
 * block exits. Filesystems not backed by the native posix layer ignore the request.
 */
public final class Umask implements AutoCloseable {
  @Nullable private final Integer previous;

  private Umask(@Nullable Integer previous) {
    this.previous = previous;
  }

  public static Umask set(FileSystem fileSystem, int mask) {
    if (!Posix.isNative(fileSystem)) {
      return new Umask(null);
    }
    return new Umask(Posix.get().umask(mask));
  }

  @Override
  public void close() {
    if (previous != null) {
      Posix.get().umask(previous);
    }
  }
}
