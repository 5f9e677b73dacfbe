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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import jnr.posix.POSIX;
import jnr.posix.POSIXFactory;

/** Native posix calls for the few modes nio cannot express: umask and setgid. */
final class Posix {
  @SuppressWarnings("Guava")
  private static final Supplier<POSIX> posix = Suppliers.memoize(POSIXFactory::getNativePOSIX);

  private Posix() {}

  /** Only the default filesystem is backed by the process's native posix layer. */
  static boolean isNative(FileSystem fileSystem) {
    return fileSystem == FileSystems.getDefault()
        && fileSystem.supportedFileAttributeViews().contains("posix");
  }

  static POSIX get() {
    return posix.get();
  }
}
