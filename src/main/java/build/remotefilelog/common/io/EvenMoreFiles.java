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

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import javax.annotation.Nullable;

/** Named in the theme of Files (nio) -> MoreFiles (guava) -> EvenMoreFiles */
public class EvenMoreFiles {
  private static final Set<PosixFilePermission> readOnlyPerms =
      PosixFilePermissions.fromString("r--r--r--");
  private static final Set<PosixFilePermission> groupWritablePerms =
      PosixFilePermissions.fromString("rw-rw-r--");
  private static final Set<PosixFilePermission> groupWritableDirPerms =
      PosixFilePermissions.fromString("rwxrwxr-x");

  @SuppressWarnings("OctalInteger")
  private static final int STICKY_GROUP_DIR_MODE = 02775;

  private static boolean isPosix(Path path) {
    return path.getFileSystem().supportedFileAttributeViews().contains("posix");
  }

  public static void setReadOnlyPerms(Path path) throws IOException {
    if (isPosix(path)) {
      Files.setPosixFilePermissions(path, readOnlyPerms);
    } else {
      // windows, we hope
      Files.setAttribute(path, "dos:readonly", true, LinkOption.NOFOLLOW_LINKS);
    }
  }

  public static void setGroupWritablePerms(Path path) throws IOException {
    if (isPosix(path)) {
      Files.setPosixFilePermissions(path, groupWritablePerms);
    }
  }

  /**
   * Create a directory and any missing parents so that every user of a shared cache can add
   * entries to them. Directories created by this call are made group writable with the setgid bit
   * where the platform supports it, and handed to {@code group} when one is given. Directories that
   * already exist are left alone, they may belong to another user.
   */
  public static void createStickyGroupDirectories(Path dir, @Nullable GroupPrincipal group)
      throws IOException {
    Deque<Path> missing = new ArrayDeque<>();
    for (Path path = dir; path != null && !Files.isDirectory(path); path = path.getParent()) {
      missing.push(path);
    }
    while (!missing.isEmpty()) {
      Path path = missing.pop();
      try {
        Files.createDirectory(path);
      } catch (FileAlreadyExistsException e) {
        // another writer created it first
        continue;
      }
      if (group != null && isPosix(path)) {
        Files.getFileAttributeView(path, PosixFileAttributeView.class).setGroup(group);
      }
      setStickyGroupPerms(path);
    }
  }

  private static void setStickyGroupPerms(Path dir) throws IOException {
    if (Posix.isNative(dir.getFileSystem())) {
      if (Posix.get().chmod(dir.toString(), STICKY_GROUP_DIR_MODE) < 0) {
        throw new IOException("could not set group permissions on " + dir);
      }
    } else if (isPosix(dir)) {
      Files.setPosixFilePermissions(dir, groupWritableDirPerms);
    }
  }
}
