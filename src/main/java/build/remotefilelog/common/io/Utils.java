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

import com.google.common.base.Strings;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.UserPrincipal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

public final class Utils {
  private Utils() {}

  enum IOErrorFormatter {
    AccessDeniedException("access denied"),
    DirectoryNotEmptyException("directory not empty"),
    FileSystemException(""),
    IOException(""),
    NoSuchFileException("no such file");

    private final String description;

    IOErrorFormatter(String description) {
      this.description = description;
    }

    String toString(IOException e) {
      if (description.isEmpty()) {
        return e.getMessage();
      }
      return String.format("%s: %s", e.getMessage(), description);
    }
  }

  public static String formatIOError(IOException e) {
    IOErrorFormatter formatter;
    try {
      formatter = IOErrorFormatter.valueOf(e.getClass().getSimpleName());
    } catch (IllegalArgumentException eUnknown) {
      formatter = IOErrorFormatter.valueOf("IOException");
    }
    return formatter.toString(e);
  }

  private static final LinkOption[] NO_LINK_OPTION = new LinkOption[0];
  // This isn't generally safe; we rely on the file system APIs not modifying the array.
  private static final LinkOption[] NOFOLLOW_LINKS_OPTION = {LinkOption.NOFOLLOW_LINKS};

  private static LinkOption[] linkOpts(boolean followSymlinks) {
    return followSymlinks ? NO_LINK_OPTION : NOFOLLOW_LINKS_OPTION;
  }

  public static List<Path> listDir(Path path) throws IOException {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(path)) {
      for (Path entry : stream) {
        files.add(entry);
      }
    }
    return files;
  }

  /**
   * Stat a path. Unlike a boolean existence check, a vanished path surfaces as {@link
   * NoSuchFileException} and every other failure keeps its own exception type, so callers can
   * tell a benign race from a real fault.
   */
  public static FileStatus stat(final Path path, final boolean followSymlinks) throws IOException {
    final BasicFileAttributes attributes =
        Files.readAttributes(path, BasicFileAttributes.class, linkOpts(followSymlinks));
    return new FileStatus() {
      @Override
      public boolean isFile() {
        return attributes.isRegularFile();
      }

      @Override
      public boolean isDirectory() {
        return attributes.isDirectory();
      }

      @Override
      public long getSize() {
        return attributes.size();
      }

      @Override
      public Instant getLastAccessTime() {
        return attributes.lastAccessTime().toInstant();
      }
    };
  }

  /** Stat a path, or null if it does not exist. Any other failure is thrown. */
  public static @Nullable FileStatus statIfFound(Path path, boolean followSymlinks)
      throws IOException {
    try {
      return stat(path, followSymlinks);
    } catch (NoSuchFileException e) {
      return null;
    }
  }

  /** Delete a file, clearing the read-only attribute first where the platform requires it. */
  public static void unlinkFile(Path path) throws IOException {
    if (!path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
      // windows, we hope: read-only files cannot be deleted
      Files.setAttribute(path, "dos:readonly", false, LinkOption.NOFOLLOW_LINKS);
    }
    Files.delete(path);
  }

  /**
   * Delete a file that may already have been removed by another process.
   *
   * @return true if this call removed the file
   */
  public static boolean tryUnlink(Path path) throws IOException {
    try {
      unlinkFile(path);
      return true;
    } catch (NoSuchFileException e) {
      return false;
    }
  }

  public static @Nullable UserPrincipal getUser(String userName, FileSystem fileSystem)
      throws IOException {
    if (Strings.isNullOrEmpty(userName)) {
      return null;
    }
    return fileSystem.getUserPrincipalLookupService().lookupPrincipalByName(userName);
  }

  public static @Nullable GroupPrincipal getGroup(String groupName, FileSystem fileSystem)
      throws IOException {
    if (Strings.isNullOrEmpty(groupName)) {
      return null;
    }
    return fileSystem.getUserPrincipalLookupService().lookupPrincipalByGroupName(groupName);
  }
}
