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

import static com.google.common.base.Preconditions.checkState;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * An output stream that atomically presents a target file only on successful close.
 *
 * <p>Writes are performed to a temporary sibling file with a unique UUID suffix. On successful
 * close(), the temporary file is renamed over the target, so readers observe either the previous
 * content or the complete new content, never a partial write.
 *
 * <pre>{@code
 * try (AtomicFileOutputStream out = new AtomicFileOutputStream(target, true)) {
 *   out.write(data);
 *   out.onSuccess();
 * }
 * }</pre>
 *
 * Note: This resource must be told, prior to the close block, that it was successfully completed.
 * If success is not indicated with an 'onSuccess' call at the time of the first close call, the
 * temp file will be deleted and no interaction with the target will occur.
 *
 * <p>No thread safety of onSuccess() and close() is guaranteed.
 */
public class AtomicFileOutputStream extends FilterOutputStream {
  private final Path target;
  private final Path temp;
  private final boolean readOnly;
  private boolean closed = false;
  private boolean success = false;

  private static Path createSiblingRandomUUIDTemp(Path target) {
    String suffix = UUID.randomUUID().toString();
    String filename = target.getFileName().toString();
    return target.resolveSibling(filename + ".tmp." + suffix);
  }

  /**
   * Creates an AtomicFileOutputStream for the specified target path.
   *
   * @param target the final destination path for the file
   * @param readOnly whether the presented file should be read-only
   * @throws IOException if the temporary file cannot be created
   */
  public AtomicFileOutputStream(Path target, boolean readOnly) throws IOException {
    this(target, createSiblingRandomUUIDTemp(target), readOnly);
  }

  private AtomicFileOutputStream(Path target, Path temp, boolean readOnly) throws IOException {
    super(Files.newOutputStream(temp, CREATE_NEW, WRITE));
    checkState(!target.equals(temp));
    this.target = target;
    this.temp = temp;
    this.readOnly = readOnly;
  }

  public void onSuccess() {
    success = true;
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    out.write(b, off, len);
  }

  /**
   * Closes the stream and renames the temporary file over the target.
   *
   * <p>The temporary file is always deleted, even if an error occurs during the rename.
   *
   * @throws IOException if an error occurs during the rename
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;

    try {
      super.close();
      if (success) {
        if (readOnly) {
          EvenMoreFiles.setReadOnlyPerms(temp);
        } else {
          EvenMoreFiles.setGroupWritablePerms(temp);
        }
        Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
