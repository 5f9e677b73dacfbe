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

import static build.remotefilelog.common.io.Utils.formatIOError;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

import com.google.common.hash.HashCode;
import io.prometheus.client.Counter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * Checks that a blob record is complete and that the node in its footer is the node its path is
 * named for. Failing blobs are quarantined by renaming them with {@link #CORRUPT_SUFFIX}, which
 * takes them out of every later lookup while keeping them for inspection.
 */
@Log
class BlobValidator {
  static final String CORRUPT_SUFFIX = ".corrupt";

  private static final Counter corruptBlobs =
      Counter.build()
          .name("remotefilelog_corrupt_blobs")
          .help("Number of blobs quarantined after failing validation.")
          .register();

  @Nullable private final Path corruptionLog;

  BlobValidator(@Nullable Path corruptionLog) {
    this.corruptionLog = corruptionLog;
  }

  /**
   * Validate the blob at {@code path}, quarantining it on failure.
   *
   * @param action what the caller was doing, recorded in the corruption log
   * @return true if the blob is intact
   * @throws IOException if the blob could not be read
   */
  boolean validate(Path path, String action) throws IOException {
    byte[] data = Files.readAllBytes(path);
    if (isValid(data, path)) {
      return true;
    }
    quarantine(path, action);
    return false;
  }

  boolean isValid(byte[] data, Path path) {
    if (data.length == 0) {
      return false;
    }
    BlobHeader header;
    try {
      header = BlobHeaders.parse(data);
    } catch (MalformedBlobException e) {
      log.log(Level.FINE, format("%s: %s", path, e.getMessage()));
      return false;
    }
    if (data.length <= header.size()) {
      // truncated
      return false;
    }
    long nodeOffset = header.offset() + header.size();
    if (nodeOffset + StoreKey.NODE_BYTES > data.length) {
      return false;
    }
    byte[] node =
        Arrays.copyOfRange(data, (int) nodeOffset, (int) nodeOffset + StoreKey.NODE_BYTES);
    return path.getFileName().toString().equals(HashCode.fromBytes(node).toString());
  }

  /** Best effort: a blob that cannot be moved aside is still reported invalid to the caller. */
  void quarantine(Path path, String action) {
    corruptBlobs.inc();
    log.log(Level.WARNING, format("corrupt %s during %s", path, action));
    if (corruptionLog != null) {
      try {
        Files.write(
            corruptionLog,
            format("corrupt %s during %s\n", path, action).getBytes(UTF_8),
            CREATE,
            APPEND);
      } catch (IOException e) {
        log.log(
            Level.WARNING,
            format("could not record corruption in %s: %s", corruptionLog, formatIOError(e)));
      }
    }
    Path quarantined = path.resolveSibling(path.getFileName() + CORRUPT_SUFFIX);
    try {
      Files.move(path, quarantined, REPLACE_EXISTING);
    } catch (IOException e) {
      log.log(
          Level.WARNING,
          format("could not quarantine %s as %s: %s", path, quarantined, formatIOError(e)));
    }
  }
}
