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
import static build.remotefilelog.common.io.Utils.listDir;
import static build.remotefilelog.common.io.Utils.statIfFound;
import static build.remotefilelog.common.io.Utils.tryUnlink;
import static java.lang.String.format;

import build.remotefilelog.common.io.FileStatus;
import com.google.common.collect.Sets;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * Tidies a store tree after entries have been removed: empty directories are pruned bottom up,
 * and backups left by the writer are removed once the entry they preserve is gone. The root
 * itself is never removed.
 */
@Log
public class DirectoryCompactor {
  public record CompactionResults(int removedDirectories, int removedBackups) {}

  private static final class Tally {
    int directories = 0;
    int backups = 0;
  }

  public CompactionResults cleanup(Path root) throws IOException {
    Tally tally = new Tally();
    cleanupDirectory(root, tally);
    log.log(
        Level.FINE,
        format(
            "compacted %s: removed %d directories and %d backups",
            root, tally.directories, tally.backups));
    return new CompactionResults(tally.directories, tally.backups);
  }

  private void cleanupDirectory(Path dir, Tally tally) throws IOException {
    List<Path> entries;
    try {
      entries = listDir(dir);
    } catch (NoSuchFileException e) {
      log.log(Level.FINE, format("directory %s was removed by another process", dir));
      return;
    }

    // only siblings within this directory decide whether a backup is orphaned
    Set<String> backups = new HashSet<>();
    Set<String> others = new HashSet<>();
    for (Path entry : entries) {
      FileStatus stat = statIfFound(entry, /* followSymlinks= */ false);
      if (stat == null) {
        // removed by another process since the listing
        continue;
      }
      if (stat.isDirectory()) {
        cleanupDirectory(entry, tally);
        if (tryRemoveDirectory(entry)) {
          tally.directories++;
        }
      } else if (stat.isFile()) {
        String name = entry.getFileName().toString();
        if (name.endsWith(RemoteFileStore.BACKUP_SUFFIX)) {
          backups.add(name.substring(0, name.length() - RemoteFileStore.BACKUP_SUFFIX.length()));
        } else {
          others.add(name);
        }
      }
    }

    for (String name : Sets.difference(backups, others)) {
      if (tryUnlink(dir.resolve(name + RemoteFileStore.BACKUP_SUFFIX))) {
        tally.backups++;
      }
    }
  }

  private static boolean tryRemoveDirectory(Path dir) {
    try {
      Files.delete(dir);
      return true;
    } catch (IOException e) {
      // still has entries, or lost a race with another process
      log.log(Level.FINEST, format("kept directory %s: %s", dir, formatIOError(e)));
      return false;
    }
  }
}
