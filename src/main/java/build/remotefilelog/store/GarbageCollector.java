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

import static build.remotefilelog.common.io.Utils.stat;
import static build.remotefilelog.common.io.Utils.tryUnlink;
import static java.lang.String.format;

import build.remotefilelog.common.ProgressReporter;
import build.remotefilelog.common.ProgressReporter.Progress;
import build.remotefilelog.common.io.FileStatus;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * Reclaims space beneath a cache root in two tiers. Files that are neither protected by the keep
 * set nor accessed within the retention window are deleted outright. If the survivors still
 * exceed the size limit, they are evicted least recently accessed first until the cache fits;
 * membership in the keep set does not exempt a file from this second tier.
 *
 * <p>Other processes may read, write and delete beneath the root concurrently. A file that
 * disappears while it is being inspected or removed is logged and skipped; any other filesystem
 * failure aborts the sweep.
 */
@Log
public class GarbageCollector {
  private static final Counter removedFiles =
      Counter.build()
          .name("remotefilelog_gc_removed_files")
          .help("Number of cache files removed by garbage collection.")
          .register();
  private static final Gauge cacheSizeMetric =
      Gauge.build()
          .name("remotefilelog_cache_size_bytes")
          .help("Cache size after the last collection.")
          .register();

  private final Path root;
  private final long cacheLimitBytes;
  private final Duration retention;
  private final Set<String> excludedDirectories;
  private final String registryFileName;
  private final Clock clock;
  private final ProgressReporter progressReporter;

  public GarbageCollector(
      Path root,
      long cacheLimitBytes,
      Duration retention,
      Set<String> excludedDirectories,
      String registryFileName,
      Clock clock,
      ProgressReporter progressReporter) {
    this.root = root;
    this.cacheLimitBytes = cacheLimitBytes;
    this.retention = retention;
    this.excludedDirectories = ImmutableSet.copyOf(excludedDirectories);
    this.registryFileName = registryFileName;
    this.clock = clock;
    this.progressReporter = progressReporter;
  }

  /**
   * Sweep the cache.
   *
   * @param keepKeys '/' separated paths relative to the root that survive the first tier
   *     regardless of age
   */
  public GcResults gc(Set<String> keepKeys) throws IOException {
    return sweep(collect(), keepKeys);
  }

  /** Every file beneath the root that the collector owns, in walk order. */
  @VisibleForTesting
  List<Path> collect() throws IOException {
    ImmutableList.Builder<Path> files = ImmutableList.builder();
    Files.walkFileTree(
        root,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            // pack files belong to the repack subsystem
            if (!dir.equals(root) && excludedDirectories.contains(dir.getFileName().toString())) {
              return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!file.getFileName().toString().equals(registryFileName)) {
              files.add(file);
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
            if (e instanceof NoSuchFileException) {
              logRemovedByAnotherProcess(file);
              return FileVisitResult.CONTINUE;
            }
            throw e;
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException e) throws IOException {
            if (e instanceof NoSuchFileException) {
              logRemovedByAnotherProcess(dir);
            } else if (e != null) {
              throw e;
            }
            return FileVisitResult.CONTINUE;
          }
        });
    return files.build();
  }

  @VisibleForTesting
  GcResults sweep(Iterable<Path> files, Set<String> keepKeys) throws IOException {
    Instant limit = clock.instant().minus(retention);
    PriorityQueue<AccessEntry> queue = new PriorityQueue<>();
    long originalSize = 0;
    long size = 0;
    long count = 0;
    long removed = 0;
    long sequence = 0;

    try (Progress progress = progressReporter.start("removing unnecessary files", "files", 0)) {
      for (Path path : files) {
        progress.set(++count);
        FileStatus stat;
        try {
          stat = stat(path, /* followSymlinks= */ false);
        } catch (NoSuchFileException e) {
          logRemovedByAnotherProcess(path);
          continue;
        }
        originalSize += stat.getSize();

        Instant accessTime = stat.getLastAccessTime();
        if (keepKeys.contains(relativeKey(path)) || accessTime.isAfter(limit)) {
          queue.add(new AccessEntry(accessTime, path, stat.getSize(), sequence++));
          size += stat.getSize();
        } else if (unlink(path)) {
          removed++;
        }
      }
    }

    if (size > cacheLimitBytes) {
      long excess = size - cacheLimitBytes;
      try (Progress progress = progressReporter.start("enforcing cache limit", "bytes", excess)) {
        long evicted = 0;
        while (!queue.isEmpty() && size > cacheLimitBytes && size > 0) {
          AccessEntry entry = queue.poll();
          // gone either way, the space is no longer held
          unlink(entry.path());
          size -= entry.size();
          removed++;
          evicted += entry.size();
          progress.set(evicted);
        }
      }
    }

    removedFiles.inc(removed);
    cacheSizeMetric.set(size);
    GcResults results = new GcResults(count, removed, originalSize, size);
    log.log(Level.INFO, "finished: " + results);
    return results;
  }

  private String relativeKey(Path path) {
    return Joiner.on('/').join(root.relativize(path));
  }

  private boolean unlink(Path path) throws IOException {
    if (tryUnlink(path)) {
      return true;
    }
    logRemovedByAnotherProcess(path);
    return false;
  }

  private static void logRemovedByAnotherProcess(Path path) {
    log.log(Level.WARNING, format("file %s was removed by another process", path));
  }
}
