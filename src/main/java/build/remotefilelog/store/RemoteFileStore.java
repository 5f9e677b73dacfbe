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

import static build.remotefilelog.common.io.EvenMoreFiles.createStickyGroupDirectories;
import static build.remotefilelog.common.io.Utils.formatIOError;
import static build.remotefilelog.common.io.Utils.stat;
import static build.remotefilelog.common.io.Utils.tryUnlink;
import static java.lang.String.format;

import build.remotefilelog.common.ProgressReporter;
import build.remotefilelog.common.ProgressReporter.Progress;
import build.remotefilelog.common.config.RemoteFileLogConfigs;
import build.remotefilelog.common.config.Store;
import build.remotefilelog.common.io.AtomicFileOutputStream;
import build.remotefilelog.common.io.FileStatus;
import build.remotefilelog.common.io.Umask;
import build.remotefilelog.common.io.Utils;
import build.remotefilelog.repack.Ledger;
import build.remotefilelog.repack.LedgerEntry;
import build.remotefilelog.repack.RepackOptions;
import build.remotefilelog.store.DirectoryCompactor.CompactionResults;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.SetMultimap;
import com.google.common.hash.HashCode;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.UserPrincipal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import javax.annotation.Nullable;
import javax.naming.ConfigurationException;
import lombok.extern.java.Log;

/**
 * A content addressed cache of remotefilelog blobs, kept as one file per file revision.
 *
 * <p>A shared store serves many repositories from one root, each beneath its own directory, and
 * may be used concurrently by several processes and users without any locking. A local store
 * belongs to a single repository. Every operation tolerates files disappearing underneath it;
 * only unexpected filesystem failures and writes that do not verify are raised.
 */
@Log
public class RemoteFileStore {
  public static final String BACKUP_SUFFIX = "_old";

  @SuppressWarnings("OctalInteger")
  private static final int CACHE_UMASK = 0002;

  public record VerifyResults(int checked, int corrupt) {}

  private final EntryPathStrategy entryPathStrategy;
  private final boolean shared;
  private final ValidationMode validationMode;
  private final BlobValidator validator;
  @Nullable private final GroupPrincipal cacheGroup;
  private final RepoRegistry registry;
  private final String registryFileName;
  private final ProgressReporter progressReporter;
  private final DirectoryCompactor compactor = new DirectoryCompactor();

  public RemoteFileStore(
      Path root,
      String repoName,
      boolean shared,
      ValidationMode validationMode,
      @Nullable Path corruptionLog,
      @Nullable GroupPrincipal cacheGroup,
      @Nullable UserPrincipal processOwner,
      String registryFileName,
      ProgressReporter progressReporter) {
    this.entryPathStrategy =
        shared ? new SharedEntryPathStrategy(root, repoName) : new LocalEntryPathStrategy(root);
    this.shared = shared;
    this.validationMode = validationMode;
    this.validator = new BlobValidator(corruptionLog);
    this.cacheGroup = cacheGroup;
    this.registry = new RepoRegistry(root.resolve(registryFileName), processOwner);
    this.registryFileName = registryFileName;
    this.progressReporter = progressReporter;
  }

  /**
   * Open the store described by {@code configs}, creating its directories as needed.
   *
   * @param base directory a relative store path is resolved against
   */
  public static RemoteFileStore create(
      Path base, RemoteFileLogConfigs configs, ProgressReporter progressReporter)
      throws ConfigurationException, IOException {
    Store config = configs.getStore();
    Path root = config.getValidPath(base);
    Path corruptionLog =
        config.getValidateCacheLog() == null ? null : base.resolve(config.getValidateCacheLog());
    RemoteFileStore store =
        new RemoteFileStore(
            root,
            config.getRepoName(),
            config.isShared(),
            ValidationMode.fromConfig(config.getValidateCache()),
            corruptionLog,
            Utils.getGroup(config.getCacheGroup(), root.getFileSystem()),
            processOwner(root),
            configs.getGc().getRegistryFileName(),
            progressReporter);
    store.initialize();
    return store;
  }

  @Nullable
  private static UserPrincipal processOwner(Path root) {
    try {
      return Utils.getUser(System.getProperty("user.name"), root.getFileSystem());
    } catch (IOException e) {
      log.log(Level.FINE, "could not look up the process owner: " + formatIOError(e));
      return null;
    }
  }

  /** Create the root and this repository's directory. */
  public void initialize() throws IOException {
    try (Umask umask = Umask.set(getRoot().getFileSystem(), CACHE_UMASK)) {
      createStickyGroupDirectories(getRepoCachePath(), cacheGroup);
    }
  }

  public Path getRoot() {
    return entryPathStrategy.getRoot();
  }

  public Path getRepoCachePath() {
    return entryPathStrategy.getRepoCachePath();
  }

  public RepoRegistry getRegistry() {
    return registry;
  }

  /** The key of {@code key} relative to the root, in the form garbage collection keeps. */
  public String getKey(StoreKey key) {
    return entryPathStrategy.getKey(key);
  }

  public Path getPath(StoreKey key) {
    return entryPathStrategy.getPath(key);
  }

  /**
   * Classify {@code key} without reading it, unless validation is strict. Never reports data.
   * Failures to stat are reported as missing.
   */
  public BlobLookup lookup(StoreKey key) {
    Path path = getPath(key);
    try {
      FileStatus stat = stat(path, /* followSymlinks= */ true);
      if (stat.getSize() == 0) {
        return BlobLookup.missing(path);
      }
      if (validationMode == ValidationMode.STRICT && !validator.validate(path, "contains")) {
        return BlobLookup.corrupt(path);
      }
      return BlobLookup.found(path, null);
    } catch (NoSuchFileException e) {
      return BlobLookup.missing(path);
    } catch (IOException e) {
      log.log(Level.WARNING, format("treating %s as missing: %s", path, formatIOError(e)));
      return BlobLookup.missing(path);
    }
  }

  /** The keys that are not usable from this store, in the order requested. */
  public List<StoreKey> getMissing(List<StoreKey> keys) {
    ImmutableList.Builder<StoreKey> missing = ImmutableList.builder();
    try (Progress progress = progressReporter.start("discovering", "files", keys.size())) {
      int count = 0;
      for (StoreKey key : keys) {
        if (!lookup(key).isFound()) {
          missing.add(key);
        }
        progress.set(++count);
      }
    }
    return missing.build();
  }

  /** Read the blob for {@code key}, quarantining it if it does not validate. */
  public BlobLookup read(StoreKey key) {
    Path path = getPath(key);
    byte[] data;
    try {
      data = Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      return BlobLookup.missing(path);
    } catch (IOException e) {
      log.log(Level.WARNING, format("treating %s as missing: %s", path, formatIOError(e)));
      return BlobLookup.missing(path);
    }
    if (data.length == 0) {
      return BlobLookup.missing(path);
    }
    if (validationMode.isEnabled() && !validator.isValid(data, path)) {
      validator.quarantine(path, "read");
      return BlobLookup.corrupt(path);
    }
    return BlobLookup.found(path, data);
  }

  /**
   * Store {@code data}, the complete blob including header and trailing node, as the entry for
   * {@code key}. An existing entry is preserved beside it with the backup suffix.
   *
   * @throws CorruptWriteException if validation is enabled and the written entry does not verify
   */
  public void addBlob(StoreKey key, byte[] data) throws IOException {
    Path path = getPath(key);
    try (Umask umask = Umask.set(path.getFileSystem(), CACHE_UMASK)) {
      if (Files.exists(path)) {
        backup(path);
      }

      createStickyGroupDirectories(path.getParent(), cacheGroup);

      try (AtomicFileOutputStream out = new AtomicFileOutputStream(path, /* readOnly= */ true)) {
        out.write(data);
        out.onSuccess();
      }

      if (validationMode.isEnabled() && !validator.validate(path, "write")) {
        throw new CorruptWriteException(path);
      }
    }
  }

  private void backup(Path path) throws IOException {
    Path backup = path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
    tryUnlink(backup);
    try (InputStream in = Files.newInputStream(path);
        AtomicFileOutputStream out = new AtomicFileOutputStream(backup, /* readOnly= */ true)) {
      ByteStreams.copy(in, out);
      out.onSuccess();
    } catch (NoSuchFileException e) {
      // the live entry was collected between the check and the copy
      log.log(Level.FINE, format("no backup of %s: removed by another process", path));
    }
  }

  /** Register the repository whose metadata lives at {@code repoPath} as a user of the store. */
  public void markRepo(Path repoPath) throws IOException {
    registry.markRepo(repoPath);
  }

  /** Every well formed entry beneath this repository's directory. */
  public List<HashedKey> listKeys() throws IOException {
    return ImmutableList.copyOf(walkKeys().values());
  }

  private Map<Path, HashedKey> walkKeys() throws IOException {
    Path repoCachePath = getRepoCachePath();
    Map<Path, HashedKey> keys = new LinkedHashMap<>();
    if (!Files.isDirectory(repoCachePath)) {
      return keys;
    }
    Files.walkFileTree(
        repoCachePath,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!file.getFileName().toString().equals(registryFileName)) {
              HashedKey key = entryPathStrategy.parseKey(file);
              if (key != null) {
                keys.put(file, key);
              }
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
            if (e instanceof NoSuchFileException) {
              return FileVisitResult.CONTINUE;
            }
            throw e;
          }
        });
    return keys;
  }

  /**
   * The entries of this repository grouped by file name. Entries whose name cannot be found in
   * {@code history} are left out.
   */
  public Map<String, List<HashCode>> getFiles(RepositoryHistory history) throws IOException {
    SetMultimap<HashCode, HashCode> nodesByNameHash = LinkedHashMultimap.create();
    for (HashedKey key : listKeys()) {
      nodesByNameHash.put(key.nameHash(), key.node());
    }
    Map<HashCode, String> filenames =
        new FilenameResolver(history).resolve(nodesByNameHash.keySet());

    Map<String, List<HashCode>> files = new LinkedHashMap<>();
    for (Map.Entry<HashCode, Set<HashCode>> entry :
        Multimaps.asMap(nodesByNameHash).entrySet()) {
      String filename = filenames.get(entry.getKey());
      if (filename != null) {
        files.put(filename, ImmutableList.copyOf(entry.getValue()));
      }
    }
    return files;
  }

  /** Offer every entry of a shared store to a repack as both data and history. */
  public void markLedger(Ledger ledger, RepackOptions options, RepositoryHistory history)
      throws IOException {
    if (options.packsOnly() || !shared) {
      return;
    }
    for (Map.Entry<String, List<HashCode>> file : getFiles(history).entrySet()) {
      for (HashCode node : file.getValue()) {
        ledger.markDataEntry(this, file.getKey(), node);
        ledger.markHistoryEntry(this, file.getKey(), node);
      }
    }
  }

  /** Remove the entries a repack has taken over or collected, then compact the store. */
  public CompactionResults cleanup(Ledger ledger) throws IOException {
    List<LedgerEntry> entries = new ArrayList<>(ledger.entriesFrom(this));
    try (Progress progress = progressReporter.start("cleaning up", "files", entries.size())) {
      int count = 0;
      for (LedgerEntry entry : entries) {
        if (entry.isReclaimable()) {
          Path path = getPath(new StoreKey(entry.getFilename(), entry.getNode()));
          if (!tryUnlink(path)) {
            log.log(Level.FINE, format("file %s was removed by another process", path));
          }
        }
        progress.set(++count);
      }
    }
    return compact();
  }

  /** Prune empty directories and orphaned backups beneath this repository's directory. */
  public CompactionResults compact() throws IOException {
    return compactor.cleanup(getRepoCachePath());
  }

  /** Validate every entry of this repository, quarantining those that fail. */
  public VerifyResults verify() throws IOException {
    Map<Path, HashedKey> keys = walkKeys();
    int checked = 0;
    int corrupt = 0;
    try (Progress progress = progressReporter.start("verifying", "files", keys.size())) {
      for (Path path : keys.keySet()) {
        try {
          if (Files.size(path) > 0) {
            checked++;
            if (!validator.validate(path, "verify")) {
              corrupt++;
            }
          }
        } catch (NoSuchFileException e) {
          log.log(Level.FINE, format("file %s was removed by another process", path));
        }
        progress.set(checked);
      }
    }
    return new VerifyResults(checked, corrupt);
  }

  /** A collector for the whole root, shared by every repository using it. */
  public GarbageCollector newGarbageCollector(
      long cacheLimitBytes, Duration retention, Set<String> excludedDirectories, Clock clock) {
    return new GarbageCollector(
        getRoot(),
        cacheLimitBytes,
        retention,
        excludedDirectories,
        registryFileName,
        clock,
        progressReporter);
  }
}
