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

import static build.remotefilelog.store.Blobs.blob;
import static build.remotefilelog.store.Blobs.node;
import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import build.remotefilelog.common.ProgressReporter;
import build.remotefilelog.common.ProgressReporter.Progress;
import build.remotefilelog.repack.LedgerEntry;
import build.remotefilelog.repack.MemoryLedger;
import build.remotefilelog.repack.RepackOptions;
import build.remotefilelog.store.DirectoryCompactor.CompactionResults;
import build.remotefilelog.store.RemoteFileStore.VerifyResults;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.HashCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RemoteFileStoreTest {
  private static final StoreKey FOO = new StoreKey("dir/foo.txt", node('a'));
  private static final StoreKey BAR = new StoreKey("dir/bar.txt", node('b'));

  private Path root;
  private Path corruptionLog;

  @Before
  public void setUp() {
    root = Blobs.newRoot().resolve("cache");
    corruptionLog = root.getRoot().resolve("corruption.log");
  }

  private RemoteFileStore newStore(ValidationMode mode) throws IOException {
    return newStore(mode, ProgressReporter.NOOP, /* shared= */ true);
  }

  private RemoteFileStore newStore(ValidationMode mode, ProgressReporter reporter, boolean shared)
      throws IOException {
    RemoteFileStore store =
        new RemoteFileStore(
            root,
            "repo",
            shared,
            mode,
            corruptionLog,
            /* cacheGroup= */ null,
            /* processOwner= */ null,
            "repos",
            reporter);
    store.initialize();
    return store;
  }

  private void writeRaw(RemoteFileStore store, StoreKey key, byte[] data) throws IOException {
    Path path = store.getPath(key);
    Files.createDirectories(path.getParent());
    Files.write(path, data);
  }

  @Test
  public void sharedKeysNestUnderRepoAndNameHash() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    String nameHash = StoreKey.hashName("dir/foo.txt").toString();

    assertThat(store.getKey(FOO))
        .isEqualTo(
            "repo/" + nameHash.substring(0, 2) + "/" + nameHash.substring(2) + "/" + FOO.node());
    assertThat((Object) store.getPath(FOO)).isEqualTo(root.resolve(store.getKey(FOO)));
    assertThat(Files.isDirectory(store.getRepoCachePath())).isTrue();
  }

  @Test
  public void getMissingReportsUnwrittenKeysUntilAdded() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);

    assertThat(store.getMissing(ImmutableList.of(FOO, BAR))).containsExactly(FOO, BAR).inOrder();

    store.addBlob(FOO, blob("foo", FOO.node()));

    assertThat(store.getMissing(ImmutableList.of(BAR, FOO))).containsExactly(BAR);
    assertThat(store.lookup(FOO).isFound()).isTrue();
  }

  @Test
  public void getMissingPreservesRequestOrder() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    StoreKey baz = new StoreKey("baz", node('c'));
    store.addBlob(BAR, blob("bar", BAR.node()));

    assertThat(store.getMissing(ImmutableList.of(baz, BAR, FOO)))
        .containsExactly(baz, FOO)
        .inOrder();
  }

  @Test
  public void getMissingReportsProgress() throws IOException {
    ProgressReporter reporter = mock(ProgressReporter.class);
    Progress progress = mock(Progress.class);
    when(reporter.start(eq("discovering"), eq("files"), anyLong())).thenReturn(progress);
    RemoteFileStore store = newStore(ValidationMode.ON, reporter, /* shared= */ true);

    store.getMissing(ImmutableList.of(FOO, BAR));

    verify(reporter).start("discovering", "files", 2);
    verify(progress).set(2);
    verify(progress).close();
  }

  @Test
  public void zeroLengthEntryIsMissing() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    writeRaw(store, FOO, new byte[0]);

    assertThat(store.getMissing(ImmutableList.of(FOO))).containsExactly(FOO);
    assertThat(store.read(FOO).status()).isEqualTo(BlobLookup.Status.MISSING);
    // absence is not corruption
    assertThat(Files.exists(store.getPath(FOO))).isTrue();
  }

  @Test
  public void strictLookupQuarantinesMismatchedFooter() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.STRICT);
    writeRaw(store, FOO, blob("foo", node('f')));

    assertThat(store.lookup(FOO).status()).isEqualTo(BlobLookup.Status.CORRUPT);
    assertThat(store.getMissing(ImmutableList.of(FOO))).containsExactly(FOO);
    Path path = store.getPath(FOO);
    assertThat(Files.exists(path)).isFalse();
    assertThat(Files.exists(path.resolveSibling(path.getFileName() + ".corrupt"))).isTrue();
    assertThat(Files.readAllLines(corruptionLog, UTF_8))
        .containsExactly("corrupt " + path + " during contains");
  }

  @Test
  public void onLookupDoesNotReadEntries() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    writeRaw(store, FOO, blob("foo", node('f')));

    assertThat(store.lookup(FOO).isFound()).isTrue();
    assertThat(Files.exists(store.getPath(FOO))).isTrue();
  }

  @Test
  public void readReturnsStoredBlob() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    byte[] data = blob("contents", FOO.node());
    store.addBlob(FOO, data);

    BlobLookup lookup = store.read(FOO);

    assertThat(lookup.status()).isEqualTo(BlobLookup.Status.FOUND);
    assertThat(lookup.getData()).isEqualTo(data);
  }

  @Test
  public void readQuarantinesCorruptBlob() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    writeRaw(store, FOO, blob("foo", node('f')));
    Path path = store.getPath(FOO);

    assertThat(store.read(FOO).status()).isEqualTo(BlobLookup.Status.CORRUPT);
    assertThat(Files.exists(path)).isFalse();
    assertThat(Files.exists(path.resolveSibling(path.getFileName() + ".corrupt"))).isTrue();
    assertThat(store.read(FOO).status()).isEqualTo(BlobLookup.Status.MISSING);
    assertThat(Files.readAllLines(corruptionLog, UTF_8))
        .containsExactly("corrupt " + path + " during read");
  }

  @Test
  public void readWithoutValidationReturnsAnything() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.OFF);
    byte[] data = blob("foo", node('f'));
    writeRaw(store, FOO, data);

    assertThat(store.read(FOO).getData()).isEqualTo(data);
  }

  @Test
  public void readOfTruncatedBlobIsCorrupt() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    writeRaw(store, FOO, BlobHeaders.format(100, 0));

    assertThat(store.read(FOO).status()).isEqualTo(BlobLookup.Status.CORRUPT);
  }

  @Test
  public void addBlobWritesReadOnlyEntry() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    store.addBlob(FOO, blob("foo", FOO.node()));

    assertThat(Files.getPosixFilePermissions(store.getPath(FOO)))
        .containsExactlyElementsIn(PosixFilePermissions.fromString("r--r--r--"));
    assertThat(Files.getPosixFilePermissions(store.getPath(FOO).getParent()))
        .contains(PosixFilePermission.GROUP_WRITE);
  }

  @Test
  public void addBlobTwiceKeepsOneBackupOfFirstVersion() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    byte[] first = blob("first", FOO.node());
    byte[] second = blob("second", FOO.node());
    byte[] third = blob("third", FOO.node());
    Path path = store.getPath(FOO);
    Path backup = path.resolveSibling(path.getFileName() + RemoteFileStore.BACKUP_SUFFIX);

    store.addBlob(FOO, first);
    store.addBlob(FOO, second);

    assertThat(Files.readAllBytes(path)).isEqualTo(second);
    assertThat(Files.readAllBytes(backup)).isEqualTo(first);
    try (Stream<Path> entries = Files.list(path.getParent())) {
      assertThat(entries.count()).isEqualTo(2);
    }

    store.addBlob(FOO, third);

    assertThat(Files.readAllBytes(path)).isEqualTo(third);
    assertThat(Files.readAllBytes(backup)).isEqualTo(second);
  }

  @Test
  public void corruptWriteIsFatal() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    Path path = store.getPath(FOO);

    CorruptWriteException e =
        assertThrows(CorruptWriteException.class, () -> store.addBlob(FOO, blob("foo", node('f'))));

    assertThat((Object) e.getPath()).isEqualTo(path);
    assertThat(e).hasMessageThat().isEqualTo("local cache write was corrupted " + path);
    assertThat(Files.exists(path)).isFalse();
    assertThat(Files.readAllLines(corruptionLog, UTF_8))
        .containsExactly("corrupt " + path + " during write");
  }

  @Test
  public void unvalidatedWriteAcceptsMismatch() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.OFF);

    store.addBlob(FOO, blob("foo", node('f')));

    assertThat(store.lookup(FOO).isFound()).isTrue();
  }

  @Test
  public void localStoreNestsByNameHash() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON, ProgressReporter.NOOP, false);
    store.addBlob(FOO, blob("foo", FOO.node()));

    assertThat((Object) store.getRepoCachePath()).isEqualTo(root);
    assertThat(store.getKey(FOO)).isEqualTo(FOO.nameHash() + "/" + FOO.node());
    assertThat(store.listKeys()).containsExactly(new HashedKey(FOO.nameHash(), FOO.node()));
  }

  @Test
  public void listKeysIgnoresBackupsAndStrays() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    store.addBlob(FOO, blob("first", FOO.node()));
    store.addBlob(FOO, blob("second", FOO.node()));
    store.addBlob(BAR, blob("bar", BAR.node()));
    Files.write(store.getRepoCachePath().resolve("stray"), new byte[] {1});

    assertThat(store.listKeys())
        .containsExactly(
            new HashedKey(FOO.nameHash(), FOO.node()), new HashedKey(BAR.nameHash(), BAR.node()));
  }

  @Test
  public void listKeysOfEmptyStore() throws IOException {
    RemoteFileStore store =
        new RemoteFileStore(
            root,
            "never-initialized",
            /* shared= */ true,
            ValidationMode.ON,
            null,
            null,
            null,
            "repos",
            ProgressReporter.NOOP);

    assertThat(store.listKeys()).isEmpty();
  }

  @Test
  public void getFilesGroupsResolvedNodes() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    StoreKey foo2 = new StoreKey(FOO.name(), node('c'));
    StoreKey orphan = new StoreKey("deleted/long/ago", node('d'));
    for (StoreKey key : ImmutableList.of(FOO, foo2, BAR, orphan)) {
      store.addBlob(key, blob(key.name(), key.node()));
    }

    Map<String, List<HashCode>> files = store.getFiles(history(FOO.name(), BAR.name()));

    assertThat(files.keySet()).containsExactly(FOO.name(), BAR.name());
    assertThat(files.get(FOO.name())).containsExactly(FOO.node(), foo2.node());
    assertThat(files.get(BAR.name())).containsExactly(BAR.node());
  }

  @Test
  public void markLedgerOffersEveryResolvedEntry() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    store.addBlob(FOO, blob("foo", FOO.node()));
    MemoryLedger ledger = new MemoryLedger();

    store.markLedger(ledger, RepackOptions.DEFAULT, history(FOO.name()));

    LedgerEntry entry = ledger.getEntry(FOO.name(), FOO.node());
    assertThat(entry).isNotNull();
    assertThat(entry.isDataSource()).isTrue();
    assertThat(entry.isHistorySource()).isTrue();
    assertThat(ledger.entriesFrom(store)).containsExactly(entry);
  }

  @Test
  public void markLedgerSkipsPacksOnlyAndLocalStores() throws IOException {
    RemoteFileStore shared = newStore(ValidationMode.ON);
    shared.addBlob(FOO, blob("foo", FOO.node()));
    RemoteFileStore local = newStore(ValidationMode.ON, ProgressReporter.NOOP, false);
    local.addBlob(BAR, blob("bar", BAR.node()));
    MemoryLedger ledger = new MemoryLedger();

    shared.markLedger(ledger, new RepackOptions(/* packsOnly= */ true), history(FOO.name()));
    local.markLedger(ledger, RepackOptions.DEFAULT, history(BAR.name()));

    assertThat(ledger.getEntries()).isEmpty();
  }

  @Test
  public void cleanupRemovesReclaimableEntriesAndCompacts() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    StoreKey kept = new StoreKey("kept", node('c'));
    StoreKey halfRepacked = new StoreKey("half", node('d'));
    for (StoreKey key : ImmutableList.of(FOO, BAR, kept, halfRepacked)) {
      store.addBlob(key, blob(key.name(), key.node()));
    }
    MemoryLedger ledger = new MemoryLedger();
    store.markLedger(
        ledger,
        RepackOptions.DEFAULT,
        history(FOO.name(), BAR.name(), kept.name(), halfRepacked.name()));
    ledger.getEntry(FOO.name(), FOO.node()).setGced(true);
    ledger.getEntry(BAR.name(), BAR.node()).setDataRepacked(true);
    ledger.getEntry(BAR.name(), BAR.node()).setHistoryRepacked(true);
    ledger.getEntry(halfRepacked.name(), halfRepacked.node()).setDataRepacked(true);
    // another process got there first
    Files.delete(store.getPath(BAR));

    CompactionResults results = store.cleanup(ledger);

    assertThat(store.getMissing(ImmutableList.of(FOO, BAR, kept, halfRepacked)))
        .containsExactly(FOO, BAR)
        .inOrder();
    assertThat(Files.exists(store.getPath(FOO).getParent())).isFalse();
    assertThat(Files.exists(store.getPath(BAR).getParent().getParent())).isFalse();
    assertThat(results.removedDirectories()).isEqualTo(4);
  }

  @Test
  public void markRepoRegistersParentOfRepoPath() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);

    store.markRepo(root.getRoot().resolve("src/fbsource/.hg"));

    assertThat((Object) store.getRegistry().getPath()).isEqualTo(root.resolve("repos"));
    assertThat(store.getRegistry().readRepos()).containsExactly("/src/fbsource");
  }

  @Test
  public void verifyQuarantinesCorruptEntries() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    store.addBlob(FOO, blob("foo", FOO.node()));
    writeRaw(store, BAR, blob("bar", node('f')));
    StoreKey empty = new StoreKey("empty", node('c'));
    writeRaw(store, empty, new byte[0]);

    VerifyResults results = store.verify();

    assertThat(results).isEqualTo(new VerifyResults(2, 1));
    assertThat(store.getMissing(ImmutableList.of(FOO, BAR))).containsExactly(BAR);
  }

  @Test
  public void garbageCollectorSkipsRegistry() throws IOException {
    RemoteFileStore store = newStore(ValidationMode.ON);
    store.addBlob(FOO, blob("foo", FOO.node()));
    store.markRepo(root.getRoot().resolve("src/repo/.hg"));

    GarbageCollector collector =
        store.newGarbageCollector(
            /* cacheLimitBytes= */ 0, Duration.ZERO, ImmutableSet.of("packs"), Clock.systemUTC());

    assertThat(collector.collect()).containsExactly(store.getPath(FOO));
  }

  private static RepositoryHistory history(String... manifest) {
    return new RepositoryHistory() {
      @Override
      public Iterable<String> latestManifest() {
        return ImmutableList.copyOf(manifest);
      }

      @Override
      public Iterable<? extends Iterable<String>> changesNewestFirst() {
        return ImmutableList.of();
      }
    };
  }
}
