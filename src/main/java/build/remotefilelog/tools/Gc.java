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

package build.remotefilelog.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import build.remotefilelog.common.LoggingProgressReporter;
import build.remotefilelog.common.ProgressReporter;
import build.remotefilelog.common.Size;
import build.remotefilelog.common.config.RemoteFileLogConfigs;
import build.remotefilelog.common.config.StoreOptions;
import build.remotefilelog.common.io.Utils;
import build.remotefilelog.store.DirectoryCompactor;
import build.remotefilelog.store.DirectoryCompactor.CompactionResults;
import build.remotefilelog.store.GarbageCollector;
import build.remotefilelog.store.GcResults;
import build.remotefilelog.store.RepoRegistry;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.devtools.common.options.OptionsParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.java.Log;

// Sweeps a shared cache: forgets repositories that no longer exist, expires and evicts entries,
// then prunes what the sweep left empty.
@Log
class Gc {
  record Results(int repos, GcResults gc, int removedDirectories, int removedBackups) {}

  static Results run(
      Path root,
      RemoteFileLogConfigs configs,
      Set<String> keepKeys,
      Clock clock,
      ProgressReporter progressReporter)
      throws IOException {
    build.remotefilelog.common.config.Gc config = configs.getGc();
    RepoRegistry registry =
        new RepoRegistry(root.resolve(config.getRegistryFileName()), /* processOwner= */ null);
    List<String> repos = registry.readRepos();
    ImmutableList.Builder<String> validRepos = ImmutableList.builder();
    for (String repo : repos) {
      if (Files.isDirectory(root.getFileSystem().getPath(repo))) {
        validRepos.add(repo);
      } else {
        log.fine("forgetting repository " + repo);
      }
    }
    List<String> remaining = validRepos.build();
    if (Files.exists(registry.getPath())) {
      registry.rewrite(remaining);
    }

    Set<String> excluded = ImmutableSet.copyOf(config.getExcludedDirectories());
    GarbageCollector collector =
        new GarbageCollector(
            root,
            config.getCacheLimitBytes(),
            config.getRetention(),
            excluded,
            config.getRegistryFileName(),
            clock,
            progressReporter);
    GcResults results = collector.gc(keepKeys);

    DirectoryCompactor compactor = new DirectoryCompactor();
    int removedDirectories = 0;
    int removedBackups = 0;
    for (Path child : Utils.listDir(root)) {
      if (Files.isDirectory(child) && !excluded.contains(child.getFileName().toString())) {
        CompactionResults compaction = compactor.cleanup(child);
        removedDirectories += compaction.removedDirectories();
        removedBackups += compaction.removedBackups();
      }
    }
    return new Results(remaining.size(), results, removedDirectories, removedBackups);
  }

  static Set<String> readKeepKeys(String keepKeysPath) throws IOException {
    if (Strings.isNullOrEmpty(keepKeysPath)) {
      return ImmutableSet.of();
    }
    ImmutableSet.Builder<String> keys = ImmutableSet.builder();
    for (String line : Files.readAllLines(Paths.get(keepKeysPath), UTF_8)) {
      String key = line.trim();
      if (!key.isEmpty()) {
        keys.add(key);
      }
    }
    return keys.build();
  }

  public static void main(String[] args) throws Exception {
    OptionsParser parser = RemoteFileLogConfigs.getOptionsParser(StoreOptions.class, args);
    StoreOptions options = parser.getOptions(StoreOptions.class);
    if (options.help) {
      System.out.println("Usage: Gc <config.yml> [--keep_keys=<file>] [--cache_limit=<size>]");
      System.out.println(
          parser.describeOptions(Collections.emptyMap(), OptionsParser.HelpVerbosity.LONG));
      return;
    }
    RemoteFileLogConfigs configs = RemoteFileLogConfigs.loadConfigs(parser);
    Path root = configs.getStore().getValidPath(Paths.get("").toAbsolutePath());

    Results results =
        run(
            root,
            configs,
            readKeepKeys(options.keepKeys),
            Clock.systemUTC(),
            new LoggingProgressReporter(/* interval= */ 10000));

    System.out.println("Repositories: " + results.repos());
    System.out.println(
        "Files: removed " + results.gc().removed() + " of " + results.gc().examined());
    System.out.printf(
        Locale.ROOT,
        "Size: %.2f GB to %.2f GB%n",
        Size.bytesToGbFraction(results.gc().originalSize()),
        Size.bytesToGbFraction(results.gc().finalSize()));
    System.out.println("Directories removed: " + results.removedDirectories());
    System.out.println("Backups removed: " + results.removedBackups());
  }
}
