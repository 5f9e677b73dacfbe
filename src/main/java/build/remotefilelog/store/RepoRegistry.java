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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

import build.remotefilelog.common.io.AtomicFileOutputStream;
import build.remotefilelog.common.io.EvenMoreFiles;
import build.remotefilelog.common.io.Umask;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.UserPrincipal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The list of repositories that consume a shared store, one path per line. Registration only ever
 * appends, relying on single line appends being atomic; duplicates are folded when the list is
 * read.
 */
public class RepoRegistry {
  @SuppressWarnings("OctalInteger")
  private static final int REGISTRY_UMASK = 0002;

  private final Path path;
  @Nullable private final UserPrincipal processOwner;

  public RepoRegistry(Path path, @Nullable UserPrincipal processOwner) {
    this.path = path;
    this.processOwner = processOwner;
  }

  public Path getPath() {
    return path;
  }

  /**
   * Record that the repository whose metadata lives at {@code repoPath} uses this store. The
   * registered path is the repository's working directory, the parent of {@code repoPath}.
   */
  public void markRepo(Path repoPath) throws IOException {
    Path repoRoot = repoPath.getParent() == null ? repoPath : repoPath.getParent();
    Files.write(path, (repoRoot + "\n").getBytes(UTF_8), CREATE, APPEND);

    // the creator opens the registry to the other users of the cache
    if (processOwner != null && processOwner.equals(Files.getOwner(path))) {
      EvenMoreFiles.setGroupWritablePerms(path);
    }
  }

  /** Registered repository paths, without blanks or repeats, in registration order. */
  public List<String> readRepos() throws IOException {
    List<String> lines;
    try {
      lines = Files.readAllLines(path, UTF_8);
    } catch (NoSuchFileException e) {
      return ImmutableList.of();
    }
    Set<String> repos = new LinkedHashSet<>();
    for (String line : lines) {
      if (!line.isEmpty()) {
        repos.add(line);
      }
    }
    return ImmutableList.copyOf(repos);
  }

  /** Replace the registry with {@code repos}, typically the entries that still exist. */
  public void rewrite(List<String> repos) throws IOException {
    StringBuilder content = new StringBuilder();
    for (String repo : repos) {
      content.append(repo).append('\n');
    }
    try (Umask umask = Umask.set(path.getFileSystem(), REGISTRY_UMASK);
        AtomicFileOutputStream out = new AtomicFileOutputStream(path, /* readOnly= */ false)) {
      out.write(content.toString().getBytes(UTF_8));
      out.onSuccess();
    }
  }
}
