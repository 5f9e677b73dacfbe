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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.Iterables;
import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.GroupPrincipal;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermissions;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvenMoreFilesTest {
  private Path root;

  @Before
  public void setUp() {
    root =
        Iterables.getFirst(
            Jimfs.newFileSystem(
                    Configuration.unix().toBuilder()
                        .setAttributeViews("basic", "owner", "posix", "unix")
                        .build())
                .getRootDirectories(),
            null);
  }

  @Test
  public void createsOnlyMissingDirectories() throws IOException {
    Path existing = root.resolve("cache");
    Files.createDirectory(existing);
    Files.setPosixFilePermissions(existing, PosixFilePermissions.fromString("rwx------"));
    GroupPrincipal group =
        root.getFileSystem().getUserPrincipalLookupService().lookupPrincipalByGroupName("hg");

    EvenMoreFiles.createStickyGroupDirectories(existing.resolve("repo/aa"), group);

    for (Path created : new Path[] {existing.resolve("repo"), existing.resolve("repo/aa")}) {
      PosixFileAttributes attributes = Files.readAttributes(created, PosixFileAttributes.class);
      assertThat(attributes.isDirectory()).isTrue();
      assertThat(attributes.group().getName()).isEqualTo("hg");
      assertThat(attributes.permissions())
          .containsExactlyElementsIn(PosixFilePermissions.fromString("rwxrwxr-x"));
    }
    assertThat(Files.getPosixFilePermissions(existing))
        .containsExactlyElementsIn(PosixFilePermissions.fromString("rwx------"));
  }

  @Test
  public void existingDirectoryIsANoop() throws IOException {
    Path dir = root.resolve("dir");
    Files.createDirectory(dir);

    EvenMoreFiles.createStickyGroupDirectories(dir, /* group= */ null);

    assertThat(Files.isDirectory(dir)).isTrue();
  }

  @Test
  public void groupIsIgnoredWithoutPosixAttributes() throws IOException {
    Path windowsRoot =
        Iterables.getFirst(Jimfs.newFileSystem(Configuration.windows()).getRootDirectories(), null);
    GroupPrincipal group =
        root.getFileSystem().getUserPrincipalLookupService().lookupPrincipalByGroupName("hg");
    Path dir = windowsRoot.resolve("cache").resolve("repo");

    EvenMoreFiles.createStickyGroupDirectories(dir, group);

    assertThat(Files.isDirectory(dir)).isTrue();
  }
}
