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

package build.remotefilelog.common.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import build.remotefilelog.common.Size;
import com.google.devtools.common.options.OptionsParser;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import javax.naming.ConfigurationException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RemoteFileLogConfigsTest {
  private Path configPath;

  @Before
  public void setUp() throws Exception {
    // If a CONFIG_PATH env variable is set, it wins. We're not mocking env vars.
    assertThat(System.getenv("CONFIG_PATH")).isNull();
    configPath = Paths.get(getClass().getResource("test-config.yml").toURI());
  }

  @Test
  public void defaults() throws ConfigurationException {
    RemoteFileLogConfigs configs = new RemoteFileLogConfigs();

    assertThat(configs.getStore().isShared()).isTrue();
    assertThat(configs.getStore().getValidateCache()).isEqualTo("on");
    assertThat((Object) configs.getStore().getValidPath(Paths.get("/base")))
        .isEqualTo(Paths.get("/base/cache"));
    assertThat(configs.getGc().getCacheLimitBytes()).isEqualTo(Size.gbToBytes(1000));
    assertThat(configs.getGc().getRetention()).isEqualTo(Duration.ofHours(24));
    assertThat(configs.getGc().getExcludedDirectories()).containsExactly("packs");
    assertThat(configs.getGc().getRegistryFileName()).isEqualTo("repos");
  }

  @Test
  public void loadsYaml() throws Exception {
    RemoteFileLogConfigs configs = RemoteFileLogConfigs.loadConfigs(configPath);

    assertThat(configs.getStore().getPath()).isEqualTo("cache");
    assertThat(configs.getStore().getRepoName()).isEqualTo("fbsource");
    assertThat(configs.getStore().getValidateCache()).isEqualTo("strict");
    assertThat(configs.getStore().getValidateCacheLog()).isEqualTo("corruption.log");
    assertThat(configs.getStore().getCacheGroup()).isNull();
    assertThat(configs.getGc().getCacheLimitBytes()).isEqualTo(Size.mbToBytes(25));
    assertThat(configs.getGc().getRetention()).isEqualTo(Duration.ofHours(1));
    assertThat(configs.getGc().getExcludedDirectories()).containsExactly("packs", "manifests");
    // unset values keep their defaults
    assertThat(configs.getGc().getRegistryFileName()).isEqualTo("repos");
  }

  @Test
  public void commandLineOverridesYaml() throws Exception {
    OptionsParser parser =
        RemoteFileLogConfigs.getOptionsParser(
            StoreOptions.class,
            new String[] {configPath.toString(), "--repo_name=other", "--cache_limit=1 GB"});

    RemoteFileLogConfigs configs = RemoteFileLogConfigs.loadConfigs(parser);

    assertThat(configs.getStore().getRepoName()).isEqualTo("other");
    assertThat(configs.getGc().getCacheLimitBytes()).isEqualTo(Size.gbToBytes(1));
  }

  @Test
  public void configPathIsRequired() {
    OptionsParser parser =
        RemoteFileLogConfigs.getOptionsParser(StoreOptions.class, new String[0]);

    assertThrows(ConfigurationException.class, () -> RemoteFileLogConfigs.loadConfigs(parser));
  }

  @Test
  public void emptyStorePathIsInvalid() {
    Store store = new Store();
    store.setPath("");

    assertThrows(ConfigurationException.class, () -> store.getValidPath(Paths.get("/base")));
  }
}
