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

import com.google.common.base.Strings;
import com.google.devtools.common.options.OptionsBase;
import com.google.devtools.common.options.OptionsParser;
import com.google.devtools.common.options.OptionsParsingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import javax.naming.ConfigurationException;
import lombok.Data;
import lombok.extern.java.Log;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

@Data
@Log
public final class RemoteFileLogConfigs {
  private Store store = new Store();
  private Gc gc = new Gc();

  public static RemoteFileLogConfigs loadConfigs(Path configLocation) throws IOException {
    log.info("Loading configs from: " + configLocation);
    Yaml yaml = new Yaml(new Constructor(RemoteFileLogConfigs.class, new LoaderOptions()));
    RemoteFileLogConfigs configs;
    try (InputStream inputStream = Files.newInputStream(configLocation)) {
      configs = yaml.load(inputStream);
    }
    if (configs == null) {
      throw new IOException("Could not load configs from path: " + configLocation);
    }
    log.info(configs.toString());
    return configs;
  }

  public static RemoteFileLogConfigs loadConfigs(OptionsParser parser)
      throws ConfigurationException {
    StoreOptions options = parser.getOptions(StoreOptions.class);
    RemoteFileLogConfigs configs;
    try {
      configs = loadConfigs(getConfigurationPath(parser));
    } catch (IOException e) {
      log.severe("Could not parse yml configuration file." + e);
      throw new RuntimeException(e);
    }
    if (options != null) {
      if (!Strings.isNullOrEmpty(options.repoName)) {
        configs.getStore().setRepoName(options.repoName);
      }
      if (!Strings.isNullOrEmpty(options.cacheLimit)) {
        configs.getGc().setCacheLimit(options.cacheLimit);
      }
    }
    return configs;
  }

  public static OptionsParser getOptionsParser(
      Class<? extends OptionsBase> clazz, String[] args) {
    OptionsParser parser = OptionsParser.newOptionsParser(clazz);
    try {
      parser.parse(args);
    } catch (OptionsParsingException e) {
      log.severe("Could not parse options provided." + e);
      throw new RuntimeException(e);
    }
    return parser;
  }

  private static Path getConfigurationPath(OptionsParser parser) throws ConfigurationException {
    // source config from env variable
    if (!Strings.isNullOrEmpty(System.getenv("CONFIG_PATH"))) {
      return Paths.get(System.getenv("CONFIG_PATH"));
    }

    // source config from cli
    List<String> residue = parser.getResidue();
    if (residue.isEmpty()) {
      log.info("Usage: CONFIG_PATH");
      log.info(parser.describeOptions(Collections.emptyMap(), OptionsParser.HelpVerbosity.LONG));
      throw new ConfigurationException("A valid path to a configuration file must be provided.");
    }

    return Paths.get(residue.get(0));
  }
}
