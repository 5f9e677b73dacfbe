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
import java.nio.file.Path;
import javax.naming.ConfigurationException;
import lombok.Data;

@Data
public class Store {
  // cache root, resolved against the working directory
  private String path = "cache";

  // partition of a shared cache owned by this repository
  private String repoName = "";

  // false for a store private to one repository
  private boolean shared = true;

  // off | on | strict
  private String validateCache = "on";

  // optional, appended to for every quarantined blob
  private String validateCacheLog;

  // optional, group given to directories created in a shared cache
  private String cacheGroup;

  public Path getValidPath(Path root) throws ConfigurationException {
    if (Strings.isNullOrEmpty(path)) {
      throw new ConfigurationException("Store cache directory value in config missing");
    }
    return root.resolve(path);
  }
}
