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

import build.remotefilelog.common.LoggingProgressReporter;
import build.remotefilelog.common.config.RemoteFileLogConfigs;
import build.remotefilelog.common.config.StoreOptions;
import build.remotefilelog.store.RemoteFileStore;
import build.remotefilelog.store.RemoteFileStore.VerifyResults;
import com.google.devtools.common.options.OptionsParser;
import java.nio.file.Paths;

// Validates every entry of one repository's store, quarantining the corrupt ones.
class Verify {
  public static void main(String[] args) throws Exception {
    OptionsParser parser = RemoteFileLogConfigs.getOptionsParser(StoreOptions.class, args);
    RemoteFileLogConfigs configs = RemoteFileLogConfigs.loadConfigs(parser);
    RemoteFileStore store =
        RemoteFileStore.create(
            Paths.get("").toAbsolutePath(),
            configs,
            new LoggingProgressReporter(/* interval= */ 10000));

    VerifyResults results = store.verify();
    System.out.println("Store: " + store.getRepoCachePath());
    System.out.println("Checked: " + results.checked());
    System.out.println("Corrupt: " + results.corrupt());
    if (results.corrupt() > 0) {
      System.exit(1);
    }
  }
}
