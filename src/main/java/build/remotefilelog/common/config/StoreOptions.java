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

import com.google.devtools.common.options.Option;
import com.google.devtools.common.options.OptionsBase;

/** Command-line options shared by the store tools. */
public class StoreOptions extends OptionsBase {
  @Option(name = "help", abbrev = 'h', help = "Prints usage info.", defaultValue = "false")
  public boolean help;

  @Option(
      name = "repo_name",
      help = "Repository partition of the shared cache, overrides store.repoName.",
      defaultValue = "")
  public String repoName;

  @Option(
      name = "cache_limit",
      help = "Size the cache is reduced to, e.g. \"10 GB\", overrides gc.cacheLimit.",
      defaultValue = "")
  public String cacheLimit;

  @Option(
      name = "keep_keys",
      help = "File listing store keys, one per line, that garbage collection must not expire.",
      defaultValue = "")
  public String keepKeys;
}
