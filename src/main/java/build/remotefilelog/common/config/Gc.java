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

import build.remotefilelog.common.Size;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;
import lombok.Data;

@Data
public class Gc {
  private String cacheLimit = "1000 GB";

  // files accessed more recently than this survive regardless of the keep set
  private long retentionSeconds = 86400; // 24 hours

  private List<String> excludedDirectories = ImmutableList.of("packs");

  private String registryFileName = "repos";

  public long getCacheLimitBytes() {
    return Size.parseBytes(cacheLimit);
  }

  public Duration getRetention() {
    return Duration.ofSeconds(retentionSeconds);
  }
}
