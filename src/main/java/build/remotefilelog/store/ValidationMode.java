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

import java.util.Locale;
import javax.annotation.Nullable;

/** How eagerly stored blobs are checked against the node their path promises. */
public enum ValidationMode {
  /** Never validate. */
  OFF,
  /** Validate blobs when they are read or written. */
  ON,
  /** Additionally validate during existence checks. */
  STRICT;

  /** Parse a configured mode; anything unrecognized falls back to {@link #ON}. */
  public static ValidationMode fromConfig(@Nullable String value) {
    if (value != null) {
      switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "off":
          return OFF;
        case "strict":
          return STRICT;
        default:
          break;
      }
    }
    return ON;
  }

  public boolean isEnabled() {
    return this != OFF;
  }
}
