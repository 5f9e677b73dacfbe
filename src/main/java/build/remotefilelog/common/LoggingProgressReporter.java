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

package build.remotefilelog.common;

import static java.lang.String.format;

import java.util.logging.Level;
import lombok.extern.java.Log;

/** Logs progress at a fixed value interval, and once more when the topic completes. */
@Log
public class LoggingProgressReporter implements ProgressReporter {
  private final long interval;

  public LoggingProgressReporter(long interval) {
    this.interval = interval;
  }

  @Override
  public Progress start(String topic, String unit, long total) {
    return new Progress() {
      private long value = 0;
      private long lastLogged = 0;

      @Override
      public void set(long value) {
        this.value = value;
        if (value - lastLogged >= interval) {
          lastLogged = value;
          log.log(Level.INFO, describe());
        }
      }

      @Override
      public void close() {
        log.log(Level.INFO, describe() + " done");
      }

      private String describe() {
        if (total > 0) {
          return format("%s: %d/%d %s", topic, value, total, unit);
        }
        return format("%s: %d %s", topic, value, unit);
      }
    };
  }
}
