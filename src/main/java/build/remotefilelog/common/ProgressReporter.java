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

/**
 * Receives counters during long walks over the store. Purely observational; implementations must
 * not influence the operation being reported.
 */
public interface ProgressReporter {
  ProgressReporter NOOP =
      (topic, unit, total) ->
          new Progress() {
            @Override
            public void set(long value) {}

            @Override
            public void close() {}
          };

  /**
   * Begin reporting a topic.
   *
   * @param topic what is being done, e.g. "discovering"
   * @param unit what is being counted, e.g. "files" or "bytes"
   * @param total the expected final value, or 0 when it is not known in advance
   */
  Progress start(String topic, String unit, long total);

  interface Progress extends AutoCloseable {
    void set(long value);

    @Override
    void close();
  }
}
