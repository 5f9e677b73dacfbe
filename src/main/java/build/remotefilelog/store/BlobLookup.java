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

import static com.google.common.base.Preconditions.checkState;

import java.nio.file.Path;
import javax.annotation.Nullable;

/**
 * The outcome of looking up or reading a key. Absence and corruption are ordinary outcomes, not
 * exceptions; both mean the caller should fetch the blob again.
 */
public record BlobLookup(Status status, Path path, @Nullable byte[] data) {
  public enum Status {
    FOUND,
    MISSING,
    CORRUPT
  }

  static BlobLookup found(Path path, @Nullable byte[] data) {
    return new BlobLookup(Status.FOUND, path, data);
  }

  static BlobLookup missing(Path path) {
    return new BlobLookup(Status.MISSING, path, null);
  }

  static BlobLookup corrupt(Path path) {
    return new BlobLookup(Status.CORRUPT, path, null);
  }

  public boolean isFound() {
    return status == Status.FOUND;
  }

  /** The blob record, available only for reads that found the key. */
  public byte[] getData() {
    checkState(data != null, "no data for %s lookup of %s", status, path);
    return data;
  }
}
