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

import static java.nio.charset.StandardCharsets.US_ASCII;

import com.google.common.base.Splitter;
import com.google.common.primitives.Bytes;

/**
 * Codec for the header that precedes every blob record. Two generations are understood:
 *
 * <ul>
 *   <li>v0: the decimal content size, terminated by NUL
 *   <li>v1: {@code v1\n} followed by newline separated metadata lines, terminated by NUL, where
 *       {@code s<size>} is the content size and {@code f<flags>} the revision flags
 * </ul>
 */
public final class BlobHeaders {
  private static final String V1 = "v1\n";
  private static final String SIZE_KEY = "s";
  private static final String FLAGS_KEY = "f";

  private BlobHeaders() {}

  public static BlobHeader parse(byte[] data) throws MalformedBlobException {
    int index = Bytes.indexOf(data, (byte) 0);
    if (index < 0) {
      throw new MalformedBlobException("unexpected blob header: no terminator");
    }
    String header = new String(data, 0, index, US_ASCII);
    long size = -1;
    int flags = 0;
    try {
      if (header.startsWith("v")) {
        if (!header.startsWith(V1)) {
          throw new MalformedBlobException("unsupported blob header: " + header);
        }
        for (String line : Splitter.on('\n').split(header)) {
          if (line.startsWith(SIZE_KEY)) {
            size = Long.parseLong(line.substring(SIZE_KEY.length()));
          } else if (line.startsWith(FLAGS_KEY)) {
            flags = Integer.parseInt(line.substring(FLAGS_KEY.length()));
          }
        }
      } else {
        size = Long.parseLong(header);
      }
    } catch (NumberFormatException e) {
      throw new MalformedBlobException("unexpected blob header: illegal format", e);
    }
    if (size < 0) {
      throw new MalformedBlobException("unexpected blob header: no size found");
    }
    return new BlobHeader(index + 1, size, flags);
  }

  /** A v1 header for content of {@code size} bytes, including its terminator. */
  public static byte[] format(long size, int flags) {
    StringBuilder header = new StringBuilder(V1).append(SIZE_KEY).append(size);
    if (flags != 0) {
      header.append('\n').append(FLAGS_KEY).append(flags);
    }
    return header.append('\0').toString().getBytes(US_ASCII);
  }
}
