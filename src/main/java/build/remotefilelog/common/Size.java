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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;

/**
 * @class Size
 * @brief Utilities related to cache sizes.
 * @details Contains converters between byte units and a parser for human written sizes.
 */
public class Size {
  // longer suffixes first, "kb" must win over "b"
  private static final Map<String, Long> UNITS =
      ImmutableMap.<String, Long>builder()
          .put("kb", kbToBytes(1))
          .put("mb", mbToBytes(1))
          .put("gb", gbToBytes(1))
          .put("k", kbToBytes(1))
          .put("m", mbToBytes(1))
          .put("g", gbToBytes(1))
          .put("b", 1L)
          .build();

  /**
   * @brief Kb to bytes.
   * @param sizeKb Size in KB to convert.
   * @return The number of bytes converted from KB.
   */
  public static long kbToBytes(long sizeKb) {
    return sizeKb * 1024;
  }

  /**
   * @brief Mb to bytes.
   * @param sizeMb Size in MB to convert.
   * @return The number of bytes converted from MB.
   */
  public static long mbToBytes(long sizeMb) {
    return sizeMb * 1024 * 1024;
  }

  /**
   * @brief Gb to bytes.
   * @param sizeGb Size in GB to convert.
   * @return The number of bytes converted from GB.
   */
  public static long gbToBytes(long sizeGb) {
    return sizeGb * 1024 * 1024 * 1024;
  }

  /**
   * @brief Bytes to fractional gb.
   * @details Used for reporting, where whole gigabytes would round small caches to zero.
   * @param bytes Size in bytes to convert.
   * @return Size in GB converted from bytes.
   */
  public static double bytesToGbFraction(long bytes) {
    return bytes / 1024.0 / 1024.0 / 1024.0;
  }

  /**
   * @brief Parse a size such as "1000 GB", "1.5g", "512k" or "4096".
   * @details Units are case insensitive and may be separated from the number by whitespace. A
   *     value without a unit is a byte count.
   * @param value The configured size.
   * @return The number of bytes.
   * @throws IllegalArgumentException if the value cannot be parsed.
   */
  public static long parseBytes(String value) {
    if (Strings.isNullOrEmpty(value)) {
      throw new IllegalArgumentException("size value is empty");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    try {
      for (Map.Entry<String, Long> unit : UNITS.entrySet()) {
        if (normalized.endsWith(unit.getKey())) {
          String number =
              normalized.substring(0, normalized.length() - unit.getKey().length()).trim();
          return (long) (Double.parseDouble(number) * unit.getValue());
        }
      }
      return Long.parseLong(normalized);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("size value is not a byte quantity: " + value, e);
    }
  }
}
