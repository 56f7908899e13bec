/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libnfa.util;

/**
 * Short identifiers for patterns in log lines.
 *
 * <p>The compiler and the pattern cache log a hash instead of the pattern text, so log lines stay
 * short and patterns built from user data do not end up in logs. Equal pattern strings always
 * produce equal hashes, which makes a cache miss easy to correlate with its compilation.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

  private PatternHasher() {
    // Utility class
  }

  /**
   * Hex hash of a pattern string.
   *
   * @param pattern the pattern string
   * @return hex string such as {@code "7a3f2b1c"}, or {@code "null"}
   */
  public static String hash(String pattern) {
    if (pattern == null) {
      return "null";
    }
    return Integer.toHexString(pattern.hashCode());
  }

  /**
   * Hash followed by the pattern length in code points, e.g. {@code "7a3f2b1c/12cp"}.
   *
   * <p>Used where the length helps explain a failure, since compiler error positions are code
   * point indexes.
   *
   * @param pattern the pattern string
   * @return hash with length suffix, or {@code "null"}
   */
  public static String hashWithLength(String pattern) {
    if (pattern == null) {
      return "null";
    }
    return hash(pattern) + "/" + pattern.codePointCount(0, pattern.length()) + "cp";
  }
}
