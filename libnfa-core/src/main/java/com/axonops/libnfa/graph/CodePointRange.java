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

package com.axonops.libnfa.graph;

/**
 * Inclusive range of code points used by character classes.
 *
 * @param low first code point in the range
 * @param high last code point in the range (must be {@code >= low})
 * @since 1.0.0
 */
public record CodePointRange(int low, int high) {

  public CodePointRange {
    if (low > high) {
      throw new IllegalArgumentException(
          "low (" + low + ") must not exceed high (" + high + ")");
    }
  }

  public boolean contains(int codePoint) {
    return low <= codePoint && codePoint <= high;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .appendCodePoint(low)
        .append('-')
        .appendCodePoint(high)
        .toString();
  }
}
