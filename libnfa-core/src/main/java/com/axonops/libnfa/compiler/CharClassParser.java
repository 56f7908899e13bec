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

package com.axonops.libnfa.compiler;

import com.axonops.libnfa.graph.CodePointRange;
import com.axonops.libnfa.graph.State;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the body of a bracketed character class (the text between {@code [} and {@code ]}).
 *
 * <p>Syntax:
 *
 * <ul>
 *   <li>a leading {@code ^} negates the class
 *   <li>{@code x-y} is the inclusive range from {@code x} to {@code y}
 *   <li>any other code point, including a {@code -} with no right endpoint, is a single member
 * </ul>
 *
 * <p>There is no escaping. A range whose left endpoint is above its right endpoint contains no
 * code point and is dropped.
 *
 * @since 1.0.0
 */
final class CharClassParser {
  private static final Logger logger = LoggerFactory.getLogger(CharClassParser.class);

  private CharClassParser() {
    // Utility class
  }

  /**
   * Builds a character class from its body.
   *
   * @param body code points between the brackets
   * @param from first body index (inclusive)
   * @param to last body index (exclusive)
   * @return the class node
   */
  static State.CharClass parse(int[] body, int from, int to) {
    boolean negated = false;
    int i = from;
    if (i < to && body[i] == '^') {
      negated = true;
      i++;
    }

    List<CodePointRange> ranges = new ArrayList<>();
    Set<Integer> singles = new HashSet<>();
    while (i < to) {
      if (i + 2 < to && body[i + 1] == '-') {
        int low = body[i];
        int high = body[i + 2];
        if (low <= high) {
          ranges.add(new CodePointRange(low, high));
        } else {
          logger.debug(
              "NFA: Dropping empty character range {}-{}",
              Character.toString(low),
              Character.toString(high));
        }
        i += 3;
      } else {
        singles.add(body[i]);
        i++;
      }
    }
    return new State.CharClass(ranges, singles, negated);
  }
}
