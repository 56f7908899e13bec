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

package com.axonops.libnfa.api;

import java.util.Collection;
import java.util.List;

/**
 * Main entry point for libnfa operations.
 *
 * <p>Patterns support literals, {@code .}, bracketed classes ({@code [a-z0-9]}, {@code [^0-9]})
 * and postfix {@code *} / {@code +}. Matching is always a full match and never backtracks.
 *
 * <p>Thread-safe: All methods can be called concurrently from multiple threads.
 *
 * @since 1.0.0
 */
public final class NFA {

  private NFA() {
    // Utility class
  }

  public static Pattern compile(String pattern) {
    return Pattern.compile(pattern);
  }

  /**
   * Tests if the entire input matches the pattern.
   *
   * @param pattern the pattern
   * @param input input string (the empty string is valid)
   * @return true if entire input matches, false otherwise
   * @throws PatternCompilationException if the pattern is invalid
   * @throws InputRequiredException if input is null
   */
  public static boolean matches(String pattern, String input) {
    return compile(pattern).matches(input);
  }

  /**
   * Tests multiple inputs against a pattern.
   *
   * @param pattern the pattern
   * @param inputs array of input strings
   * @return boolean array (parallel to inputs)
   */
  public static boolean[] matchAll(String pattern, String[] inputs) {
    return compile(pattern).matchAll(inputs);
  }

  /**
   * Tests multiple inputs against a pattern.
   *
   * @param pattern the pattern
   * @param inputs collection of input strings
   * @return boolean array (parallel to inputs)
   */
  public static boolean[] matchAll(String pattern, Collection<String> inputs) {
    return compile(pattern).matchAll(inputs);
  }

  /**
   * Filters a collection to only strings matching the pattern.
   *
   * @param pattern the pattern
   * @param inputs collection to filter
   * @return new list containing only matching strings
   */
  public static List<String> filter(String pattern, Collection<String> inputs) {
    return compile(pattern).filter(inputs);
  }

  /**
   * Filters a collection to only strings NOT matching the pattern.
   *
   * @param pattern the pattern
   * @param inputs collection to filter
   * @return new list containing only non-matching strings
   */
  public static List<String> filterNot(String pattern, Collection<String> inputs) {
    return compile(pattern).filterNot(inputs);
  }
}
