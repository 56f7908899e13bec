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

import com.axonops.libnfa.metrics.MetricNames;
import com.axonops.libnfa.metrics.NfaMetricsRegistry;
import java.util.Objects;

/**
 * Matches one input against a {@link Pattern}.
 *
 * <p>NOT Thread-Safe: confine each Matcher to a single thread. The underlying Pattern can be
 * shared; create one Matcher per input instead of sharing Matchers.
 *
 * <pre>
 * Pattern shared = NFA.compile("[a-z]+[0-9]*");
 *
 * Matcher m = shared.matcher("abc123");
 * m.matches(); // true
 * </pre>
 *
 * @since 1.0.0
 */
public final class Matcher {

  private final Pattern pattern;
  private final String input;

  Matcher(Pattern pattern, String input) {
    this.pattern = Objects.requireNonNull(pattern);
    this.input = Objects.requireNonNull(input);
  }

  /**
   * Tests if the entire input matches the pattern.
   *
   * @return true if all of the input is consumed and the pattern can terminate there
   */
  public boolean matches() {
    NfaMetricsRegistry metrics = Pattern.currentMetrics();
    long start = System.nanoTime();
    boolean matched = pattern.simulator().matches(input);

    metrics.recordTimer(MetricNames.MATCHING_FULL_MATCH_LATENCY, System.nanoTime() - start);
    metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
    metrics.incrementCounter(
        matched ? MetricNames.MATCHING_ACCEPTED : MetricNames.MATCHING_REJECTED);
    return matched;
  }

  public Pattern pattern() {
    return pattern;
  }

  public String input() {
    return input;
  }
}
