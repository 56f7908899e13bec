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

import com.axonops.libnfa.cache.CacheStatistics;
import com.axonops.libnfa.cache.NfaConfig;
import com.axonops.libnfa.cache.PatternCache;
import com.axonops.libnfa.compiler.PatternCompiler;
import com.axonops.libnfa.engine.NfaSimulator;
import com.axonops.libnfa.graph.StateGraph;
import com.axonops.libnfa.metrics.MetricNames;
import com.axonops.libnfa.metrics.NfaMetricsRegistry;
import com.axonops.libnfa.util.PatternHasher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled pattern: an immutable state graph plus the simulator that runs it.
 *
 * <p>Thread-safe: Pattern instances can be shared freely between threads; compiling the same
 * string twice yields patterns that accept exactly the same inputs.
 *
 * <p>Caching: {@link #compile(String)} goes through a global {@link PatternCache}. Use {@link
 * #compileWithoutCache(String)} to always build a fresh graph.
 *
 * <p>All match operations are full matches: the whole input must be consumed.
 *
 * @since 1.0.0
 */
public final class Pattern {
  private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

  // Global pattern cache (volatile so tests can swap it)
  private static volatile PatternCache cache = new PatternCache(NfaConfig.DEFAULT);

  private final String patternString;
  private final NfaSimulator simulator;

  private Pattern(String patternString, StateGraph graph) {
    this.patternString = Objects.requireNonNull(patternString);
    this.simulator = new NfaSimulator(graph);

    logger.trace(
        "NFA: Pattern created - length: {}, states: {}", patternString.length(), graph.size());
  }

  /**
   * Compiles a pattern, reusing a cached graph when available.
   *
   * @param pattern the pattern string
   * @return compiled pattern
   * @throws PatternCompilationException if the pattern is invalid
   */
  public static Pattern compile(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      // Rejected before the cache so that null never becomes a key
      return doCompile(pattern);
    }
    return cache.getOrCompile(pattern, () -> doCompile(pattern));
  }

  /**
   * Compiles a pattern without using the cache.
   *
   * @param pattern the pattern string
   * @return a pattern with its own graph
   * @throws PatternCompilationException if the pattern is invalid
   */
  public static Pattern compileWithoutCache(String pattern) {
    return doCompile(pattern);
  }

  private static Pattern doCompile(String pattern) {
    NfaMetricsRegistry metrics = cache.getConfig().metricsRegistry();
    long start = System.nanoTime();
    StateGraph graph;
    try {
      graph = PatternCompiler.compile(pattern);
    } catch (PatternCompilationException e) {
      metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
      logger.debug(
          "NFA: Pattern compilation failed - hash: {}, error: {}",
          PatternHasher.hashWithLength(pattern),
          e.getMessage());
      throw e;
    }
    long durationNanos = System.nanoTime() - start;

    metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);
    metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
    return new Pattern(pattern, graph);
  }

  /**
   * Creates a matcher for one input.
   *
   * @param input the input; the empty string is valid
   * @return a new matcher
   * @throws InputRequiredException if {@code input} is null
   */
  public Matcher matcher(String input) {
    if (input == null) {
      currentMetrics().incrementCounter(MetricNames.ERRORS_INPUT_REQUIRED);
      throw new InputRequiredException("matcher input cannot be null");
    }
    return new Matcher(this, input);
  }

  /**
   * Tests if the entire input matches this pattern.
   *
   * @param input the input; the empty string is valid
   * @return true if the whole input is accepted
   * @throws InputRequiredException if {@code input} is null
   */
  public boolean matches(String input) {
    return matcher(input).matches();
  }

  // ========== Bulk Operations ==========

  /**
   * Tests multiple inputs against this pattern.
   *
   * @param inputs array of input strings (elements must not be null)
   * @return boolean array parallel to inputs
   * @throws InputRequiredException if the array or any element is null
   */
  public boolean[] matchAll(String[] inputs) {
    if (inputs == null) {
      throw new InputRequiredException("inputs cannot be null");
    }
    long start = System.nanoTime();
    boolean[] results = new boolean[inputs.length];
    int accepted = 0;
    for (int i = 0; i < inputs.length; i++) {
      results[i] = matchesElement(inputs[i], i);
      if (results[i]) {
        accepted++;
      }
    }
    recordBulk(inputs.length, accepted, start);
    return results;
  }

  /**
   * Tests multiple inputs against this pattern.
   *
   * @param inputs collection of input strings (elements must not be null)
   * @return boolean array parallel to the collection's iteration order
   * @throws InputRequiredException if the collection or any element is null
   */
  public boolean[] matchAll(Collection<String> inputs) {
    if (inputs == null) {
      throw new InputRequiredException("inputs cannot be null");
    }
    return matchAll(inputs.toArray(new String[0]));
  }

  /**
   * Filters a collection to the inputs this pattern matches.
   *
   * @param inputs collection to filter (elements must not be null)
   * @return new list of matching inputs, in iteration order
   * @throws InputRequiredException if the collection or any element is null
   */
  public List<String> filter(Collection<String> inputs) {
    return select(inputs, true);
  }

  /**
   * Filters a collection to the inputs this pattern does NOT match.
   *
   * @param inputs collection to filter (elements must not be null)
   * @return new list of non-matching inputs, in iteration order
   * @throws InputRequiredException if the collection or any element is null
   */
  public List<String> filterNot(Collection<String> inputs) {
    return select(inputs, false);
  }

  private List<String> select(Collection<String> inputs, boolean keepMatches) {
    if (inputs == null) {
      throw new InputRequiredException("inputs cannot be null");
    }
    long start = System.nanoTime();
    List<String> selected = new ArrayList<>();
    int index = 0;
    int accepted = 0;
    for (String input : inputs) {
      boolean matched = matchesElement(input, index++);
      if (matched) {
        accepted++;
      }
      if (matched == keepMatches) {
        selected.add(input);
      }
    }
    recordBulk(index, accepted, start);
    return selected;
  }

  private boolean matchesElement(String input, int index) {
    if (input == null) {
      currentMetrics().incrementCounter(MetricNames.ERRORS_INPUT_REQUIRED);
      throw new InputRequiredException("input at index " + index + " is null");
    }
    return simulator.matches(input);
  }

  /**
   * Records a finished bulk call. Every item also counts as a full-match operation, with the
   * per-item latency going to the full-match timer.
   */
  private void recordBulk(int items, int accepted, long startNanos) {
    long durationNanos = System.nanoTime() - startNanos;
    long perItemNanos = items > 0 ? durationNanos / items : 0;
    NfaMetricsRegistry metrics = currentMetrics();

    metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS, items);
    metrics.incrementCounter(MetricNames.MATCHING_ACCEPTED, accepted);
    metrics.incrementCounter(MetricNames.MATCHING_REJECTED, items - accepted);
    metrics.recordTimer(MetricNames.MATCHING_FULL_MATCH_LATENCY, perItemNanos);

    metrics.incrementCounter(MetricNames.MATCHING_BULK_OPERATIONS);
    metrics.incrementCounter(MetricNames.MATCHING_BULK_ITEMS, items);
    metrics.recordTimer(MetricNames.MATCHING_BULK_LATENCY, durationNanos);
  }

  // ========== Accessors ==========

  public String pattern() {
    return patternString;
  }

  /**
   * Number of nodes in the compiled graph, including start and termination.
   *
   * @return state count
   */
  public int stateCount() {
    return simulator.graph().size();
  }

  /**
   * The compiled graph (immutable).
   *
   * @return state graph
   */
  public StateGraph graph() {
    return simulator.graph();
  }

  NfaSimulator simulator() {
    return simulator;
  }

  static NfaMetricsRegistry currentMetrics() {
    return cache.getConfig().metricsRegistry();
  }

  @Override
  public String toString() {
    return "Pattern{" + patternString + "}";
  }

  // ========== Cache Management ==========

  /** Gets cache statistics (for monitoring). */
  public static CacheStatistics getCacheStatistics() {
    return cache.getStatistics();
  }

  /** Clears the pattern cache. */
  public static void clearCache() {
    cache.clear();
  }

  /** Fully resets the cache including statistics (for testing only). */
  public static void resetCache() {
    cache.reset();
  }

  /**
   * Reconfigures the global cache. All cached patterns are dropped.
   *
   * @param config the new configuration
   */
  public static void configureCache(NfaConfig config) {
    cache.reconfigure(config);
  }

  /**
   * Gets the current cache configuration.
   *
   * @return the current NfaConfig
   */
  public static NfaConfig getCacheConfig() {
    return cache.getConfig();
  }

  public static PatternCache getGlobalCache() {
    return cache;
  }

  /**
   * Replaces the global cache (for tests that need an isolated cache and metrics registry).
   *
   * @param newCache the cache to install
   */
  public static void setGlobalCache(PatternCache newCache) {
    cache = Objects.requireNonNull(newCache, "cache cannot be null");
  }
}
