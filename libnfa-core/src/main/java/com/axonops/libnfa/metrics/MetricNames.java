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

package com.axonops.libnfa.metrics;

/**
 * Metric name constants for libnfa instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Pattern Compilation</b> - compilations, cache hits and misses, compilation latency
 *   <li><b>Cache</b> - current size and LRU evictions
 *   <li><b>Matching</b> - full-match operations, outcomes and latency; bulk operations
 *   <li><b>Errors</b> - rejected patterns and missing inputs
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - suffix {@code .total.count}
 *   <li><b>Timer</b> - suffix {@code .latency}
 *   <li><b>Gauge</b> - suffix {@code .current.count}
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * Pattern.configureCache(NfaConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.nfa"))
 *     .build());
 *
 * Pattern.compile("[a-z]+").matches("hello");
 *
 * Counter compilations = registry.counter(
 *     MetricRegistry.name("myapp.nfa", MetricNames.PATTERNS_COMPILED));
 * }</pre>
 *
 * @since 1.0.0
 * @see com.axonops.libnfa.cache.PatternCache
 * @see com.axonops.libnfa.api.Pattern
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation
  // ========================================

  /**
   * Total patterns compiled into state graphs.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> High values relative to cache hits mean many unique patterns
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /** Total cache hits (pattern found in cache). Counter. */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /** Total cache misses (compilation required). Counter. */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /**
   * Pattern compilation latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> For each successful compilation
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  // ========================================
  // Cache
  // ========================================

  /** Current number of patterns in cache. Gauge. */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  /**
   * Patterns evicted because the cache exceeded its maximum size.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Steady growth means the cache is too small for the working set
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  // ========================================
  // Matching
  // ========================================

  /** Total full-match operations; each item of a bulk call counts as one. Counter. */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /** Full-match latency; bulk calls record their per-item average. Timer (nanoseconds). */
  public static final String MATCHING_FULL_MATCH_LATENCY = "matching.full_match.latency";

  /** Inputs accepted by their pattern. Counter. */
  public static final String MATCHING_ACCEPTED = "matching.accepted.total.count";

  /** Inputs rejected by their pattern (a normal outcome, not an error). Counter. */
  public static final String MATCHING_REJECTED = "matching.rejected.total.count";

  /** Bulk operations ({@code matchAll}, {@code filter}, {@code filterNot}). Counter. */
  public static final String MATCHING_BULK_OPERATIONS = "matching.bulk.operations.total.count";

  /** Inputs processed by bulk operations. Counter. */
  public static final String MATCHING_BULK_ITEMS = "matching.bulk.items.total.count";

  /** Latency of a whole bulk operation. Timer (nanoseconds). */
  public static final String MATCHING_BULK_LATENCY = "matching.bulk.latency";

  // ========================================
  // Errors
  // ========================================

  /**
   * Patterns rejected by the compiler.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> Each time {@link com.axonops.libnfa.api.PatternCompilationException} is
   * thrown
   */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /** Match operations called with a null input. Counter. */
  public static final String ERRORS_INPUT_REQUIRED = "errors.input_required.total.count";
}
