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

package com.axonops.libnfa.cache;

import com.axonops.libnfa.api.Pattern;
import com.axonops.libnfa.metrics.MetricNames;
import com.axonops.libnfa.metrics.NfaMetricsRegistry;
import com.axonops.libnfa.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of compiled patterns with approximate LRU eviction.
 *
 * <p>Lookups are lock-free ({@link ConcurrentHashMap}); a miss compiles inside {@code
 * computeIfAbsent}, so each distinct pattern is compiled by one thread only. When an insertion
 * pushes the cache over {@code maxCacheSize}, the least recently used entries of a bounded sample
 * are removed before the caller returns. Up to {@value #EVICTION_SAMPLE_SIZE} entries the sample
 * is the whole cache and eviction is exact LRU; larger caches evict the oldest entries of the
 * first {@value #EVICTION_SAMPLE_SIZE} in iteration order. Recency is an access sequence number
 * rather than a clock reading, which keeps the ordering strict.
 *
 * <p>Evicted patterns stay usable by whoever still holds them; they are simply no longer shared.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  /** Upper bound on entries examined per eviction pass. */
  private static final int EVICTION_SAMPLE_SIZE = 500;

  private volatile NfaConfig config;
  private final ConcurrentHashMap<String, CachedPattern> cache = new ConcurrentHashMap<>();
  private final Object evictionLock = new Object();

  private final AtomicLong accessSequence = new AtomicLong(0);
  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictions = new AtomicLong(0);

  /**
   * Creates a new pattern cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public PatternCache(NfaConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");

    if (config.cacheEnabled()) {
      logger.debug("NFA: Pattern cache initialized - maxSize: {}", config.maxCacheSize());
      registerCacheMetrics();
    } else {
      logger.info("NFA: Pattern caching disabled");
    }
  }

  public NfaConfig getConfig() {
    return config;
  }

  /**
   * Gets or compiles a pattern.
   *
   * @param patternString pattern text (cache key)
   * @param compiler compiles the pattern on a miss; exceptions propagate and nothing is cached
   * @return cached or newly compiled pattern
   */
  public Pattern getOrCompile(String patternString, Supplier<Pattern> compiler) {
    NfaMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    CachedPattern cached = cache.get(patternString);
    if (cached != null) {
      return hit(patternString, cached, metrics);
    }

    // Only the thread whose mapping function runs records the miss
    boolean[] compiledHere = new boolean[1];
    CachedPattern entry =
        cache.computeIfAbsent(
            patternString,
            k -> {
              compiledHere[0] = true;
              misses.incrementAndGet();
              metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
              logger.trace("NFA: Cache miss - hash: {}, compiling", PatternHasher.hash(k));
              return new CachedPattern(compiler.get(), accessSequence.incrementAndGet());
            });

    if (!compiledHere[0]) {
      return hit(patternString, entry, metrics);
    }
    if (cache.size() > config.maxCacheSize()) {
      evictLeastRecentlyUsed();
    }
    return entry.pattern();
  }

  private Pattern hit(String patternString, CachedPattern cached, NfaMetricsRegistry metrics) {
    cached.touch(accessSequence.incrementAndGet());
    hits.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
    logger.trace("NFA: Cache hit - hash: {}", PatternHasher.hash(patternString));
    return cached.pattern();
  }

  /**
   * Removes the oldest entries until the cache is back within its limit.
   *
   * <p>Examines at most {@link #EVICTION_SAMPLE_SIZE} entries per pass. Each candidate's access
   * sequence is read once before sorting, since concurrent hits keep updating it.
   */
  private void evictLeastRecentlyUsed() {
    synchronized (evictionLock) {
      int toEvict = cache.size() - config.maxCacheSize();
      if (toEvict <= 0) {
        return;
      }

      List<EvictionCandidate> candidates =
          cache.entrySet().stream()
              .limit(Math.max(EVICTION_SAMPLE_SIZE, toEvict))
              .map(e -> new EvictionCandidate(e.getKey(), e.getValue(), e.getValue().lastAccess()))
              .sorted(Comparator.comparingLong(EvictionCandidate::lastAccess))
              .limit(toEvict)
              .collect(Collectors.toList());

      int evicted = 0;
      for (EvictionCandidate candidate : candidates) {
        if (cache.remove(candidate.key(), candidate.entry())) {
          evicted++;
          logger.trace("NFA: LRU evicting pattern - hash: {}", PatternHasher.hash(candidate.key()));
        }
      }

      if (evicted > 0) {
        evictions.addAndGet(evicted);
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU, evicted);
        logger.debug(
            "NFA: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
            evicted,
            cache.size(),
            config.maxCacheSize());
      }
    }
  }

  /**
   * Tests whether a pattern is currently cached.
   *
   * @param patternString pattern text
   * @return true if present
   */
  public boolean contains(String patternString) {
    return config.cacheEnabled() && cache.containsKey(patternString);
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictions.get(),
        config.cacheEnabled() ? cache.size() : 0,
        config.maxCacheSize());
  }

  /** Removes every cached pattern. Statistics are kept. */
  public void clear() {
    int size = cache.size();
    cache.clear();
    logger.debug("NFA: Cleared cache - {} patterns removed", size);
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictions.set(0);
    logger.trace("NFA: Cache statistics reset");
  }

  /** Full reset for testing (clears cache and resets statistics). */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Reconfigures the cache with new settings.
   *
   * <p>Clears the cache and statistics and moves gauges to the new metrics registry.
   *
   * @param newConfig the new configuration
   */
  public synchronized void reconfigure(NfaConfig newConfig) {
    Objects.requireNonNull(newConfig, "config cannot be null");
    logger.info("NFA: Reconfiguring cache with new settings");

    config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    reset();
    this.config = newConfig;

    if (newConfig.cacheEnabled()) {
      registerCacheMetrics();
      logger.info("NFA: Cache reconfigured - maxSize: {}", newConfig.maxCacheSize());
    } else {
      logger.info("NFA: Cache disabled after reconfiguration");
    }
  }

  /** Clears the cache and unregisters its gauges. */
  public void shutdown() {
    logger.info("NFA: Shutting down cache");
    config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    clear();
  }

  private void registerCacheMetrics() {
    config.metricsRegistry().registerGauge(MetricNames.CACHE_PATTERNS_COUNT, cache::size);
    logger.debug("NFA: Metrics registered - cache gauges");
  }

  /** Entry considered for eviction, with its access sequence frozen at sampling time. */
  private record EvictionCandidate(String key, CachedPattern entry, long lastAccess) {}

  /** Cached pattern with its last access sequence number. */
  private static final class CachedPattern {
    private final Pattern pattern;
    private final AtomicLong lastAccess;

    CachedPattern(Pattern pattern, long sequence) {
      this.pattern = pattern;
      this.lastAccess = new AtomicLong(sequence);
    }

    Pattern pattern() {
      return pattern;
    }

    long lastAccess() {
      return lastAccess.get();
    }

    void touch(long sequence) {
      lastAccess.set(sequence);
    }
  }
}
