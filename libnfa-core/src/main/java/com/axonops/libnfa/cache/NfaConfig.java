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

import com.axonops.libnfa.metrics.NfaMetricsRegistry;
import com.axonops.libnfa.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for libnfa: pattern caching and metrics.
 *
 * <p>Immutable record. Compiled patterns are immutable and hold no native resources, so the cache
 * only saves recompilation work; when it exceeds {@code maxCacheSize} the least recently used
 * patterns (approximately, for very large caches) are dropped.
 *
 * <pre>{@code
 * NfaConfig config = NfaConfig.builder()
 *     .maxCacheSize(1000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry))
 *     .build();
 * Pattern.configureCache(config);
 * }</pre>
 *
 * @param cacheEnabled whether {@code Pattern.compile} goes through the cache
 * @param maxCacheSize maximum cached patterns (ignored when the cache is disabled)
 * @param metricsRegistry metrics sink, never null
 * @since 1.0.0
 */
public record NfaConfig(
    boolean cacheEnabled, int maxCacheSize, NfaMetricsRegistry metricsRegistry) {

  /** Cache enabled with 10,000 entries, metrics disabled. */
  public static final NfaConfig DEFAULT =
      new NfaConfig(
          true, // Cache enabled
          10000, // Max 10K cached patterns
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Configuration with caching disabled. Every compile builds a new graph. */
  public static final NfaConfig NO_CACHE =
      new NfaConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException if the cache is enabled with a non-positive size
   * @throws NullPointerException if metricsRegistry is null
   */
  public NfaConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (cacheEnabled && maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
    }
    if (maxCacheSize < 0) {
      throw new IllegalArgumentException("maxCacheSize must not be negative");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link NfaConfig}; starts from the {@link #DEFAULT} values. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private NfaMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable pattern caching.
     *
     * @param enabled true to enable caching (default)
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of patterns in cache before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * @param size maximum cached patterns (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set the metrics registry.
     *
     * <p><b>Default:</b> {@link NoOpMetricsRegistry#INSTANCE}
     *
     * @param registry metrics sink (not null)
     * @return this builder
     */
    public Builder metricsRegistry(NfaMetricsRegistry registry) {
      this.metricsRegistry = Objects.requireNonNull(registry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if the values are inconsistent
     */
    public NfaConfig build() {
      return new NfaConfig(cacheEnabled, maxCacheSize, metricsRegistry);
    }
  }
}
