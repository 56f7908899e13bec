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

package com.axonops.libnfa.dropwizard;

import com.axonops.libnfa.cache.NfaConfig;
import com.axonops.libnfa.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convenience factory for NfaConfig with Dropwizard Metrics integration.
 *
 * <p>Builds a configuration whose metrics go to an existing {@link MetricRegistry} and, unless
 * told otherwise, exposes that registry over JMX.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * Pattern.configureCache(NfaMetricsConfig.withMetrics(registry, "com.mycompany.myapp.nfa"));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class NfaMetricsConfig {
  private static final Logger logger = LoggerFactory.getLogger(NfaMetricsConfig.class);
  private static volatile JmxReporter jmxReporter;

  private NfaMetricsConfig() {
    // Utility class
  }

  /**
   * Creates NfaConfig with Dropwizard Metrics integration and automatic JMX.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @return configured NfaConfig with metrics enabled
   */
  public static NfaConfig withMetrics(MetricRegistry registry, String metricPrefix) {
    return withMetrics(registry, metricPrefix, true);
  }

  /**
   * Creates NfaConfig with Dropwizard Metrics integration.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @param metricPrefix the metric namespace prefix
   * @param enableJmx whether to set up JMX exposure
   * @return configured NfaConfig with metrics enabled
   */
  public static NfaConfig withMetrics(
      MetricRegistry registry, String metricPrefix, boolean enableJmx) {
    Objects.requireNonNull(registry, "registry cannot be null");
    Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

    if (enableJmx) {
      ensureJmxReporter(registry);
    }

    return NfaConfig.builder()
        .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
        .build();
  }

  /**
   * Creates NfaConfig with Dropwizard Metrics using the default prefix {@code
   * "com.axonops.libnfa"}.
   *
   * @param registry the Dropwizard MetricRegistry to use
   * @return configured NfaConfig with metrics enabled
   */
  public static NfaConfig withMetrics(MetricRegistry registry) {
    return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
  }

  /** Whether a JMX reporter has been started by this class. */
  public static boolean isJmxReporterRunning() {
    return jmxReporter != null;
  }

  /**
   * Starts one JmxReporter for the first registry seen. Idempotent.
   *
   * @param registry the MetricRegistry to expose via JMX
   */
  private static synchronized void ensureJmxReporter(MetricRegistry registry) {
    if (jmxReporter == null) {
      try {
        logger.info("NFA: Registering JmxReporter for metrics");
        JmxReporter reporter = JmxReporter.forRegistry(registry).build();
        reporter.start();
        jmxReporter = reporter;
        logger.info("NFA: JmxReporter started - metrics available via JMX");
      } catch (RuntimeException e) {
        // Not fatal: the application may already expose the registry
        logger.warn("NFA: Failed to start JmxReporter (may already be configured)", e);
      }
    }
  }

  /** Stops the JMX reporter if one was started. */
  public static synchronized void shutdown() {
    if (jmxReporter != null) {
      logger.info("NFA: Stopping JmxReporter");
      jmxReporter.stop();
      jmxReporter = null;
    }
  }
}
