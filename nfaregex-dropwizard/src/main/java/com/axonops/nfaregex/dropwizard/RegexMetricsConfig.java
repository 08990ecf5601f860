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
package com.axonops.nfaregex.dropwizard;

import com.axonops.nfaregex.cache.RegexConfig;
import com.axonops.nfaregex.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for {@link RegexConfig} with Dropwizard Metrics integration.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application that already owns a MetricRegistry:
 * RegexConfig config = RegexMetricsConfig.withMetrics(appRegistry, "com.myapp.regex");
 * Regex.configure(config);
 *
 * // Standalone, default prefix, metrics visible over JMX:
 * Regex.configure(RegexMetricsConfig.withMetrics(new MetricRegistry()));
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> unless disabled, a single {@link JmxReporter} is started for
 * the first registry passed in, so every metric shows up under the {@code metrics} JMX domain.
 *
 * @since 1.0.0
 */
public final class RegexMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegexMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private RegexMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a configuration publishing metrics under {@code metricPrefix}, with JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configuration with metrics enabled
     */
    public static RegexConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a configuration publishing metrics under {@code metricPrefix}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start JMX exposure
     * @return configuration with metrics enabled
     */
    public static RegexConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builder(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates a configuration with the default prefix {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}
     * and JMX.
     */
    public static RegexConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Same as {@link #withMetrics(MetricRegistry, String, boolean)} but returns the builder so
     * cache size or parsing mode can still be changed.
     */
    public static RegexConfig.Builder builder(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return RegexConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * Starts the JMX reporter once. Later calls, even with another registry, are no-ops.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("NFA: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("NFA: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal, the registry may already be exposed
                logger.warn("NFA: Failed to start JmxReporter (may already be configured)", e);
                jmxReporter = null;
            }
        }
    }

    /**
     * @return true if this class started a JMX reporter that is still running
     */
    public static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the JMX reporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("NFA: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
