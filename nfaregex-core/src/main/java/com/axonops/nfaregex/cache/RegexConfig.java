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
package com.axonops.nfaregex.cache;

import com.axonops.nfaregex.metrics.NoOpMetricsRegistry;
import com.axonops.nfaregex.metrics.RegexMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for the {@link com.axonops.nfaregex.api.Regex} entry point: automaton caching,
 * parsing mode and metrics.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 10K cached automata, permissive parsing, metrics disabled
 * RegexConfig config = RegexConfig.DEFAULT;
 *
 * // Reject malformed patterns and publish metrics
 * RegexConfig config = RegexConfig.builder()
 *     .strictParsing(true)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.regex"))
 *     .build();
 * Regex.setGlobalCache(new AutomatonCache(config));
 * }</pre>
 *
 * @param cacheEnabled keep compiled automata for reuse
 * @param maxCacheSize automata kept before least-recently-used eviction (must be > 0 if cache
 *     enabled)
 * @param strictParsing compile with {@link com.axonops.nfaregex.parser.SimpleParser#strict()}, so
 *     malformed patterns throw instead of degrading to a best-effort automaton
 * @param metricsRegistry metrics implementation ({@link NoOpMetricsRegistry} for none)
 * @since 1.0.0
 */
public record RegexConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    boolean strictParsing,
    RegexMetricsRegistry metricsRegistry) {

  /** Cache of 10K automata, permissive parsing, no metrics. */
  public static final RegexConfig DEFAULT =
      new RegexConfig(
          true, // Cache enabled
          10000, // Max 10K cached automata
          false, // Permissive parsing
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Every compilation builds a new automaton. */
  public static final RegexConfig NO_CACHE =
      new RegexConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          false, // Permissive parsing
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public RegexConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (cacheEnabled && maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
    }
    if (maxCacheSize < 0) {
      throw new IllegalArgumentException("maxCacheSize must not be negative");
    }
  }

  /**
   * @return new builder starting from {@link #DEFAULT}
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder starting from the {@link #DEFAULT} values. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private boolean strictParsing = false;
    private RegexMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * @param enabled true to cache compiled automata (default)
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * <b>Default: 10,000</b>
     *
     * @param size maximum cached automata (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * <b>Default: false</b>. When enabled, any syntax anomaly makes compilation throw {@link
     * com.axonops.nfaregex.api.PatternCompilationException}.
     *
     * @param strict true to reject malformed patterns
     * @return this builder
     */
    public Builder strictParsing(boolean strict) {
      this.strictParsing = strict;
      return this;
    }

    /**
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(RegexMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public RegexConfig build() {
      return new RegexConfig(cacheEnabled, maxCacheSize, strictParsing, metricsRegistry);
    }
  }
}
