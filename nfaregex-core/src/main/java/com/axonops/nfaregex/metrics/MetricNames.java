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
package com.axonops.nfaregex.metrics;

/**
 * Metric name constants.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.*})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * RegexConfig config = RegexConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.regex"))
 *     .build();
 * Regex.setGlobalCache(new AutomatonCache(config));
 *
 * Regex.fullMatch("[a-z]+@[a-z]+", "user@example");
 *
 * Counter compilations = registry.counter(
 *     MetricRegistry.name("myapp.regex", MetricNames.AUTOMATA_COMPILED));
 * }</pre>
 *
 * <p>Cache hit rate is {@code AUTOMATA_CACHE_HITS / (AUTOMATA_CACHE_HITS + AUTOMATA_CACHE_MISSES)}.
 *
 * @since 1.0.0
 * @see com.axonops.nfaregex.cache.AutomatonCache
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Compilation
  // ========================================

  /**
   * Patterns compiled into automata.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String AUTOMATA_COMPILED = "automata.compiled.total.count";

  /**
   * Time to parse a pattern and build its automaton.
   *
   * <p><b>Type:</b> Timer
   */
  public static final String AUTOMATA_COMPILATION_LATENCY = "automata.compilation.latency";

  /**
   * Compilations rejected because the parser reported a syntax error (strict parsing only).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_PARSE_FAILED = "errors.parse.failed.total.count";

  // ========================================
  // Cache
  // ========================================

  /**
   * Pattern found in the automaton cache.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String AUTOMATA_CACHE_HITS = "automata.cache.hits.total.count";

  /**
   * Pattern not cached, compilation required.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String AUTOMATA_CACHE_MISSES = "automata.cache.misses.total.count";

  /**
   * Least-recently-used automata dropped because the cache was full.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /**
   * Automata currently cached.
   *
   * <p><b>Type:</b> Gauge
   */
  public static final String CACHE_AUTOMATA_COUNT = "cache.automata.current.count";

  /**
   * NFA states held by all cached automata. Rough measure of the cache footprint.
   *
   * <p><b>Type:</b> Gauge
   */
  public static final String CACHE_STATES_COUNT = "cache.states.current.count";

  // ========================================
  // Matching
  // ========================================

  /**
   * Full-match simulation time.
   *
   * <p><b>Type:</b> Timer
   */
  public static final String MATCHING_FULL_MATCH_LATENCY = "matching.full_match.latency";

  /**
   * Full-match operations performed.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";
}
