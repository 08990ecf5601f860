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

import com.axonops.nfaregex.metrics.MetricNames;
import com.axonops.nfaregex.metrics.RegexMetricsRegistry;
import com.axonops.nfaregex.nfa.Nfa;
import com.axonops.nfaregex.util.PatternHasher;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe LRU cache of compiled automata, keyed by pattern text.
 *
 * <p>The cache keeps one master automaton per pattern and hands out {@link Nfa#duplicate()
 * duplicates}, so callers never share mutable states with the cache or with each other.
 *
 * <p>Compilation of a missing pattern runs outside the lock; two threads missing the same pattern
 * at once may both compile it and the first result stored wins.
 *
 * @since 1.0.0
 */
public final class AutomatonCache {
  private static final Logger logger = LoggerFactory.getLogger(AutomatonCache.class);

  private final RegexConfig config;

  // Access-ordered: iteration starts at the least recently used entry
  private final LinkedHashMap<String, Nfa> cache = new LinkedHashMap<>(16, 0.75f, true);
  private long cachedStates;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictions = new AtomicLong(0);

  /**
   * @param config cache configuration
   */
  public AutomatonCache(RegexConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");

    if (config.cacheEnabled()) {
      logger.debug(
          "NFA: Automaton cache initialized - maxSize: {}, strictParsing: {}",
          config.maxCacheSize(),
          config.strictParsing());
      registerCacheMetrics();
    } else {
      logger.info("NFA: Automaton caching disabled");
    }
  }

  public RegexConfig getConfig() {
    return config;
  }

  /**
   * Returns a private copy of the cached automaton for {@code pattern}, compiling and caching it
   * first if needed.
   *
   * @param pattern pattern text, the cache key
   * @param compiler builds the automaton on a miss; exceptions propagate and nothing is cached
   * @return automaton owned by the caller
   */
  public Nfa getOrCompile(String pattern, Supplier<Nfa> compiler) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    Objects.requireNonNull(compiler, "compiler cannot be null");
    RegexMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.AUTOMATA_CACHE_MISSES);
      return compiler.get();
    }

    synchronized (cache) {
      Nfa cached = cache.get(pattern);
      if (cached != null) {
        hits.incrementAndGet();
        metrics.incrementCounter(MetricNames.AUTOMATA_CACHE_HITS);
        logger.trace("NFA: Cache hit - hash: {}", PatternHasher.hash(pattern));
        return cached.duplicate();
      }
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.AUTOMATA_CACHE_MISSES);
    logger.trace("NFA: Cache miss - hash: {}, compiling", PatternHasher.hash(pattern));

    Nfa compiled = compiler.get();

    synchronized (cache) {
      Nfa existing = cache.get(pattern);
      if (existing != null) {
        return existing.duplicate();
      }
      cache.put(pattern, compiled);
      cachedStates += compiled.size();
      evictIfNeeded(metrics);
      return compiled.duplicate();
    }
  }

  /** Caller holds the lock. */
  private void evictIfNeeded(RegexMetricsRegistry metrics) {
    Iterator<Map.Entry<String, Nfa>> eldest = cache.entrySet().iterator();
    while (cache.size() > config.maxCacheSize() && eldest.hasNext()) {
      Map.Entry<String, Nfa> entry = eldest.next();
      cachedStates -= entry.getValue().size();
      eldest.remove();
      evictions.incrementAndGet();
      metrics.incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
      logger.debug("NFA: Evicted LRU automaton - hash: {}", PatternHasher.hash(entry.getKey()));
    }
  }

  /**
   * @return true if an automaton for {@code pattern} is cached (does not affect LRU order)
   */
  public boolean contains(String pattern) {
    synchronized (cache) {
      return cache.containsKey(pattern);
    }
  }

  public int size() {
    synchronized (cache) {
      return cache.size();
    }
  }

  /**
   * Drops every cached automaton. Statistics are kept.
   */
  public void clear() {
    synchronized (cache) {
      cache.clear();
      cachedStates = 0;
    }
    logger.debug("NFA: Automaton cache cleared");
  }

  /**
   * Resets hit, miss and eviction counters.
   */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictions.set(0);
  }

  /**
   * Clears the cache and unregisters its gauges.
   */
  public void shutdown() {
    clear();
    if (config.cacheEnabled()) {
      config.metricsRegistry().removeGauge(MetricNames.CACHE_AUTOMATA_COUNT);
      config.metricsRegistry().removeGauge(MetricNames.CACHE_STATES_COUNT);
    }
  }

  public CacheStatistics getStatistics() {
    synchronized (cache) {
      return new CacheStatistics(
          hits.get(),
          misses.get(),
          evictions.get(),
          cache.size(),
          config.cacheEnabled() ? config.maxCacheSize() : 0,
          cachedStates);
    }
  }

  private void registerCacheMetrics() {
    RegexMetricsRegistry metrics = config.metricsRegistry();
    metrics.registerGauge(MetricNames.CACHE_AUTOMATA_COUNT, this::size);
    metrics.registerGauge(
        MetricNames.CACHE_STATES_COUNT,
        () -> {
          synchronized (cache) {
            return cachedStates;
          }
        });
  }
}
