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

import java.util.function.Supplier;

/**
 * Metrics abstraction so the engine works with or without Dropwizard Metrics on the classpath.
 *
 * <p>Implementations must be thread-safe.
 *
 * @since 1.0.0
 * @see MetricNames
 */
public interface RegexMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "automata.compiled.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a non-negative delta.
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a duration in nanoseconds into a timer histogram.
     *
     * @param name metric name (e.g., "automata.compilation.latency")
     * @param durationNanos measured duration
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge computed on read. An existing gauge with the same name is replaced.
     *
     * @param name metric name (e.g., "cache.automata.current.count")
     * @param valueSupplier fast, non-blocking value source
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a gauge; no-op if absent.
     */
    void removeGauge(String name);
}
