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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Dropwizard Metrics adapter.
 *
 * <p>Delegates every metric to a {@link MetricRegistry}, under a dot-separated prefix:
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * RegexMetricsRegistry metrics = new DropwizardMetricsAdapter(registry, "com.myapp.regex");
 * // counters appear as com.myapp.regex.automata.compiled.total.count, ...
 * }</pre>
 *
 * <p>Thread-safe, as are all Dropwizard metric types.
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements RegexMetricsRegistry {

    public static final String DEFAULT_PREFIX = "com.axonops.nfaregex";

    private final MetricRegistry registry;
    private final String prefix;

    /**
     * Creates adapter with the default prefix {@value #DEFAULT_PREFIX}.
     */
    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry the Dropwizard registry to register metrics with
     * @param prefix metric name prefix (e.g., "com.myapp.regex")
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<Number> valueSupplier) {
        String fullName = metricName(name);

        // Replace, registering twice under one name throws
        registry.remove(fullName);
        registry.register(fullName, (Gauge<Number>) valueSupplier::get);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(metricName(name));
    }

    public String prefix() {
        return prefix;
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
