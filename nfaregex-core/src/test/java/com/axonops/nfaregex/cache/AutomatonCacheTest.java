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

import com.axonops.nfaregex.nfa.Nfa;
import com.axonops.nfaregex.nfa.NfaRunner;
import com.axonops.nfaregex.parser.SimpleParser;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

class AutomatonCacheTest {

    @Test
    void getOrCompile_compilesOncePerPattern() {
        AutomatonCache cache = new AutomatonCache(RegexConfig.DEFAULT);
        AtomicInteger compilations = new AtomicInteger();

        cache.getOrCompile("ab", compiler("ab", compilations));
        cache.getOrCompile("ab", compiler("ab", compilations));

        assertThat(compilations.get()).isEqualTo(1);
        assertThat(cache.getStatistics().hits()).isEqualTo(1);
        assertThat(cache.getStatistics().misses()).isEqualTo(1);
    }

    @Test
    void getOrCompile_returnsCopiesOfStoredAutomaton() {
        AutomatonCache cache = new AutomatonCache(RegexConfig.DEFAULT);

        Nfa first = cache.getOrCompile("ab", compiler("ab", new AtomicInteger()));
        first.clear();
        Nfa second = cache.getOrCompile("ab", compiler("ab", new AtomicInteger()));

        assertThat(new NfaRunner(second).accept("ab")).isTrue();
    }

    @Test
    void eviction_removesLeastRecentlyUsed() {
        AutomatonCache cache = new AutomatonCache(RegexConfig.builder().maxCacheSize(2).build());
        AtomicInteger compilations = new AtomicInteger();

        cache.getOrCompile("a", compiler("a", compilations));
        cache.getOrCompile("b", compiler("b", compilations));
        cache.getOrCompile("a", compiler("a", compilations));
        cache.getOrCompile("c", compiler("c", compilations));

        assertThat(cache.contains("a")).isTrue();
        assertThat(cache.contains("b")).isFalse();
        assertThat(cache.contains("c")).isTrue();
        assertThat(cache.getStatistics().evictions()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void statistics_trackCachedStates() {
        AutomatonCache cache = new AutomatonCache(RegexConfig.DEFAULT);

        cache.getOrCompile("ab", compiler("ab", new AtomicInteger()));
        cache.getOrCompile("a", compiler("a", new AtomicInteger()));

        CacheStatistics stats = cache.getStatistics();
        assertThat(stats.cachedStates()).isEqualTo(5);
        assertThat(stats.maxSize()).isEqualTo(10000);

        cache.clear();
        assertThat(cache.getStatistics().cachedStates()).isZero();
    }

    @Test
    void compilerFailure_leavesCacheUnchanged() {
        AutomatonCache cache = new AutomatonCache(RegexConfig.DEFAULT);

        assertThatThrownBy(() -> cache.getOrCompile("x", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.contains("x")).isFalse();
        assertThat(cache.size()).isZero();
    }

    @Test
    void disabledCache_neverStores() {
        AutomatonCache cache = new AutomatonCache(RegexConfig.NO_CACHE);
        AtomicInteger compilations = new AtomicInteger();

        cache.getOrCompile("a", compiler("a", compilations));
        cache.getOrCompile("a", compiler("a", compilations));

        assertThat(compilations.get()).isEqualTo(2);
        assertThat(cache.size()).isZero();
        assertThat(cache.getStatistics().maxSize()).isZero();
    }

    @Test
    void resetStatistics_keepsEntries() {
        AutomatonCache cache = new AutomatonCache(RegexConfig.DEFAULT);
        cache.getOrCompile("a", compiler("a", new AtomicInteger()));

        cache.resetStatistics();

        assertThat(cache.getStatistics().totalRequests()).isZero();
        assertThat(cache.contains("a")).isTrue();
    }

    @Test
    void cacheStatistics_rates() {
        CacheStatistics stats = new CacheStatistics(3, 1, 0, 2, 8, 10);

        assertThat(stats.totalRequests()).isEqualTo(4);
        assertThat(stats.hitRate()).isEqualTo(0.75);
        assertThat(stats.missRate()).isEqualTo(0.25);
        assertThat(stats.utilization()).isEqualTo(0.25);
        assertThat(new CacheStatistics(0, 0, 0, 0, 0, 0).hitRate()).isZero();
    }

    private static Supplier<Nfa> compiler(String pattern, AtomicInteger counter) {
        return () -> {
            counter.incrementAndGet();
            return new SimpleParser().compile(pattern);
        };
    }
}
