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
package com.axonops.nfaregex.api;

import com.axonops.nfaregex.cache.AutomatonCache;
import com.axonops.nfaregex.cache.CacheStatistics;
import com.axonops.nfaregex.cache.RegexConfig;
import com.axonops.nfaregex.nfa.Nfa;
import com.axonops.nfaregex.parser.Parser;
import com.axonops.nfaregex.parser.SimpleParser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for regex operations.
 *
 * <p>Patterns compiled here go through a global {@link AutomatonCache}; each returned
 * {@link RegularExpression} gets its own copy of the cached automaton.
 *
 * <p>Thread-safe: all methods can be called concurrently.
 *
 * @since 1.0.0
 */
public final class Regex {

    // Global automaton cache (mutable for testing and configuration)
    private static volatile AutomatonCache cache = new AutomatonCache(RegexConfig.DEFAULT);

    private Regex() {
        // Utility class
    }

    /**
     * Compiles a pattern using the global cache and configuration.
     *
     * @param pattern pattern text
     * @return compiled expression owned by the caller
     * @throws PatternCompilationException if strict parsing is configured and the pattern is malformed
     */
    public static RegularExpression compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        AutomatonCache current = cache;
        RegexConfig config = current.getConfig();
        Parser parser = config.strictParsing() ? SimpleParser.strict() : new SimpleParser();

        Nfa nfa = current.getOrCompile(pattern,
            () -> RegularExpression.compile(parser, pattern, config.metricsRegistry()));
        return new RegularExpression(pattern, parser, nfa);
    }

    // ========== Matching Operations ==========

    /**
     * Tests if the entire input matches the pattern (full match).
     *
     * @param pattern regex pattern
     * @param input input text
     * @return true if entire input matches, false otherwise
     */
    public static boolean fullMatch(String pattern, CharSequence input) {
        return compile(pattern).fullMatch(input);
    }

    /**
     * Tests multiple inputs against pattern (bulk full match).
     *
     * @param pattern regex pattern
     * @param inputs array of input strings
     * @return boolean array (parallel to inputs)
     */
    public static boolean[] matchAll(String pattern, String[] inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        RegularExpression re = compile(pattern);
        boolean[] results = new boolean[inputs.length];
        for (int i = 0; i < inputs.length; i++) {
            results[i] = re.fullMatch(inputs[i]);
        }
        return results;
    }

    /**
     * Tests multiple inputs against pattern (bulk full match).
     *
     * @param pattern regex pattern
     * @param inputs collection of input strings
     * @return boolean array (parallel to inputs, in iteration order)
     */
    public static boolean[] matchAll(String pattern, Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        return matchAll(pattern, inputs.toArray(new String[0]));
    }

    /**
     * Filters collection to only strings fully matching the pattern.
     *
     * @param pattern regex pattern
     * @param inputs collection to filter
     * @return new list containing only matching strings
     */
    public static List<String> filter(String pattern, Collection<String> inputs) {
        return select(pattern, inputs, true);
    }

    /**
     * Filters collection to only strings NOT fully matching the pattern.
     *
     * @param pattern regex pattern
     * @param inputs collection to filter
     * @return new list containing only non-matching strings
     */
    public static List<String> filterNot(String pattern, Collection<String> inputs) {
        return select(pattern, inputs, false);
    }

    private static List<String> select(String pattern, Collection<String> inputs, boolean matching) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        RegularExpression re = compile(pattern);
        List<String> result = new ArrayList<>();
        for (String input : inputs) {
            if (re.fullMatch(input) == matching) {
                result.add(input);
            }
        }
        return result;
    }

    // ========== Cache Management ==========

    public static AutomatonCache getGlobalCache() {
        return cache;
    }

    /**
     * Replaces the global cache (for testing and custom wiring). The previous cache is left as is.
     */
    public static void setGlobalCache(AutomatonCache newCache) {
        cache = Objects.requireNonNull(newCache, "cache cannot be null");
    }

    /**
     * Replaces the global cache with a new one built from {@code config}. The previous cache is
     * shut down first, so its gauges are released before the new ones register.
     */
    public static synchronized void configure(RegexConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        cache.shutdown();
        cache = new AutomatonCache(config);
    }

    /**
     * Empties the global cache and resets its statistics.
     */
    public static void resetCache() {
        AutomatonCache current = cache;
        current.clear();
        current.resetStatistics();
    }

    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }
}
