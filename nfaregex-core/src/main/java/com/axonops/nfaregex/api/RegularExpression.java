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

import com.axonops.nfaregex.metrics.MetricNames;
import com.axonops.nfaregex.metrics.RegexMetricsRegistry;
import com.axonops.nfaregex.nfa.Nfa;
import com.axonops.nfaregex.nfa.NfaRunner;
import com.axonops.nfaregex.parser.Parser;
import com.axonops.nfaregex.parser.SimpleParser;
import com.axonops.nfaregex.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A regular expression: pattern text plus its lazily compiled automaton.
 *
 * <p>The pattern is compiled on first use and kept until {@link #setPattern(String)} replaces it.
 * Compilation goes through the {@link Parser} strategy given at construction (a permissive
 * {@link SimpleParser} by default).
 *
 * <p>NOT Thread-Safe: the pattern and the parser are mutable. The compiled automaton is never
 * modified once built, and every match runs its own {@link NfaRunner}.
 *
 * <pre>{@code
 * RegularExpression re = new RegularExpression("ab*");
 * re.fullMatch("abbb");   // true
 * re.fullMatch("b");      // false
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RegularExpression {
    private static final Logger logger = LoggerFactory.getLogger(RegularExpression.class);

    private final Parser parser;
    private String pattern;
    private Nfa compiled;

    public RegularExpression(String pattern) {
        this(pattern, null);
    }

    /**
     * @param pattern pattern text
     * @param parser parser strategy, null for the default permissive parser
     */
    public RegularExpression(String pattern, Parser parser) {
        this.parser = parser != null ? parser : new SimpleParser();
        setPattern(pattern);
    }

    /**
     * Wraps an automaton compiled elsewhere (e.g. taken from the cache).
     */
    RegularExpression(String pattern, Parser parser, Nfa compiled) {
        this(pattern, parser);
        this.compiled = Objects.requireNonNull(compiled, "compiled cannot be null");
    }

    /**
     * Replaces the pattern and drops the compiled automaton.
     */
    public void setPattern(String pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern cannot be null");
        this.compiled = null;
    }

    public String pattern() {
        return pattern;
    }

    public Parser parser() {
        return parser;
    }

    /**
     * Compiles the pattern unless it is already compiled.
     *
     * @throws PatternCompilationException if the parser reports an error
     */
    public void compile() {
        if (compiled == null) {
            compiled = compile(parser, pattern, metrics());
        }
    }

    public boolean isCompiled() {
        return compiled != null;
    }

    /**
     * Tests if the entire input matches the pattern.
     *
     * @param input input text
     * @return true if the automaton accepts the whole input
     * @throws PatternCompilationException if compilation is needed and the parser reports an error
     */
    public boolean fullMatch(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");
        compile();

        RegexMetricsRegistry metrics = metrics();
        long startNanos = System.nanoTime();
        boolean result = new NfaRunner(compiled).accept(input);
        metrics.recordTimer(MetricNames.MATCHING_FULL_MATCH_LATENCY, System.nanoTime() - startNanos);
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        return result;
    }

    /**
     * Creates a runner over the compiled automaton for incremental matching.
     *
     * @return a new runner positioned before the first character
     */
    public NfaRunner runner() {
        compile();
        return new NfaRunner(compiled);
    }

    @Override
    public String toString() {
        return pattern;
    }

    /**
     * Parses and builds {@code pattern} with {@code parser}, recording metrics.
     */
    static Nfa compile(Parser parser, String pattern, RegexMetricsRegistry metrics) {
        String hash = PatternHasher.hash(pattern);
        long startNanos = System.nanoTime();

        Nfa nfa = parser.compile(pattern);
        if (parser.error()) {
            metrics.incrementCounter(MetricNames.ERRORS_PARSE_FAILED);
            logger.debug("NFA: Pattern compilation failed - hash: {}, issues: {}", hash, parser.issues());
            throw new PatternCompilationException(pattern, parser.issues());
        }

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.AUTOMATA_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.AUTOMATA_COMPILED);
        logger.trace("NFA: Pattern compiled - hash: {}, length: {}, states: {}, timeNs: {}",
            hash, pattern.length(), nfa.size(), durationNanos);
        return nfa;
    }

    private static RegexMetricsRegistry metrics() {
        return Regex.getGlobalCache().getConfig().metricsRegistry();
    }
}
