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

package com.axonops.nfaregex.parser;

import com.axonops.nfaregex.ast.Node;
import com.axonops.nfaregex.nfa.NfaRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the default recursive-descent parser.
 */
@DisplayName("SimpleParser")
class SimpleParserTest {

    // ========== Tree Shape ==========

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiterString = "=>", value = {
        "a => a",
        "ab => Concat(a, b)",
        "abc => Concat(Concat(a, b), c)",
        "a|b => Choice(a, b)",
        "a|b|c => Choice(Choice(a, b), c)",
        "ab|c => Choice(Concat(a, b), c)",
        "ab* => Concat(a, KleeneStar(b))",
        "a+b? => Concat(KleenePlus(a), Optional(b))",
        "(ab)+ => KleenePlus(Subexpression(Concat(a, b)))",
        "(?:ab)? => Optional(Concat(a, b))",
        "a.c => Concat(Concat(a, .), c)",
        "\\* => *",
        "\\.\\\\ => Concat(., \\)",
        "[abc] => [abc]",
        "[^abc] => [^abc]",
        "[a-d] => [abcd]",
        "[-a] => [-a]",
        "[a-] => [a-]",
        "[a\\]b] => [a]b]",
        "a()b => Concat(a, b)"
    })
    void parse_buildsExpectedTree(String pattern, String expected) {
        SimpleParser parser = new SimpleParser();

        Node node = parse(parser, pattern);

        assertThat(node).hasToString(expected);
        assertThat(parser.error()).isFalse();
    }

    @Test
    void emptyPattern_producesNoTree() {
        SimpleParser parser = new SimpleParser();

        assertThat(parse(parser, "")).isNull();
        assertThat(parser.issues()).isEmpty();
    }

    @Test
    void emptyPattern_compilesToAutomatonMatchingNothing() {
        SimpleParser parser = new SimpleParser();

        NfaRunner runner = new NfaRunner(parser.compile(""));

        assertThat(runner.accept("")).isFalse();
        assertThat(runner.accept("a")).isFalse();
    }

    // ========== Malformed Input ==========

    @ParameterizedTest(name = "{0} -> {1} ({2})")
    @CsvSource(delimiterString = "=>", value = {
        "a\\ => a => dangling escape",
        "a| => a => trailing",
        "a** => Concat(KleeneStar(a), *) => nothing to repeat",
        "*a => Concat(*, a) => nothing to repeat",
        "(a => Subexpression(a) => unterminated group",
        "a)b => a => unmatched",
        "[abc => [abc] => unterminated character class",
        "[z-a] => [] => reversed range",
        "(?a) => Subexpression(a) => unsupported group modifier",
        "(|a) => Subexpression(Choice(null, a)) => empty alternative",
        "a(?:) => a => empty group"
    })
    void malformedPattern_isAbsorbedAndRecorded(String pattern, String expected, String issue) {
        SimpleParser parser = new SimpleParser();

        Node node = parse(parser, pattern);

        assertThat(node).hasToString(expected);
        assertThat(parser.issues()).extracting(SyntaxIssue::message)
            .anySatisfy(message -> assertThat(message).contains(issue));
        assertThat(parser.error()).isFalse();
    }

    @Test
    void emptyGroup_producesNoTree() {
        SimpleParser parser = new SimpleParser();

        assertThat(parse(parser, "()")).isNull();
        assertThat(parser.issues()).extracting(SyntaxIssue::message).containsExactly("empty group");
    }

    @Test
    void issue_recordsPosition() {
        SimpleParser parser = new SimpleParser();

        parse(parser, "ab\\");

        assertThat(parser.issues()).containsExactly(
            new SyntaxIssue(2, "dangling escape at end of pattern"));
        assertThat(parser.issues().get(0)).hasToString("dangling escape at end of pattern at index 2");
    }

    @Test
    void issues_areClearedBetweenPatterns() {
        SimpleParser parser = new SimpleParser();

        parse(parser, "(a");
        assertThat(parser.issues()).isNotEmpty();

        parse(parser, "a");
        assertThat(parser.issues()).isEmpty();
    }

    @Test
    void bracketNegation_invertsMembership() {
        SimpleParser parser = new SimpleParser();
        NfaRunner runner = new NfaRunner(parser.compile("[^abc]"));

        assertThat(runner.accept("a")).isFalse();
        assertThat(runner.accept("d")).isTrue();
        assertThat(runner.accept("")).isFalse();
    }

    // ========== Strict Mode ==========

    @Test
    void strictParser_reportsErrorOnIssue() {
        SimpleParser parser = SimpleParser.strict();

        parser.compile("(ab");

        assertThat(parser.isStrict()).isTrue();
        assertThat(parser.error()).isTrue();
        assertThat(parser.issues()).hasSize(1);
    }

    @Test
    void strictParser_acceptsWellFormedPattern() {
        SimpleParser parser = SimpleParser.strict();

        parser.compile("(a|b)*c");

        assertThat(parser.error()).isFalse();
    }

    @Test
    void compile_rejectsNullSource() {
        assertThatThrownBy(() -> new SimpleParser().compile(null))
            .isInstanceOf(NullPointerException.class);
    }

    private static Node parse(SimpleParser parser, String pattern) {
        return parser.parse(new PatternReader(pattern));
    }
}
