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

package com.axonops.nfaregex.ast;

import com.axonops.nfaregex.nfa.CharCondition;
import com.axonops.nfaregex.nfa.Nfa;
import com.axonops.nfaregex.nfa.NfaRunner;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for fragment construction of each node kind.
 */
class NodeBuildTest {

    private static final Node A = new SingleCharacter('a');
    private static final Node B = new SingleCharacter('b');

    @Test
    void leaf_acceptsExactlyOneMatchingCharacter() {
        Nfa nfa = new Leaf(CharCondition.oneOf("xy")).build();

        assertThat(accepts(nfa, "x")).isTrue();
        assertThat(accepts(nfa, "y")).isTrue();
        assertThat(accepts(nfa, "z")).isFalse();
        assertThat(accepts(nfa, "")).isFalse();
        assertThat(accepts(nfa, "xy")).isFalse();
        assertThat(nfa.size()).isEqualTo(2);
    }

    @Test
    void concat_acceptsConcatenation() {
        Nfa nfa = new Concat(A, B).build();

        assertThat(accepts(nfa, "ab")).isTrue();
        assertThat(accepts(nfa, "a")).isFalse();
        assertThat(accepts(nfa, "ba")).isFalse();
        assertThat(nfa.size()).isEqualTo(3);
    }

    @Test
    void concat_withMissingSide_buildsOtherSide() {
        assertThat(accepts(new Concat(A, null).build(), "a")).isTrue();
        assertThat(accepts(new Concat(null, B).build(), "b")).isTrue();
        assertThat(accepts(new Concat(null, null).build(), "")).isFalse();
    }

    @Test
    void choice_acceptsEitherSide() {
        Nfa nfa = new Choice(A, B).build();

        assertThat(accepts(nfa, "a")).isTrue();
        assertThat(accepts(nfa, "b")).isTrue();
        assertThat(accepts(nfa, "ab")).isFalse();
        assertThat(accepts(nfa, "")).isFalse();
    }

    @Test
    void choice_withMissingSide_contributesNoPath() {
        Nfa nfa = new Choice(null, B).build();

        assertThat(accepts(nfa, "b")).isTrue();
        assertThat(accepts(nfa, "")).isFalse();
    }

    @Test
    void kleeneStar_acceptsZeroOrMoreRepetitions() {
        Nfa nfa = new KleeneStar(A).build();

        assertThat(accepts(nfa, "")).isTrue();
        assertThat(accepts(nfa, "a")).isTrue();
        assertThat(accepts(nfa, "aaaa")).isTrue();
        assertThat(accepts(nfa, "ab")).isFalse();
    }

    @Test
    void kleenePlus_requiresOneRepetition() {
        Nfa nfa = new KleenePlus(A).build();

        assertThat(accepts(nfa, "")).isFalse();
        assertThat(accepts(nfa, "a")).isTrue();
        assertThat(accepts(nfa, "aaa")).isTrue();
    }

    @Test
    void optional_acceptsZeroOrOne() {
        Nfa nfa = new Optional(A).build();

        assertThat(accepts(nfa, "")).isTrue();
        assertThat(accepts(nfa, "a")).isTrue();
        assertThat(accepts(nfa, "aa")).isFalse();
    }

    @Test
    void subexpression_isTransparent() {
        Nfa grouped = new Subexpression(new Concat(A, B)).build();

        assertThat(accepts(grouped, "ab")).isTrue();
        assertThat(accepts(grouped, "a")).isFalse();
    }

    @Test
    void unaryNode_withoutChild_matchesNothing() {
        assertThat(accepts(new KleeneStar(null).build(), "")).isFalse();
        assertThat(accepts(new Optional(null).build(), "")).isFalse();
        assertThat(accepts(new Subexpression(null).build(), "a")).isFalse();
    }

    @Test
    void nestedStar_terminatesOnEpsilonCycles() {
        Nfa nfa = new KleeneStar(new KleeneStar(A)).build();

        assertThat(accepts(nfa, "")).isTrue();
        assertThat(accepts(nfa, "aaa")).isTrue();
        assertThat(accepts(nfa, "b")).isFalse();
    }

    @Test
    void build_returnsFreshAutomatonEachTime() {
        Node node = new Concat(A, new KleeneStar(B));

        Nfa first = node.build();
        Nfa second = node.build();

        assertThat(second.states()).doesNotContainAnyElementsOf(first.states());
        assertThat(accepts(first, "abb")).isTrue();
        assertThat(accepts(second, "abb")).isTrue();
    }

    @Test
    void toString_rendersTreeShape() {
        Node node = new Choice(new Concat(A, new KleeneStar(B)), new Leaf(CharCondition.any()));

        assertThat(node).hasToString("Choice(Concat(a, KleeneStar(b)), .)");
    }

    private static boolean accepts(Nfa nfa, String input) {
        return new NfaRunner(nfa).accept(input);
    }
}
