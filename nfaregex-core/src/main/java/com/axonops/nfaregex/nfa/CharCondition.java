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

package com.axonops.nfaregex.nfa;

import java.util.Objects;

/**
 * Predicate over a single input character, attached to a {@link Transition}.
 *
 * <p>Three kinds exist:
 * <ul>
 *   <li>{@link AnyChar} - accepts every character ({@code .})</li>
 *   <li>{@link ExactChar} - accepts one character (literals and escapes)</li>
 *   <li>{@link CharSet} - accepts members of a set, or non-members when negated ({@code [...]})</li>
 * </ul>
 *
 * <p>Conditions are immutable values and can be shared between automata.
 *
 * @since 1.0.0
 */
public interface CharCondition {

    /**
     * Tests whether this condition accepts the character.
     *
     * @param c input character
     * @return true if a transition guarded by this condition may be taken on {@code c}
     */
    boolean matches(char c);

    static CharCondition any() {
        return AnyChar.INSTANCE;
    }

    static CharCondition exactly(char c) {
        return new ExactChar(c);
    }

    static CharCondition oneOf(String members) {
        return new CharSet(members, false);
    }

    static CharCondition noneOf(String members) {
        return new CharSet(members, true);
    }

    /** Accepts every character. */
    final class AnyChar implements CharCondition {
        static final AnyChar INSTANCE = new AnyChar();

        private AnyChar() {
        }

        @Override
        public boolean matches(char c) {
            return true;
        }

        @Override
        public String toString() {
            return ".";
        }
    }

    /** Accepts exactly one character. */
    record ExactChar(char value) implements CharCondition {

        @Override
        public boolean matches(char c) {
            return c == value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * Accepts the characters in {@code members}, or every other character when {@code negated}.
     */
    record CharSet(String members, boolean negated) implements CharCondition {

        public CharSet {
            Objects.requireNonNull(members, "members cannot be null");
        }

        @Override
        public boolean matches(char c) {
            return (members.indexOf(c) >= 0) != negated;
        }

        @Override
        public String toString() {
            return (negated ? "[^" : "[") + members + "]";
        }
    }
}
