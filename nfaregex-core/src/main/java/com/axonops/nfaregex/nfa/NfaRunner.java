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

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Simulates an {@link Nfa} over an input, one character at a time.
 *
 * <p>The runner keeps the set of simultaneously active states, always closed under epsilon
 * transitions. It never modifies the automaton.
 *
 * <p>NOT Thread-Safe: each thread needs its own runner. The automaton itself can be shared.
 *
 * <pre>{@code
 * NfaRunner runner = new NfaRunner(nfa);
 * for (char c : "abb".toCharArray()) {
 *     runner.step(c);
 * }
 * boolean matched = runner.acceptable();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class NfaRunner {

    private final Nfa nfa;
    private Set<State> state;

    /**
     * Creates a runner positioned before the first character: the active set is the closure of
     * the input state (empty if the automaton has none).
     */
    public NfaRunner(Nfa nfa) {
        this.nfa = Objects.requireNonNull(nfa, "nfa cannot be null");
        reset();
    }

    public Nfa nfa() {
        return nfa;
    }

    /**
     * @return read-only view of the active states
     */
    public Set<State> state() {
        return Collections.unmodifiableSet(state);
    }

    /**
     * Replaces the active set with the epsilon closure of {@code seed}.
     */
    public void setState(Collection<State> seed) {
        state = epsilonClosure(seed);
    }

    /**
     * Returns to the initial active set.
     */
    public void reset() {
        State input = nfa.input();
        state = input != null ? epsilonClosure(Collections.singleton(input)) : new LinkedHashSet<>();
    }

    /**
     * Consumes one character.
     */
    public void step(char c) {
        state = expand(state, c);
    }

    /**
     * @return true if the output state is active, i.e. the consumed prefix is accepted
     */
    public boolean acceptable() {
        State output = nfa.output();
        return output != null && state.contains(output);
    }

    /**
     * @return true if no state is active; no further input can lead to acceptance
     */
    public boolean isDead() {
        return state.isEmpty();
    }

    /**
     * Runs the whole input from the initial state.
     *
     * @param input characters to consume
     * @return true if the automaton accepts the entire input
     */
    public boolean accept(CharSequence input) {
        Objects.requireNonNull(input, "input cannot be null");
        reset();
        for (int i = 0; i < input.length(); i++) {
            step(input.charAt(i));
            if (isDead()) {
                return false;
            }
        }
        return acceptable();
    }

    /**
     * Computes the set of states reachable from {@code seed} through epsilon transitions only,
     * {@code seed} included. Terminates on epsilon cycles.
     *
     * @param seed starting states, null elements are skipped
     * @return a new closed set
     */
    public static Set<State> epsilonClosure(Collection<State> seed) {
        Set<State> closure = new LinkedHashSet<>();
        Deque<State> worklist = new ArrayDeque<>();
        for (State s : seed) {
            if (s != null && closure.add(s)) {
                worklist.add(s);
            }
        }

        while (!worklist.isEmpty()) {
            State current = worklist.poll();
            for (State adjacent : current.epsilonTransitions()) {
                if (closure.add(adjacent)) {
                    worklist.add(adjacent);
                }
            }
        }
        return closure;
    }

    /**
     * Follows every conditioned transition accepting {@code c} from {@code source}, then closes
     * the result under epsilon transitions.
     */
    public static Set<State> expand(Collection<State> source, char c) {
        Set<State> next = new LinkedHashSet<>();
        for (State s : source) {
            next.addAll(s.nextStates(c));
        }
        return epsilonClosure(next);
    }
}
