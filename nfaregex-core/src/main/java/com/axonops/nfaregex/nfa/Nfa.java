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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Non-deterministic finite automaton.
 *
 * <p>Owns a set of {@link State}s and designates an input and an output state. Whenever input or
 * output is non-null it is a member of the owned set. Either may be null after the automaton was
 * emptied by {@link #merge(Nfa)}, {@link #acquireStates(Nfa)} or {@link #clear()}.
 *
 * <p>Ownership: a state belongs to exactly one automaton. {@link #merge(Nfa)} and
 * {@link #acquireStates(Nfa)} move states between automata and leave the source empty. There is
 * no copy constructor; {@link #duplicate()} is the explicit deep copy and never shares states
 * with its source.
 *
 * <p>NOT Thread-Safe while being built. Once construction is finished the graph is read-only and
 * may be shared by any number of {@link NfaRunner}s, one per thread.
 *
 * @since 1.0.0
 */
public final class Nfa {
    private static final Logger logger = LoggerFactory.getLogger(Nfa.class);

    private final Set<State> states = new LinkedHashSet<>();
    private State input;
    private State output;

    /**
     * Creates an automaton with a fresh input and output state and no transitions.
     */
    public Nfa() {
        this(true);
    }

    private Nfa(boolean withEndpoints) {
        if (withEndpoints) {
            setInput(new State());
            setOutput(new State());
        }
    }

    /**
     * Deep copy. States are cloned, every edge is rewritten through an old-to-new mapping and
     * edges leading out of this automaton are dropped.
     *
     * @return independent automaton with the same matching behaviour
     */
    public Nfa duplicate() {
        Map<State, State> translation = new HashMap<>();
        Nfa result = new Nfa(false);

        for (State state : states) {
            State copy = state.copy();
            translation.put(state, copy);
            result.insertState(copy);
        }

        for (State copy : result.states) {
            copy.translate(translation, true);
        }

        result.input = input != null ? translation.get(input) : null;
        result.output = output != null ? translation.get(output) : null;

        logger.trace("NFA: Duplicated automaton - states: {}", states.size());
        return result;
    }

    /**
     * Creates a state owned by this automaton.
     */
    public State newState() {
        State state = new State();
        insertState(state);
        return state;
    }

    /**
     * Takes ownership of {@code state}, removing it from its previous owner first.
     */
    public void insertState(State state) {
        Objects.requireNonNull(state, "state cannot be null");
        if (state.owner() != this) {
            if (state.owner() != null) {
                state.owner().removeState(state);
            }
            state.setOwner(this);
            states.add(state);
        }
    }

    /**
     * Detaches {@code state} if this automaton owns it. Input and output are cleared when they
     * refer to the removed state.
     */
    public void removeState(State state) {
        if (state != null && state.owner() == this) {
            state.setOwner(null);
            if (state == input) {
                input = null;
            }
            if (state == output) {
                output = null;
            }
            states.remove(state);
        }
    }

    /**
     * Detaches every state, including input and output.
     */
    public void clear() {
        input = null;
        output = null;
        for (State state : states) {
            state.setOwner(null);
        }
        states.clear();
    }

    /**
     * @return read-only view of the owned states
     */
    public Set<State> states() {
        return Collections.unmodifiableSet(states);
    }

    public int size() {
        return states.size();
    }

    public boolean contains(State state) {
        return states.contains(state);
    }

    /**
     * Subset construction is not available.
     *
     * @throws UnsupportedOperationException always
     */
    public void makeDeterministic() {
        throw new UnsupportedOperationException("NFA: Determinization is not supported");
    }

    /**
     * Appends {@code other} to this automaton, emptying it in the process.
     *
     * <p>This output state and the input state of {@code other} are fused: the surviving state
     * (this output) receives the edges of the discarded one and edges into the discarded state
     * are redirected to it. All remaining states of {@code other} are adopted and its output
     * becomes this output.
     *
     * @param other automaton to append, must differ from this
     * @return false (and no change) if the automata are the same or either lacks input or output
     */
    public boolean merge(Nfa other) {
        if (other == null || other == this
            || input == null || output == null
            || other.input == null || other.output == null) {
            logger.trace("NFA: Merge rejected - missing endpoint or self merge");
            return false;
        }

        State survivor = output;
        State discarded = other.input;
        State newOutput = other.output == discarded ? survivor : other.output;

        survivor.absorb(discarded);
        other.removeState(discarded);

        Map<State, State> redirect = Map.of(discarded, survivor);
        survivor.translate(redirect, false);
        for (State state : other.states) {
            state.translate(redirect, false);
        }

        acquireStates(other);
        output = newOutput;
        return true;
    }

    /**
     * Moves every state of {@code other} into this automaton without changing any edge.
     * {@code other} ends with no states and null input and output.
     */
    public void acquireStates(Nfa other) {
        if (other == null || other == this) {
            return;
        }
        other.input = null;
        other.output = null;
        for (State state : other.states) {
            state.setOwner(this);
        }
        states.addAll(other.states);
        other.states.clear();
    }

    public State input() {
        return input;
    }

    /**
     * Sets the input state, taking ownership of it.
     */
    public void setInput(State state) {
        if (state != null) {
            insertState(state);
        }
        input = state;
    }

    public State output() {
        return output;
    }

    /**
     * Sets the output state, taking ownership of it.
     */
    public void setOutput(State state) {
        if (state != null) {
            insertState(state);
        }
        output = state;
    }

    @Override
    public String toString() {
        return "Nfa[states=" + states.size()
            + ", input=" + (input != null) + ", output=" + (output != null) + "]";
    }
}
