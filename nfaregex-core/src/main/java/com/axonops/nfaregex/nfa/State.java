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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Automaton state.
 *
 * <p>Holds conditioned transitions and epsilon (unconditioned) transitions to other states. The
 * owner reference is bookkeeping only: the owning {@link Nfa} keeps it in sync when states are
 * inserted, removed, merged or acquired. A state belongs to at most one automaton at a time.
 *
 * <p>Identity semantics: two states are equal only if they are the same object.
 *
 * @since 1.0.0
 */
public final class State {

    private final List<Transition> transitions = new ArrayList<>();
    private final Set<State> epsilonTransitions = new LinkedHashSet<>();
    private Nfa owner;

    State() {
    }

    /**
     * Adds an epsilon transition. A null target is ignored.
     */
    public void addTransition(State target) {
        if (target != null) {
            epsilonTransitions.add(target);
        }
    }

    /**
     * Adds a conditioned transition. Ignored if either argument is null.
     */
    public void addTransition(State target, CharCondition condition) {
        if (target != null && condition != null) {
            transitions.add(new Transition(target, condition));
        }
    }

    public void addTransition(Transition transition) {
        transitions.add(Objects.requireNonNull(transition, "transition cannot be null"));
    }

    /**
     * @return read-only view of the epsilon targets
     */
    public Set<State> epsilonTransitions() {
        return Collections.unmodifiableSet(epsilonTransitions);
    }

    /**
     * @return read-only view of the conditioned transitions
     */
    public List<Transition> transitions() {
        return Collections.unmodifiableList(transitions);
    }

    /**
     * Returns the states directly reachable by consuming {@code c}. Epsilon transitions are not
     * followed.
     */
    public Set<State> nextStates(char c) {
        Set<State> result = new LinkedHashSet<>();
        for (Transition transition : transitions) {
            if (transition.condition().matches(c)) {
                result.add(transition.target());
            }
        }
        return result;
    }

    /**
     * @return the automaton owning this state, or null if detached
     */
    public Nfa owner() {
        return owner;
    }

    void setOwner(Nfa owner) {
        this.owner = owner;
    }

    /**
     * Unions the outgoing edges of {@code other} into this state.
     */
    void absorb(State other) {
        transitions.addAll(other.transitions);
        epsilonTransitions.addAll(other.epsilonTransitions);
    }

    /**
     * Replaces every edge target found in {@code translation} by its mapped state.
     *
     * @param translation old target to new target
     * @param dropUnmapped if true, edges whose target is not mapped are removed
     */
    void translate(Map<State, State> translation, boolean dropUnmapped) {
        List<State> oldEpsilon = new ArrayList<>(epsilonTransitions);
        epsilonTransitions.clear();
        for (State target : oldEpsilon) {
            State mapped = translation.get(target);
            if (mapped != null) {
                epsilonTransitions.add(mapped);
            } else if (!dropUnmapped) {
                epsilonTransitions.add(target);
            }
        }

        List<Transition> oldTransitions = new ArrayList<>(transitions);
        transitions.clear();
        for (Transition transition : oldTransitions) {
            State mapped = translation.get(transition.target());
            if (mapped != null) {
                transitions.add(transition.withTarget(mapped));
            } else if (!dropUnmapped) {
                transitions.add(transition);
            }
        }
    }

    /**
     * Detached copy with the same edges (still pointing at the original targets).
     */
    State copy() {
        State copy = new State();
        copy.transitions.addAll(transitions);
        copy.epsilonTransitions.addAll(epsilonTransitions);
        return copy;
    }

    @Override
    public String toString() {
        return "State@" + Integer.toHexString(System.identityHashCode(this))
            + "[transitions=" + transitions.size() + ", epsilon=" + epsilonTransitions.size() + "]";
    }
}
