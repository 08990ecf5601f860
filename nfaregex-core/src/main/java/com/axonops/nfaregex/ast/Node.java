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

import com.axonops.nfaregex.nfa.Nfa;

/**
 * Node of the parsed expression tree.
 *
 * <p>Nodes are immutable and own their children. The tree only lives between parsing and
 * compilation: {@link #build()} transfers everything it describes into an automaton, after which
 * the tree is discarded.
 *
 * @since 1.0.0
 */
public abstract class Node {

    /**
     * Builds the automaton fragment for this subtree.
     *
     * <p>The result always has an input and an output state; its other states are private to the
     * fragment. Each call produces a new, independent automaton.
     *
     * @return fragment owned by the caller
     */
    public abstract Nfa build();
}
