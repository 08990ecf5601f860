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
 * Alternation: {@code a|b}.
 *
 * <p>A fresh input state forks into both sides and both sides join into a fresh output state. A
 * missing side contributes no path.
 */
public final class Choice extends BinaryNode {

    public Choice(Node left, Node right) {
        super(left, right);
    }

    @Override
    public Nfa build() {
        Nfa graph = new Nfa();
        attach(graph, left);
        attach(graph, right);
        return graph;
    }

    private static void attach(Nfa graph, Node side) {
        if (side == null) {
            return;
        }
        Nfa sideGraph = side.build();
        graph.input().addTransition(sideGraph.input());
        sideGraph.output().addTransition(graph.output());
        graph.acquireStates(sideGraph);
    }
}
