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
 * Zero or more repetitions: {@code a*}.
 */
public final class KleeneStar extends UnaryNode {

    public KleeneStar(Node child) {
        super(child);
    }

    @Override
    protected Nfa build(Nfa childGraph) {
        Nfa result = new Nfa();
        result.input().addTransition(result.output());
        result.input().addTransition(childGraph.input());
        childGraph.output().addTransition(childGraph.input());
        childGraph.output().addTransition(result.output());
        result.acquireStates(childGraph);
        return result;
    }
}
