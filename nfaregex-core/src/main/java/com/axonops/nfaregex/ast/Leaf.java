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

import java.util.Objects;

/**
 * Consumes one character accepted by a {@link CharCondition}.
 */
public class Leaf extends Node {

    private final CharCondition condition;

    public Leaf(CharCondition condition) {
        this.condition = Objects.requireNonNull(condition, "condition cannot be null");
    }

    public CharCondition condition() {
        return condition;
    }

    @Override
    public Nfa build() {
        Nfa graph = new Nfa();
        graph.input().addTransition(graph.output(), condition);
        return graph;
    }

    @Override
    public String toString() {
        return condition.toString();
    }
}
