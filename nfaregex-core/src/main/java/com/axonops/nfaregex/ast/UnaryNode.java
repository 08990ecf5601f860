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
 * Node with a single child. A missing child builds an automaton that matches nothing.
 */
public abstract class UnaryNode extends Node {

    protected final Node child;

    protected UnaryNode(Node child) {
        this.child = child;
    }

    public Node child() {
        return child;
    }

    @Override
    public final Nfa build() {
        if (child == null) {
            return new Nfa();
        }
        return build(child.build());
    }

    /**
     * Wraps the already built child fragment.
     *
     * @param childGraph fragment of the child, owned by this call
     */
    protected abstract Nfa build(Nfa childGraph);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + child + ")";
    }
}
