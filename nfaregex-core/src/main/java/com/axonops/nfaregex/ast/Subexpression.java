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
 * Capturing group: {@code (a)}.
 *
 * <p>Groups are kept in the tree but do not record anything at match time, so the fragment is the
 * child's own.
 */
public final class Subexpression extends UnaryNode {

    public Subexpression(Node child) {
        super(child);
    }

    @Override
    protected Nfa build(Nfa childGraph) {
        return childGraph;
    }
}
