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
 * Concatenation: {@code ab}.
 *
 * <p>The output of the left fragment is fused with the input of the right one. If one side is
 * missing the other side is used as is.
 */
public final class Concat extends BinaryNode {

    public Concat(Node left, Node right) {
        super(left, right);
    }

    @Override
    public Nfa build() {
        if (left == null && right == null) {
            return new Nfa();
        }
        if (right == null) {
            return left.build();
        }
        if (left == null) {
            return right.build();
        }

        Nfa leftGraph = left.build();
        Nfa rightGraph = right.build();
        if (!leftGraph.merge(rightGraph)) {
            throw new IllegalStateException("NFA: Fragment without endpoints in " + this);
        }
        return leftGraph;
    }
}
