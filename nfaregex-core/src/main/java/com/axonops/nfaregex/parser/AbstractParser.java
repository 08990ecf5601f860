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
package com.axonops.nfaregex.parser;

import com.axonops.nfaregex.ast.Node;
import com.axonops.nfaregex.nfa.Nfa;

import java.util.Objects;

/**
 * Parser that goes through an expression tree: parse, build the tree, drop the tree.
 */
public abstract class AbstractParser implements Parser {

    @Override
    public Nfa compile(CharSequence source) {
        Objects.requireNonNull(source, "source cannot be null");
        Node parsed = parse(new PatternReader(source));
        if (parsed == null) {
            return new Nfa();
        }
        return parsed.build();
    }

    /**
     * Parses the whole input.
     *
     * @return the tree root, or null if there was nothing to parse
     */
    protected abstract Node parse(PatternReader input);
}
