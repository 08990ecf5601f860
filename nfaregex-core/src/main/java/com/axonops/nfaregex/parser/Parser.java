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

import com.axonops.nfaregex.nfa.Nfa;

import java.util.List;

/**
 * Strategy turning pattern text into an automaton.
 *
 * <p>This is the extension point of the engine: any implementation can replace the default
 * grammar without touching the automaton, the compiler or the simulator. Error reporting is a
 * separate query so that a parser may still return a best-effort automaton for malformed input.
 *
 * <p>Implementations are typically stateful (the error flag refers to the last compilation) and
 * therefore NOT Thread-Safe.
 *
 * @since 1.0.0
 */
public interface Parser {

    /**
     * Compiles pattern text.
     *
     * @param source pattern text
     * @return automaton owned by the caller, never null
     */
    Nfa compile(CharSequence source);

    /**
     * @return whether the last {@link #compile(CharSequence)} should be treated as failed
     */
    boolean error();

    /**
     * @return anomalies seen during the last {@link #compile(CharSequence)}, empty by default
     */
    default List<SyntaxIssue> issues() {
        return List.of();
    }
}
