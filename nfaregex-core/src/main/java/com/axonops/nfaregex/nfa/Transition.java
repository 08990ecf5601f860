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

import java.util.Objects;

/**
 * Conditioned edge between two states. The target is referenced, not owned.
 *
 * @param target state reached when the condition accepts the character
 * @param condition character predicate guarding the edge
 * @since 1.0.0
 */
public record Transition(State target, CharCondition condition) {

    public Transition {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(condition, "condition cannot be null");
    }

    /**
     * Same condition, different target.
     */
    Transition withTarget(State newTarget) {
        return new Transition(newTarget, condition);
    }
}
