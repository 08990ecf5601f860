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

import java.util.Objects;

/**
 * Anomaly found while parsing a pattern.
 *
 * @param position index in the pattern where the anomaly was detected
 * @param message human readable description
 * @since 1.0.0
 */
public record SyntaxIssue(int position, String message) {

    public SyntaxIssue {
        Objects.requireNonNull(message, "message cannot be null");
    }

    @Override
    public String toString() {
        return message + " at index " + position;
    }
}
