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
package com.axonops.nfaregex.api;

import com.axonops.nfaregex.parser.SyntaxIssue;

import java.util.List;

/**
 * Thrown when the parser reports an error for a pattern.
 *
 * <p>The default parser never reports errors; this is only raised with a strict parser or a
 * custom {@link com.axonops.nfaregex.parser.Parser}.
 *
 * @since 1.0.0
 */
public final class PatternCompilationException extends RegexException {

    private final String pattern;
    private final List<SyntaxIssue> issues;

    public PatternCompilationException(String pattern, List<SyntaxIssue> issues) {
        super("NFA: Pattern compilation failed: " + describe(issues) + " (pattern: " + truncate(pattern) + ")");
        this.pattern = pattern;
        this.issues = List.copyOf(issues);
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * @return issues reported by the parser, possibly empty for parsers that do not detail them
     */
    public List<SyntaxIssue> getIssues() {
        return issues;
    }

    private static String describe(List<SyntaxIssue> issues) {
        if (issues.isEmpty()) {
            return "parser reported an error";
        }
        String first = issues.get(0).toString();
        return issues.size() == 1 ? first : first + " (+" + (issues.size() - 1) + " more)";
    }

    private static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
