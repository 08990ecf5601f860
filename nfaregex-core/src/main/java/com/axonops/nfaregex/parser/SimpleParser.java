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

import com.axonops.nfaregex.ast.Choice;
import com.axonops.nfaregex.ast.Concat;
import com.axonops.nfaregex.ast.KleenePlus;
import com.axonops.nfaregex.ast.KleeneStar;
import com.axonops.nfaregex.ast.Leaf;
import com.axonops.nfaregex.ast.Node;
import com.axonops.nfaregex.ast.Optional;
import com.axonops.nfaregex.ast.SingleCharacter;
import com.axonops.nfaregex.ast.Subexpression;
import com.axonops.nfaregex.nfa.CharCondition;
import com.axonops.nfaregex.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.axonops.nfaregex.parser.PatternReader.EOF;

/**
 * Default recursive-descent parser.
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 * choice  := concat ('|' concat)*
 * concat  := primary+
 * primary := atom quantifier?
 * atom    := '.' | '[' bracket ']' | '(' ('?:')? choice ')' | '\' any-char | literal-char
 * </pre>
 *
 * <p>The parser never fails. Malformed input (unterminated groups or brackets, a dangling escape,
 * empty alternatives...) is absorbed into a best-effort tree and every absorbed anomaly is
 * recorded as a {@link SyntaxIssue}. The default instance still reports {@code error() == false};
 * {@link #strict()} returns a parser that reports an error whenever an issue was recorded.
 *
 * <p>NOT Thread-Safe: issues refer to the last parsed pattern.
 *
 * @since 1.0.0
 */
public class SimpleParser extends AbstractParser {
    private static final Logger logger = LoggerFactory.getLogger(SimpleParser.class);

    private final boolean strict;
    private final List<SyntaxIssue> issues = new ArrayList<>();

    /**
     * Creates a permissive parser.
     */
    public SimpleParser() {
        this(false);
    }

    protected SimpleParser(boolean strict) {
        this.strict = strict;
    }

    /**
     * @return a parser whose {@link #error()} reports any recorded syntax issue
     */
    public static SimpleParser strict() {
        return new SimpleParser(true);
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public boolean error() {
        return strict && !issues.isEmpty();
    }

    @Override
    public List<SyntaxIssue> issues() {
        return List.copyOf(issues);
    }

    @Override
    protected Node parse(PatternReader input) {
        issues.clear();
        if (input.atEnd()) {
            return null;
        }

        Node root = parseChoice(input);
        if (!input.atEnd()) {
            // Only an unbalanced ')' stops the top level before the end
            issue(input.position(), "unmatched ')', remaining input ignored");
        }

        if (!issues.isEmpty()) {
            logger.debug("NFA: {} syntax issue(s) {} - hash: {}, first: {}",
                issues.size(), strict ? "reported" : "ignored",
                PatternHasher.hash(input.source().toString()), issues.get(0));
        }
        return root;
    }

    private Node parseChoice(PatternReader input) {
        Node node = parseConcat(input);
        while (input.peek() == '|') {
            int at = input.position();
            input.get();
            if (input.peek() == EOF) {
                issue(at, "trailing '|' ignored");
                break;
            }
            Node right = parseConcat(input);
            if (node == null || right == null) {
                issue(at, "empty alternative");
            }
            node = new Choice(node, right);
        }
        return node;
    }

    private Node parseConcat(PatternReader input) {
        Node node = null;
        while (isPrimary(input.peek())) {
            Node primary = parsePrimary(input);
            if (primary != null) {
                node = node == null ? primary : new Concat(node, primary);
            }
        }
        return node;
    }

    /**
     * Pre: the next character starts a primary expression. Post: the next character follows it,
     * quantifier included.
     *
     * @return the node, or null if the primary expression produced nothing
     */
    private Node parsePrimary(PatternReader input) {
        int start = input.position();
        int c = input.get();
        Node node;

        if (c == '\\') {
            if (input.peek() == EOF) {
                issue(start, "dangling escape at end of pattern");
                return null;
            }
            node = new SingleCharacter((char) input.get());
        } else if (c == '.') {
            node = new Leaf(CharCondition.any());
        } else if (c == '[') {
            node = parseBracket(input, start);
        } else if (c == '(') {
            node = parseGroup(input, start);
        } else {
            if (isQuantifier(c)) {
                issue(start, "quantifier '" + (char) c + "' has nothing to repeat, read as literal");
            }
            node = new SingleCharacter((char) c);
        }

        return parseQuantifier(input, node);
    }

    /**
     * Pre: the next character follows the '('. Post: the next character follows the ')'.
     */
    private Node parseGroup(PatternReader input, int start) {
        boolean capture = true;
        if (input.peek() == '?') {
            input.get();
            if (input.peek() == ':') {
                input.get();
                capture = false;
            } else {
                issue(start, "unsupported group modifier");
            }
        }

        Node inner = parseChoice(input);
        if (input.peek() == ')') {
            input.get();
        } else {
            issue(start, "unterminated group");
        }

        if (inner == null) {
            issue(start, "empty group");
            return null;
        }
        return capture ? new Subexpression(inner) : inner;
    }

    /**
     * Pre: the next character follows the '['. Post: the next character follows the ']'.
     */
    private Node parseBracket(PatternReader input, int start) {
        StringBuilder members = new StringBuilder();
        boolean negate = false;

        int c = input.get();
        if (c == '^') {
            negate = true;
            c = input.get();
        } else if (c == '-') {
            members.append('-');
            c = input.get();
        }

        while (c != EOF && c != ']') {
            // TODO: POSIX classes such as [:alpha:]
            if (c == '\\' && input.peek() != EOF) {
                members.append((char) input.get());
            } else if (input.peek() == '-') {
                int dash = input.position();
                input.get();
                int d = input.peek();
                if (d == ']' || d == EOF) {
                    members.append((char) c).append('-');
                } else {
                    input.get();
                    if (d < c) {
                        issue(dash, "reversed range " + (char) c + "-" + (char) d + " matches nothing");
                    }
                    for (int x = c; x <= d; x++) {
                        members.append((char) x);
                    }
                }
            } else {
                members.append((char) c);
            }
            c = input.get();
        }

        if (c == EOF) {
            issue(start, "unterminated character class");
        }

        String set = members.toString();
        return new Leaf(negate ? CharCondition.noneOf(set) : CharCondition.oneOf(set));
    }

    /**
     * Pre: the next character may be a quantifier. Post: the next character follows the
     * quantifier; nothing is consumed if there is none.
     *
     * @return the quantified node, or {@code child} itself without quantifier
     */
    private Node parseQuantifier(PatternReader input, Node child) {
        int at = input.position();
        int c = input.get();
        if (isQuantifier(c) && child == null) {
            issue(at, "quantifier '" + (char) c + "' has nothing to repeat, ignored");
            return null;
        }
        switch (c) {
            case '?':
                return new Optional(child);
            case '*':
                return new KleeneStar(child);
            case '+':
                return new KleenePlus(child);
            default:
                break;
        }
        if (c != EOF) {
            input.unget();
        }
        return child;
    }

    private void issue(int position, String message) {
        issues.add(new SyntaxIssue(position, message));
    }

    private static boolean isPrimary(int c) {
        return c != ')' && c != '|' && c != EOF;
    }

    private static boolean isQuantifier(int c) {
        return c == '?' || c == '*' || c == '+';
    }
}
