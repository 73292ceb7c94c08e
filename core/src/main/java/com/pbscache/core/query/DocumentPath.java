package com.pbscache.core.query;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Compiled path expression over a published document.
 * <p>
 * Supported syntax:
 * <ul>
 *   <li>{@code $} optional root marker</li>
 *   <li>{@code .Field} field access</li>
 *   <li>{@code .*} every value of an object or element of an array</li>
 *   <li>{@code [?(@.attr=="value")]} elements of an object or array whose {@code attr} equals {@code value}</li>
 *   <li>{@code ["a","b"]} (optionally preceded by a dot) selection of several fields</li>
 * </ul>
 * Examples: {@code $.Queue.*}, {@code .Queue.workq.statistics},
 * {@code $.Jobs[?(@.euser=="alice")].id}, {@code .Server.srv01.["server_state","total_jobs"]}.
 * </p>
 */
public final class DocumentPath {

    private final String expression;
    private final List<Step> steps;

    private DocumentPath(String expression, List<Step> steps) {
        this.expression = expression;
        this.steps = steps;
    }

    /**
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static DocumentPath compile(String expression) {
        Objects.requireNonNull(expression, "expression");
        return new DocumentPath(expression, new Parser(expression).parse());
    }

    /**
     * Evaluates the path against {@code root}.
     *
     * @return every match in document order; empty when nothing matches
     */
    public List<JsonNode> select(JsonNode root) {
        List<JsonNode> current = Collections.singletonList(root);
        for (Step step : steps) {
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode node : current) {
                step.apply(node, next);
            }
            current = next;
            if (current.isEmpty()) {
                break;
            }
        }
        return current;
    }

    @Override
    public String toString() {
        return expression;
    }

    private interface Step {
        void apply(JsonNode node, List<JsonNode> out);
    }

    private static final class FieldStep implements Step {
        private final List<String> names;

        FieldStep(List<String> names) {
            this.names = names;
        }

        @Override
        public void apply(JsonNode node, List<JsonNode> out) {
            if (!node.isObject()) {
                return;
            }
            for (String name : names) {
                JsonNode value = node.get(name);
                if (value != null) {
                    out.add(value);
                }
            }
        }
    }

    private static final class WildcardStep implements Step {
        @Override
        public void apply(JsonNode node, List<JsonNode> out) {
            if (node.isContainerNode()) {
                Iterator<JsonNode> it = node.elements();
                while (it.hasNext()) {
                    out.add(it.next());
                }
            }
        }
    }

    private static final class FilterStep implements Step {
        private final String attribute;
        private final String value;

        FilterStep(String attribute, String value) {
            this.attribute = attribute;
            this.value = value;
        }

        @Override
        public void apply(JsonNode node, List<JsonNode> out) {
            if (!node.isContainerNode()) {
                return;
            }
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) {
                JsonNode element = it.next();
                JsonNode candidate = element.get(attribute);
                if (candidate != null && candidate.isValueNode() && value.equals(candidate.asText())) {
                    out.add(element);
                }
            }
        }
    }

    private static final class Parser {
        private final String src;
        private int pos;

        Parser(String src) {
            this.src = src;
        }

        List<Step> parse() {
            List<Step> steps = new ArrayList<>();
            if (peek('$')) {
                pos++;
            }
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '.') {
                    pos++;
                    if (peek('*')) {
                        pos++;
                        steps.add(new WildcardStep());
                    } else if (peek('[')) {
                        steps.add(bracket());
                    } else {
                        steps.add(new FieldStep(List.of(name())));
                    }
                } else if (c == '[') {
                    steps.add(bracket());
                } else {
                    throw error("expected '.' or '['");
                }
            }
            return Collections.unmodifiableList(steps);
        }

        private Step bracket() {
            expect('[');
            Step step;
            if (peek('?')) {
                pos++;
                expect('(');
                expect('@');
                expect('.');
                String attribute = name();
                expect('=');
                expect('=');
                String value = quoted();
                expect(')');
                step = new FilterStep(attribute, value);
            } else if (peek('*')) {
                pos++;
                step = new WildcardStep();
            } else {
                List<String> names = new ArrayList<>();
                names.add(quoted());
                skipSpaces();
                while (peek(',')) {
                    pos++;
                    skipSpaces();
                    names.add(quoted());
                    skipSpaces();
                }
                step = new FieldStep(Collections.unmodifiableList(names));
            }
            expect(']');
            return step;
        }

        private String name() {
            int start = pos;
            while (pos < src.length() && "$.[]()=\"'@?* ".indexOf(src.charAt(pos)) < 0) {
                pos++;
            }
            if (start == pos) {
                throw error("expected field name");
            }
            return src.substring(start, pos);
        }

        private String quoted() {
            if (!peek('"') && !peek('\'')) {
                throw error("expected quoted string");
            }
            char quote = src.charAt(pos++);
            int end = src.indexOf(quote, pos);
            if (end < 0) {
                throw error("unterminated string");
            }
            String value = src.substring(pos, end);
            pos = end + 1;
            return value;
        }

        private void skipSpaces() {
            while (peek(' ')) {
                pos++;
            }
        }

        private boolean peek(char c) {
            return pos < src.length() && src.charAt(pos) == c;
        }

        private void expect(char c) {
            if (!peek(c)) {
                throw error("expected '" + c + "'");
            }
            pos++;
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException("invalid path '" + src + "' at " + pos + ": " + message);
        }
    }
}
