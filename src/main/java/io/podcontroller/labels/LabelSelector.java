package io.podcontroller.labels;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * <p>A predicate on labels consisting of requirements that must all match, with the same
 * syntax as Kubernetes' label selectors:</p>
 * <pre>
 *   app=web, env!=dev, tier in (front,back), zone notin (a), canary, !deprecated
 * </pre>
 * <p>The empty selector matches everything. Instances are immutable and their
 * {@link #toString()} is canonical: requirements sorted by key then operator.</p>
 */
public final class LabelSelector implements Predicate<Map<String, String>> {

    public static final LabelSelector EVERYTHING = new LabelSelector(List.of());

    /**
     * Operator of a single requirement.
     */
    public enum Operator {
        EXISTS,
        NOT_EXISTS,
        IN,
        NOT_IN
    }

    /**
     * One key constraint of a selector.
     */
    public static final class Requirement implements Predicate<Map<String, String>> {

        private final String key;
        private final Operator operator;
        private final Set<String> values;

        Requirement(String key, Operator operator, Set<String> values) {
            this.key = key;
            this.operator = operator;
            this.values = Collections.unmodifiableSet(new TreeSet<>(values));
        }

        public String key() {
            return key;
        }

        public Operator operator() {
            return operator;
        }

        public Set<String> values() {
            return values;
        }

        @Override
        public boolean test(Map<String, String> labels) {
            return switch (operator) {
                case EXISTS -> labels.containsKey(key);
                case NOT_EXISTS -> !labels.containsKey(key);
                case IN -> labels.containsKey(key) && values.contains(labels.get(key));
                case NOT_IN -> !labels.containsKey(key) || !values.contains(labels.get(key));
            };
        }

        @Override
        public String toString() {
            return switch (operator) {
                case EXISTS -> key;
                case NOT_EXISTS -> "!" + key;
                case IN -> values.size() == 1 ? key + "=" + values.iterator().next()
                        : key + " in (" + String.join(",", values) + ")";
                case NOT_IN -> values.size() == 1 ? key + "!=" + values.iterator().next()
                        : key + " notin (" + String.join(",", values) + ")";
            };
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (!(obj instanceof Requirement)) {
                return false;
            }
            Requirement that = (Requirement) obj;
            return key.equals(that.key) && operator == that.operator && values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, operator, values);
        }
    }

    private final List<Requirement> requirements;

    private LabelSelector(List<Requirement> requirements) {
        List<Requirement> sorted = new ArrayList<>(requirements);
        sorted.sort((a, b) -> {
            int byKey = a.key().compareTo(b.key());
            return byKey != 0 ? byKey : a.operator().compareTo(b.operator());
        });
        this.requirements = List.copyOf(sorted);
    }

    /**
     * Selector requiring every given label to be present with exactly the given value.
     */
    public static LabelSelector matchingLabels(Map<String, String> labels) {
        return new LabelSelector(labels.entrySet().stream()
            .map(entry -> new Requirement(entry.getKey(), Operator.IN, Set.of(entry.getValue())))
            .collect(Collectors.toList()));
    }

    public List<Requirement> requirements() {
        return requirements;
    }

    public boolean matchesEverything() {
        return requirements.isEmpty();
    }

    @Override
    public boolean test(Map<String, String> labels) {
        Map<String, String> safeLabels = labels != null ? labels : Map.of();
        for (Requirement requirement : requirements) {
            if (!requirement.test(safeLabels)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return requirements.stream().map(Requirement::toString).collect(Collectors.joining(","));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        return requirements.equals(((LabelSelector) obj).requirements);
    }

    @Override
    public int hashCode() {
        return requirements.hashCode();
    }

    /**
     * Parse the given string as a selector.
     * This is the inverse operation of {@link #toString()}.
     *
     * @throws SelectorParseException if the string is not a valid selector
     */
    public static LabelSelector parse(String selector) {
        Objects.requireNonNull(selector, "selector");
        return new LabelSelector(new Parser(selector).parseRequirements());
    }

    private static final class Parser {

        private final String input;
        private int pos;

        Parser(String input) {
            this.input = input;
            this.pos = 0;
        }

        List<Requirement> parseRequirements() {
            List<Requirement> result = new ArrayList<>();
            skipWhitespace();
            if (atEnd()) {
                return result;
            }
            while (true) {
                result.add(parseRequirement());
                skipWhitespace();
                if (atEnd()) {
                    return result;
                }
                expect(',');
            }
        }

        private Requirement parseRequirement() {
            skipWhitespace();
            if (peek('!')) {
                pos++;
                skipWhitespace();
                return new Requirement(parseToken("key"), Operator.NOT_EXISTS, Set.of());
            }
            String key = parseToken("key");
            skipWhitespace();
            if (atEnd() || peek(',')) {
                return new Requirement(key, Operator.EXISTS, Set.of());
            }
            if (input.startsWith("==", pos)) {
                pos += 2;
                return new Requirement(key, Operator.IN, Set.of(parseValue()));
            }
            if (input.startsWith("!=", pos)) {
                pos += 2;
                return new Requirement(key, Operator.NOT_IN, Set.of(parseValue()));
            }
            if (peek('=')) {
                pos++;
                return new Requirement(key, Operator.IN, Set.of(parseValue()));
            }
            String word = parseToken("operator");
            if ("in".equals(word)) {
                return new Requirement(key, Operator.IN, parseValueSet());
            }
            if ("notin".equals(word)) {
                return new Requirement(key, Operator.NOT_IN, parseValueSet());
            }
            throw error("unknown operator '" + word + "'");
        }

        private String parseValue() {
            skipWhitespace();
            if (atEnd() || peek(',')) {
                return "";
            }
            return parseToken("value");
        }

        private Set<String> parseValueSet() {
            skipWhitespace();
            expect('(');
            Set<String> values = new TreeSet<>();
            while (true) {
                skipWhitespace();
                if (peek(')') || peek(',')) {
                    values.add("");
                } else {
                    values.add(parseToken("value"));
                }
                skipWhitespace();
                if (peek(')')) {
                    pos++;
                    return values;
                }
                expect(',');
            }
        }

        private String parseToken(String what) {
            int start = pos;
            while (!atEnd() && isTokenChar(input.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw error("expected " + what);
            }
            return input.substring(start, pos);
        }

        private static boolean isTokenChar(char c) {
            return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' || c == '/';
        }

        private void expect(char c) {
            if (!peek(c)) {
                throw error("expected '" + c + "'");
            }
            pos++;
        }

        private boolean peek(char c) {
            return !atEnd() && input.charAt(pos) == c;
        }

        private boolean atEnd() {
            return pos >= input.length();
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        private SelectorParseException error(String message) {
            return new SelectorParseException("invalid selector '" + input + "' at " + pos + ": " + message);
        }
    }
}
