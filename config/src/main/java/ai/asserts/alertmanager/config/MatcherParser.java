/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Alertmanager style matcher expressions such as <code>{alertname="HighCPU", env=~"prod|stage"}</code>.
 * Braces are optional and values may be unquoted when they contain no comma or whitespace.
 */
public final class MatcherParser {
    private final String input;
    private int position;

    private MatcherParser(String input) {
        this.input = input;
    }

    /**
     * @return the parsed matchers, empty when the expression is blank or <code>{}</code>
     */
    public static List<LabelMatcher> parse(String expression) {
        if (expression == null) {
            return new ArrayList<>();
        }
        String trimmed = expression.trim();
        if (trimmed.startsWith("{")) {
            if (!trimmed.endsWith("}")) {
                throw new ValidationException("Unbalanced braces in matcher expression [" + expression + "]");
            }
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        return new MatcherParser(trimmed).parseList();
    }

    public static LabelMatcher parseOne(String expression) {
        List<LabelMatcher> matchers = parse(expression);
        if (matchers.size() != 1) {
            throw new ValidationException("Expected exactly one matcher in [" + expression + "]");
        }
        return matchers.get(0);
    }

    private List<LabelMatcher> parseList() {
        List<LabelMatcher> matchers = new ArrayList<>();
        skipWhitespace();
        while (position < input.length()) {
            matchers.add(parseMatcher());
            skipWhitespace();
            if (position < input.length()) {
                expect(',');
                skipWhitespace();
            }
        }
        return matchers;
    }

    private LabelMatcher parseMatcher() {
        int start = position;
        while (position < input.length() && isNameChar(input.charAt(position))) {
            position++;
        }
        String name = input.substring(start, position);
        if (name.isEmpty()) {
            throw error("label name expected");
        }
        skipWhitespace();
        MatchType type = parseOperator();
        skipWhitespace();
        String value = position < input.length() && input.charAt(position) == '"' ? parseQuoted() : parseBare();
        return new LabelMatcher(name, type, value);
    }

    private MatchType parseOperator() {
        for (String operator : new String[]{"=~", "!~", "!=", "="}) {
            if (input.startsWith(operator, position)) {
                position += operator.length();
                return MatchType.fromOperator(operator);
            }
        }
        throw error("operator expected");
    }

    private String parseQuoted() {
        StringBuilder value = new StringBuilder();
        position++;
        while (position < input.length()) {
            char c = input.charAt(position++);
            if (c == '"') {
                return value.toString();
            } else if (c == '\\' && position < input.length()) {
                char escaped = input.charAt(position++);
                switch (escaped) {
                    case 'n':
                        value.append('\n');
                        break;
                    case 't':
                        value.append('\t');
                        break;
                    case '"':
                    case '\\':
                        value.append(escaped);
                        break;
                    default:
                        // regex escapes such as \d pass through untouched
                        value.append('\\').append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        throw error("unterminated quoted value");
    }

    private String parseBare() {
        int start = position;
        while (position < input.length() && input.charAt(position) != ',') {
            position++;
        }
        return input.substring(start, position).trim();
    }

    private void expect(char c) {
        if (input.charAt(position) != c) {
            throw error("'" + c + "' expected");
        }
        position++;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private ValidationException error(String problem) {
        return new ValidationException("Invalid matcher expression [" + input + "] at position " + position + ": " +
                problem);
    }

    private static boolean isNameChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c) && c < 128;
    }
}
