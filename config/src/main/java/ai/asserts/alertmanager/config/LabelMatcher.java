/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static org.springframework.util.StringUtils.hasLength;

/**
 * A single label condition. Equality operators compare literal strings, regex operators apply a fully anchored
 * pattern. A label absent from the alert is evaluated as the empty string for every operator, so
 * <code>team=""</code> and <code>team!~".+"</code> both select alerts without a <code>team</code> label.
 */
@Getter
@EqualsAndHashCode(of = {"name", "type", "value"})
@JsonIgnoreProperties(ignoreUnknown = true)
public class LabelMatcher {
    public static final Pattern LABEL_NAME = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    private final String name;
    private final MatchType type;
    private final String value;
    @JsonIgnore
    private final Pattern compiledPattern;

    public LabelMatcher(String name, MatchType type, String value) {
        if (!hasLength(name) || !LABEL_NAME.matcher(name).matches()) {
            throw new ValidationException("Invalid label name [" + name + "]");
        }
        if (type == null) {
            throw new ValidationException("Matcher operator not specified for label [" + name + "]");
        }
        this.name = name;
        this.type = type;
        this.value = value == null ? "" : value;
        if (type.isRegex()) {
            try {
                this.compiledPattern = Pattern.compile(this.value);
            } catch (PatternSyntaxException e) {
                throw new ValidationException("Invalid regular expression [" + value + "] for label [" + name + "]", e);
            }
        } else {
            this.compiledPattern = null;
        }
    }

    /**
     * Accepts both the operator form <code>{"name", "value", "type": "=~"}</code> and the Alertmanager form
     * <code>{"name", "value", "isRegex", "isEqual"}</code>. The operator wins when both are present.
     */
    @JsonCreator
    public static LabelMatcher fromJson(@JsonProperty("name") String name,
                                        @JsonProperty("value") String value,
                                        @JsonProperty("type") String type,
                                        @JsonProperty("isRegex") Boolean isRegex,
                                        @JsonProperty("isEqual") Boolean isEqual) {
        MatchType matchType = hasLength(type) ? MatchType.fromOperator(type) :
                MatchType.of(Boolean.TRUE.equals(isRegex), !Boolean.FALSE.equals(isEqual));
        return new LabelMatcher(name, matchType, value);
    }

    public static LabelMatcher equal(String name, String value) {
        return new LabelMatcher(name, MatchType.EQUAL, value);
    }

    public static LabelMatcher regex(String name, String value) {
        return new LabelMatcher(name, MatchType.REGEX, value);
    }

    @JsonProperty("isRegex")
    public boolean isRegex() {
        return type.isRegex();
    }

    @JsonProperty("isEqual")
    public boolean isEqual() {
        return !type.isNegated();
    }

    public boolean matches(Map<String, String> labels) {
        return matches(labels.getOrDefault(name, ""));
    }

    public boolean matches(String labelValue) {
        String input = labelValue == null ? "" : labelValue;
        boolean matches = type.isRegex() ? compiledPattern.matcher(input).matches() : value.equals(input);
        return type.isNegated() != matches;
    }

    @Override
    public String toString() {
        return name + type.getOperator() + "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
