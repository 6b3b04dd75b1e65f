/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.stream.Stream;

@AllArgsConstructor
@Getter
public enum MatchType {
    EQUAL("=", false, false),
    NOT_EQUAL("!=", false, true),
    REGEX("=~", true, false),
    NOT_REGEX("!~", true, true);

    @JsonValue
    private final String operator;
    private final boolean regex;
    private final boolean negated;

    @JsonCreator
    public static MatchType fromOperator(String operator) {
        return Stream.of(values())
                .filter(type -> type.operator.equals(operator))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown matcher operator [" + operator + "]"));
    }

    public static MatchType of(boolean regex, boolean equal) {
        if (regex) {
            return equal ? REGEX : NOT_REGEX;
        }
        return equal ? EQUAL : NOT_EQUAL;
    }
}
