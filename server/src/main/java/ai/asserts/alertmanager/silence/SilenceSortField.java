/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.silence;

import ai.asserts.alertmanager.error.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.stream.Stream;

@AllArgsConstructor
@Getter
public enum SilenceSortField {
    CREATED_AT("created_at"),
    STARTS_AT("starts_at"),
    ENDS_AT("ends_at"),
    STATUS("status");

    private final String param;

    public static SilenceSortField parse(String value) {
        return Stream.of(values())
                .filter(field -> field.param.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Invalid sort field [" + value + "], expected one of " +
                        "created_at, starts_at, ends_at, status"));
    }
}
