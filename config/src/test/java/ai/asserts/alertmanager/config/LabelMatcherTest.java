/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LabelMatcherTest {
    private final Map<String, String> labels = ImmutableMap.of(
            "alertname", "HighCPU",
            "severity", "critical");

    @Test
    public void equal() {
        assertTrue(LabelMatcher.equal("alertname", "HighCPU").matches(labels));
        assertFalse(LabelMatcher.equal("alertname", "HighMemory").matches(labels));
    }

    @Test
    public void notEqual() {
        assertTrue(new LabelMatcher("severity", MatchType.NOT_EQUAL, "warning").matches(labels));
        assertFalse(new LabelMatcher("severity", MatchType.NOT_EQUAL, "critical").matches(labels));
    }

    @Test
    public void regex_isFullyAnchored() {
        assertTrue(LabelMatcher.regex("alertname", "High.*").matches(labels));
        assertFalse(LabelMatcher.regex("alertname", "High").matches(labels));
        assertFalse(LabelMatcher.regex("alertname", "CPU").matches(labels));
        assertTrue(new LabelMatcher("alertname", MatchType.NOT_REGEX, "CPU").matches(labels));
    }

    @Test
    public void missingLabel_treatedAsEmpty() {
        assertTrue(LabelMatcher.equal("team", "").matches(labels));
        assertFalse(LabelMatcher.equal("team", "infra").matches(labels));
        assertTrue(new LabelMatcher("team", MatchType.NOT_EQUAL, "infra").matches(labels));
        assertFalse(LabelMatcher.regex("team", ".+").matches(labels));
        assertTrue(new LabelMatcher("team", MatchType.NOT_REGEX, ".+").matches(labels));
    }

    @Test
    public void invalid() {
        assertThrows(ValidationException.class, () -> LabelMatcher.equal("", "x"));
        assertThrows(ValidationException.class, () -> LabelMatcher.equal("1abc", "x"));
        assertThrows(ValidationException.class, () -> LabelMatcher.regex("alertname", "(unclosed"));
        assertThrows(ValidationException.class, () -> MatchType.fromOperator("=="));
    }

    @Test
    public void json() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        LabelMatcher byOperator = objectMapper.readValue(
                "{\"name\":\"env\",\"value\":\"prod|stage\",\"type\":\"=~\"}", LabelMatcher.class);
        assertEquals(LabelMatcher.regex("env", "prod|stage"), byOperator);

        LabelMatcher byFlags = objectMapper.readValue(
                "{\"name\":\"env\",\"value\":\"dev\",\"isRegex\":false,\"isEqual\":false}", LabelMatcher.class);
        assertEquals(new LabelMatcher("env", MatchType.NOT_EQUAL, "dev"), byFlags);

        String json = objectMapper.writeValueAsString(LabelMatcher.equal("severity", "critical"));
        assertTrue(json.contains("\"type\":\"=\""));
        assertTrue(json.contains("\"isEqual\":true"));
        assertEquals(LabelMatcher.equal("severity", "critical"), objectMapper.readValue(json, LabelMatcher.class));
    }

    @Test
    public void toString_quotesValue() {
        assertEquals("msg=\"say \\\"hi\\\"\"", LabelMatcher.equal("msg", "say \"hi\"").toString());
    }
}
