/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MatcherParserTest {
    @Test
    public void parse_braced() {
        List<LabelMatcher> matchers = MatcherParser.parse(
                "{alertname=\"HighCPU\", env=~\"prod|stage\", team!=\"\", instance!~\"10\\.0\\..*\"}");
        assertEquals(ImmutableList.of(
                LabelMatcher.equal("alertname", "HighCPU"),
                LabelMatcher.regex("env", "prod|stage"),
                new LabelMatcher("team", MatchType.NOT_EQUAL, ""),
                new LabelMatcher("instance", MatchType.NOT_REGEX, "10\\.0\\..*")), matchers);
    }

    @Test
    public void parse_bareValuesAndNoBraces() {
        assertEquals(ImmutableList.of(
                        LabelMatcher.equal("severity", "critical"),
                        LabelMatcher.regex("job", "node.*")),
                MatcherParser.parse("severity=critical, job=~node.*"));
    }

    @Test
    public void parse_regexEscapePassesThrough() {
        LabelMatcher matcher = MatcherParser.parseOne("instance=~\"host\\d+\"");
        assertEquals("host\\d+", matcher.getValue());
        assertTrue(matcher.matches("host42"));
    }

    @Test
    public void parse_empty() {
        assertTrue(MatcherParser.parse("").isEmpty());
        assertTrue(MatcherParser.parse("{}").isEmpty());
        assertTrue(MatcherParser.parse(null).isEmpty());
        assertThrows(ValidationException.class, () -> LabelMatchers.parse("{}"));
    }

    @Test
    public void parse_errors() {
        assertThrows(ValidationException.class, () -> MatcherParser.parse("{alertname=\"x\""));
        assertThrows(ValidationException.class, () -> MatcherParser.parse("alertname"));
        assertThrows(ValidationException.class, () -> MatcherParser.parse("alertname=\"unterminated"));
        assertThrows(ValidationException.class, () -> MatcherParser.parse("=\"x\""));
        assertThrows(ValidationException.class, () -> MatcherParser.parse("a=\"x\" b=\"y\""));
        assertThrows(ValidationException.class, () -> MatcherParser.parseOne("a=\"x\",b=\"y\""));
    }
}
