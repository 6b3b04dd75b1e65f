/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.springframework.util.StringUtils.hasLength;

/**
 * YAML form of an inhibition rule. Accepts both the legacy <code>*_match</code> / <code>*_match_re</code> maps and
 * the newer <code>*_matchers</code> expression lists.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class InhibitRuleConfig {
    private String name;
    @JsonProperty("source_match")
    @Builder.Default
    private Map<String, String> sourceMatch = new TreeMap<>();
    @JsonProperty("source_match_re")
    @Builder.Default
    private Map<String, String> sourceMatchRe = new TreeMap<>();
    @JsonProperty("source_matchers")
    @Builder.Default
    private List<String> sourceMatchers = new ArrayList<>();
    @JsonProperty("target_match")
    @Builder.Default
    private Map<String, String> targetMatch = new TreeMap<>();
    @JsonProperty("target_match_re")
    @Builder.Default
    private Map<String, String> targetMatchRe = new TreeMap<>();
    @JsonProperty("target_matchers")
    @Builder.Default
    private List<String> targetMatchers = new ArrayList<>();
    @Builder.Default
    private List<String> equal = new ArrayList<>();

    public InhibitionRule compile(int index) {
        String ruleName = hasLength(name) ? name : "inhibit_rule_" + index;
        List<LabelMatcher> source = collect(sourceMatch, sourceMatchRe, sourceMatchers);
        List<LabelMatcher> target = collect(targetMatch, targetMatchRe, targetMatchers);
        if (source.isEmpty()) {
            throw new ValidationException("Inhibit rule [" + ruleName + "] has no source matchers");
        }
        if (target.isEmpty()) {
            throw new ValidationException("Inhibit rule [" + ruleName + "] has no target matchers");
        }
        if (equal != null) {
            equal.stream()
                    .filter(label -> !hasLength(label) || !LabelMatcher.LABEL_NAME.matcher(label).matches())
                    .findFirst()
                    .ifPresent(label -> {
                        throw new ValidationException(
                                "Inhibit rule [" + ruleName + "] has invalid equal label [" + label + "]");
                    });
        }
        return InhibitionRule.builder()
                .name(ruleName)
                .source(LabelMatchers.of(source))
                .target(LabelMatchers.of(target))
                .equal(equal)
                .build();
    }

    private List<LabelMatcher> collect(Map<String, String> match, Map<String, String> matchRe,
                                       List<String> expressions) {
        List<LabelMatcher> matchers = new ArrayList<>();
        if (match != null) {
            match.forEach((label, value) -> matchers.add(LabelMatcher.equal(label, value)));
        }
        if (matchRe != null) {
            matchRe.forEach((label, value) -> matchers.add(LabelMatcher.regex(label, value)));
        }
        if (expressions != null) {
            expressions.forEach(expression -> matchers.addAll(MatcherParser.parse(expression)));
        }
        return matchers;
    }
}
