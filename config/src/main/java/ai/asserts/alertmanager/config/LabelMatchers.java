/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import ai.asserts.alertmanager.error.ValidationException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A non-empty conjunction of {@link LabelMatcher}s. An empty list is rejected at construction so that a matcher set
 * can never silently select every alert. Equality ignores matcher order.
 */
@EqualsAndHashCode(of = "matcherSet")
public class LabelMatchers {
    private final List<LabelMatcher> matchers;
    private final Set<LabelMatcher> matcherSet;

    private LabelMatchers(Collection<LabelMatcher> matchers) {
        this.matchers = ImmutableList.copyOf(matchers);
        this.matcherSet = ImmutableSet.copyOf(matchers);
    }

    public static LabelMatchers of(Collection<LabelMatcher> matchers) {
        if (matchers == null || matchers.isEmpty()) {
            throw new ValidationException("At least one matcher is required");
        }
        if (matchers.stream().anyMatch(m -> m == null)) {
            throw new ValidationException("Matcher list contains an empty entry");
        }
        return new LabelMatchers(matchers);
    }

    public static LabelMatchers of(LabelMatcher... matchers) {
        return of(ImmutableList.copyOf(matchers));
    }

    public static LabelMatchers parse(String expression) {
        return of(MatcherParser.parse(expression));
    }

    public boolean matches(Map<String, String> labels) {
        return matchers.stream().allMatch(matcher -> matcher.matches(labels));
    }

    public List<LabelMatcher> getMatchers() {
        return matchers;
    }

    public int size() {
        return matchers.size();
    }

    @Override
    public String toString() {
        return matchers.stream().map(LabelMatcher::toString).collect(Collectors.joining(",", "{", "}"));
    }
}
