/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.config;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A compiled inhibition rule. A firing alert matching {@link #getSource()} mutes every other alert that matches
 * {@link #getTarget()} and carries the same values for all of the {@link #getEqual()} labels.
 */
@Getter
@EqualsAndHashCode
@ToString
public class InhibitionRule {
    private final String name;
    private final LabelMatchers source;
    private final LabelMatchers target;
    private final List<String> equal;

    @Builder(toBuilder = true)
    public InhibitionRule(String name, LabelMatchers source, LabelMatchers target, List<String> equal) {
        this.name = name;
        this.source = source;
        this.target = target;
        this.equal = equal == null ? ImmutableList.of() : ImmutableList.copyOf(equal);
    }

    public boolean matchesTarget(Map<String, String> labels) {
        return target.matches(labels);
    }

    public boolean matchesSource(Map<String, String> labels) {
        return source.matches(labels);
    }

    public boolean hasEqualLabels(Map<String, String> targetLabels, Map<String, String> sourceLabels) {
        return equal.stream().allMatch(label ->
                Objects.equals(Strings.nullToEmpty(targetLabels.get(label)),
                        Strings.nullToEmpty(sourceLabels.get(label))));
    }
}
