/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.publishing;

import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The live set of valid targets. Replaced as a whole; readers always see one complete set.
 */
@Slf4j
@Component
public class PublishingTargetRegistry {
    private final AtomicReference<List<PublishingTarget>> targets = new AtomicReference<>(ImmutableList.of());

    public List<PublishingTarget> getTargets() {
        return targets.get();
    }

    public void replace(List<PublishingTarget> validTargets) {
        List<PublishingTarget> previous = targets.getAndSet(ImmutableList.copyOf(validTargets));
        log.info("Publishing targets replaced, {} -> {}", previous.size(), validTargets.size());
    }
}
