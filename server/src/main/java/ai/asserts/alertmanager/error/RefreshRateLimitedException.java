/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.alertmanager.error;

import lombok.Getter;

import java.time.Duration;

@Getter
public class RefreshRateLimitedException extends AlertDispatchException {
    private final Duration retryAfter;

    public RefreshRateLimitedException(Duration retryAfter) {
        super("Target refresh rate limited, retry after " + Math.max(1, retryAfter.toSeconds()) + "s");
        this.retryAfter = retryAfter;
    }

    /**
     * @return the retry hint rounded up to whole seconds, at least 1
     */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.toSeconds();
        if (retryAfter.minusSeconds(seconds).isZero()) {
            return Math.max(1, seconds);
        }
        return seconds + 1;
    }

    @Override
    public String getCode() {
        return "rate_limited";
    }
}
