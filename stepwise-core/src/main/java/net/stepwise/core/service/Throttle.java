package net.stepwise.core.service;

import net.stepwise.core.spi.Clock;
import net.stepwise.core.spi.ThrottlePredicate;

import java.time.Duration;
import java.time.Instant;

/**
 * 외부 predicate 를 최소 interval 간격으로만 평가하고, 그 사이에는 직전 결과를 돌려준다.
 */
public final class Throttle {
    private final ThrottlePredicate predicate;
    private final Duration interval;
    private final Clock clock;

    private Instant checkedAt;
    private boolean throttled;

    public Throttle(ThrottlePredicate predicate, Duration interval, Clock clock) {
        this.predicate = predicate;
        this.interval = interval;
        this.clock = clock;
    }

    public synchronized boolean shouldThrottle() {
        Instant now = clock.now();
        if (checkedAt == null || !now.isBefore(checkedAt.plus(interval))) {
            throttled = predicate.shouldThrottle();
            checkedAt = now;
        }
        return throttled;
    }
}
