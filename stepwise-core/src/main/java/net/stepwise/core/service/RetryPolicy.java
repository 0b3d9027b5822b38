package net.stepwise.core.service;

import java.time.Duration;

/** errored 마이그레이션을 다시 디스패치하기 전 대기 시간 */
public interface RetryPolicy {
    Duration nextBackoff(int attempts);

    /** 고정 백오프 정책 */
    static RetryPolicy fixed(Duration backoff) {
        return attempts -> backoff;
    }

    /** base * 2^(attempts-1), max 로 상한 */
    static RetryPolicy exponential(Duration base, Duration max) {
        return attempts -> {
            int shift = Math.min(Math.max(attempts - 1, 0), 30);
            Duration d = base.multipliedBy(1L << shift);
            return d.compareTo(max) > 0 ? max : d;
        };
    }
}
