package net.stepwise.core.service;

import net.stepwise.core.spi.MigrationErrorHandler;
import net.stepwise.core.spi.ThrottlePredicate;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 엔진 설정. 한 번 만들어 Scheduler/Runner/Service 에 넘긴다.
 */
public final class EngineConfig {
    private final int defaultMaxAttempts;
    private final Duration defaultIterationPause;
    private final Duration maxSliceDuration;
    private final Duration stuckMargin;
    private final Duration throttleCheckInterval;
    private final Duration throttleBackoff;
    private final ThrottlePredicate throttlePredicate;
    private final MigrationErrorHandler errorHandler;
    private final int backtraceDepth;
    private final Predicate<StackTraceElement> backtraceFilter;
    private final RetryPolicy retryPolicy;
    private final String schedulerLockName;

    private EngineConfig(Builder b) {
        this.defaultMaxAttempts = b.defaultMaxAttempts;
        this.defaultIterationPause = b.defaultIterationPause;
        this.maxSliceDuration = b.maxSliceDuration;
        this.stuckMargin = b.stuckMargin;
        this.throttleCheckInterval = b.throttleCheckInterval;
        this.throttleBackoff = b.throttleBackoff;
        this.throttlePredicate = b.throttlePredicate;
        this.errorHandler = b.errorHandler;
        this.backtraceDepth = b.backtraceDepth;
        this.backtraceFilter = b.backtraceFilter;
        this.retryPolicy = b.retryPolicy;
        this.schedulerLockName = b.schedulerLockName;
    }

    public static EngineConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    public int defaultMaxAttempts() { return defaultMaxAttempts; }
    public Duration defaultIterationPause() { return defaultIterationPause; }
    public Duration maxSliceDuration() { return maxSliceDuration; }
    public Duration stuckMargin() { return stuckMargin; }
    public Duration throttleCheckInterval() { return throttleCheckInterval; }
    public Duration throttleBackoff() { return throttleBackoff; }
    public ThrottlePredicate throttlePredicate() { return throttlePredicate; }
    public MigrationErrorHandler errorHandler() { return errorHandler; }
    public int backtraceDepth() { return backtraceDepth; }
    public Predicate<StackTraceElement> backtraceFilter() { return backtraceFilter; }
    public RetryPolicy retryPolicy() { return retryPolicy; }
    public String schedulerLockName() { return schedulerLockName; }

    /** heartbeat 가 이만큼 끊기면 stuck */
    public Duration stuckTimeout() { return maxSliceDuration.plus(stuckMargin); }

    public static final class Builder {
        private int defaultMaxAttempts = 5;
        private Duration defaultIterationPause = Duration.ZERO;
        private Duration maxSliceDuration = Duration.ofMinutes(5);
        private Duration stuckMargin = Duration.ofMinutes(5);
        private Duration throttleCheckInterval = Duration.ofSeconds(5);
        private Duration throttleBackoff = Duration.ofSeconds(5);
        private ThrottlePredicate throttlePredicate = ThrottlePredicate.NEVER;
        private MigrationErrorHandler errorHandler = MigrationErrorHandler.NOOP;
        private int backtraceDepth = 30;
        private Predicate<StackTraceElement> backtraceFilter = e -> true;
        private RetryPolicy retryPolicy = RetryPolicy.fixed(Duration.ZERO);
        private String schedulerLockName = "stepwise-scheduler";

        private Builder() {}

        public Builder defaultMaxAttempts(int v) {
            if (v < 1) throw new IllegalArgumentException("defaultMaxAttempts must be >= 1");
            this.defaultMaxAttempts = v; return this;
        }
        public Builder defaultIterationPause(Duration v) { this.defaultIterationPause = nonNegative(v, "defaultIterationPause"); return this; }
        public Builder maxSliceDuration(Duration v) { this.maxSliceDuration = nonNegative(v, "maxSliceDuration"); return this; }
        public Builder stuckMargin(Duration v) { this.stuckMargin = nonNegative(v, "stuckMargin"); return this; }
        public Builder throttleCheckInterval(Duration v) { this.throttleCheckInterval = nonNegative(v, "throttleCheckInterval"); return this; }
        public Builder throttleBackoff(Duration v) { this.throttleBackoff = nonNegative(v, "throttleBackoff"); return this; }
        public Builder throttlePredicate(ThrottlePredicate v) { this.throttlePredicate = Objects.requireNonNull(v); return this; }
        public Builder errorHandler(MigrationErrorHandler v) { this.errorHandler = Objects.requireNonNull(v); return this; }
        public Builder backtraceDepth(int v) { this.backtraceDepth = Math.max(0, v); return this; }
        public Builder backtraceFilter(Predicate<StackTraceElement> v) { this.backtraceFilter = Objects.requireNonNull(v); return this; }
        public Builder retryPolicy(RetryPolicy v) { this.retryPolicy = Objects.requireNonNull(v); return this; }
        public Builder schedulerLockName(String v) { this.schedulerLockName = Objects.requireNonNull(v); return this; }

        public EngineConfig build() { return new EngineConfig(this); }

        private static Duration nonNegative(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative()) throw new IllegalArgumentException(name + " must not be negative");
            return d;
        }
    }
}
