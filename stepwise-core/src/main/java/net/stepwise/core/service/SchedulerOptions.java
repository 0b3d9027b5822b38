package net.stepwise.core.service;

/**
 * @param maxConcurrency 동시에 in-flight 일 수 있는 최대 마이그레이션 수
 * @param shard          null 이면 전체 샤드
 * @param lockName       null 이면 {@link EngineConfig#schedulerLockName()}
 */
public record SchedulerOptions(int maxConcurrency, String shard, String lockName) {
    public SchedulerOptions {
        if (maxConcurrency < 0) throw new IllegalArgumentException("maxConcurrency must not be negative");
    }

    public static SchedulerOptions of(int maxConcurrency) {
        return new SchedulerOptions(maxConcurrency, null, null);
    }

    public SchedulerOptions withShard(String shard) {
        return new SchedulerOptions(maxConcurrency, shard, lockName);
    }

    String resolveLockName(EngineConfig config) {
        return lockName != null ? lockName : config.schedulerLockName();
    }
}
