package net.stepwise.core.model;

import java.time.Duration;
import java.time.Instant;

public record Migration(
        Long id,
        String name,
        String arguments,
        String shard,
        String connectionName,
        String tableName,
        MigrationStatus status,
        String cursor,
        long processedCount,
        Long estimatedTotal,
        int attempts,
        int maxAttempts,
        Duration iterationPause,
        ErrorInfo error,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static Migration ofNew(String name, String arguments, String shard,
                                  String connectionName, String tableName,
                                  MigrationStatus initial, Long estimatedTotal,
                                  int maxAttempts, Duration iterationPause, Instant now) {
        return new Migration(null, name, arguments, shard, connectionName, tableName, initial,
                null, 0L, estimatedTotal, 0, maxAttempts, iterationPause, null,
                now, now, null, null);
    }

    /** 스키마 변경 계열만 리소스 키를 가진다. */
    public ResourceKey resourceKey() {
        return tableName == null ? null : new ResourceKey(tableName, shard, connectionName);
    }

    public boolean attemptsExhausted() {
        return attempts >= maxAttempts;
    }

    public boolean isStuck(Instant now, Duration stuckTimeout) {
        return status.isInFlight() && !updatedAt.isAfter(now.minus(stuckTimeout));
    }

    public ExecutionContext executionContext() {
        return new ExecutionContext(shard, connectionName);
    }

    public String describe() {
        return shard == null ? name + "#" + id : name + "#" + id + "@" + shard;
    }
}
