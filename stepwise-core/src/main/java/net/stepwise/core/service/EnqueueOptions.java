package net.stepwise.core.service;

import java.time.Duration;
import java.util.List;

/**
 * @param shards         비어 있으면 샤드 없는 마이그레이션 하나
 * @param tableName      지정하면 스키마 변경 계열로 보고 (table, shard, connection) 배타 규칙을 적용
 * @param maxAttempts    null 이면 설정 기본값
 * @param iterationPause null 이면 설정 기본값
 * @param delayed        true 면 DELAYED 로 생성, approve 전까지 실행되지 않는다
 */
public record EnqueueOptions(
        List<String> shards,
        String connectionName,
        String tableName,
        Integer maxAttempts,
        Duration iterationPause,
        boolean delayed
) {
    public EnqueueOptions {
        shards = shards == null ? List.of() : List.copyOf(shards);
    }

    public static EnqueueOptions defaults() {
        return new EnqueueOptions(List.of(), null, null, null, null, false);
    }

    public EnqueueOptions withShards(List<String> v) { return new EnqueueOptions(v, connectionName, tableName, maxAttempts, iterationPause, delayed); }
    public EnqueueOptions withConnectionName(String v) { return new EnqueueOptions(shards, v, tableName, maxAttempts, iterationPause, delayed); }
    public EnqueueOptions withTableName(String v) { return new EnqueueOptions(shards, connectionName, v, maxAttempts, iterationPause, delayed); }
    public EnqueueOptions withMaxAttempts(Integer v) { return new EnqueueOptions(shards, connectionName, tableName, v, iterationPause, delayed); }
    public EnqueueOptions withIterationPause(Duration v) { return new EnqueueOptions(shards, connectionName, tableName, maxAttempts, v, delayed); }
    public EnqueueOptions withDelayed(boolean v) { return new EnqueueOptions(shards, connectionName, tableName, maxAttempts, iterationPause, v); }
}
