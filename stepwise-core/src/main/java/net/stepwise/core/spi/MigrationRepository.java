package net.stepwise.core.spi;

import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Migration 영속화. 상태를 바꾸는 메서드는 모두 기대 상태를 조건으로 하는 compare-and-set 이며,
 * 다른 주체가 먼저 바꿨으면 false 를 돌려준다.
 */
public interface MigrationRepository {

    /** (name, arguments, shard) 가 이미 있으면 기존 행을 돌려준다. */
    Migration insertIfAbsent(Migration draft) throws Exception;

    Optional<Migration> findById(long id) throws Exception;

    Optional<Migration> findByConfiguration(String name, String arguments, String shard) throws Exception;

    /** 같은 논리 마이그레이션의 전체 샤드 */
    List<Migration> findByNameAndArguments(String name, String arguments) throws Exception;

    /**
     * 스케줄러 후보 조회. PENDING/ENQUEUED/RUNNING/PAUSING/CANCELLING/ERRORED 를 생성 순으로.
     * @param shard null 이면 전체 샤드
     */
    List<Migration> findSchedulable(String shard) throws Exception;

    /**
     * 일반 상태 전이. 에러 필드를 비우고, RUNNING 진입 시 startedAt 을, 종료 상태 진입 시 finishedAt 을 기록한다.
     * ERRORED/FAILED 로의 전이는 {@link #recordFailure} 를 쓴다.
     */
    boolean updateStatus(long id, MigrationStatus from, MigrationStatus to, Instant at) throws Exception;

    boolean recordFailure(long id, MigrationStatus from, MigrationStatus to,
                          int attempts, ErrorInfo error, Instant at) throws Exception;

    /** FAILED -> PENDING. attempts/에러를 초기화하고 커서는 유지한다. */
    boolean resetForRetry(long id, Instant at) throws Exception;

    /**
     * 커서 저장 + processedCount 증가 + heartbeat. 진행 중 상태(RUNNING/PAUSING/CANCELLING)이고
     * 저장된 커서가 expectedCursor 와 같을 때만 (null 은 null 과 같다). 다른 실행기가 먼저 전진했으면 false.
     */
    boolean recordProgress(long id, String expectedCursor, String cursor, long processedDelta, Instant at) throws Exception;

    /** 상태가 expected 일 때만 heartbeat 갱신 */
    boolean touch(long id, MigrationStatus expected, Instant at) throws Exception;
}
