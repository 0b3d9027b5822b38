package net.stepwise.core.service;

import net.stepwise.core.exception.StateTransitionException;
import net.stepwise.core.exception.ValidationException;
import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.spi.Clock;
import net.stepwise.core.spi.MigrationRepository;
import net.stepwise.core.spi.TxRunner;

import java.util.Optional;
import java.util.function.Function;

/**
 * 모든 상태 쓰기가 지나가는 곳. 전이 테이블 검증 후 compare-and-set 으로 기록한다.
 */
public final class MigrationTransitions {
    /** CAS 경합 시 다시 읽고 재시도하는 횟수 */
    private static final int MAX_RACE_RETRIES = 5;

    private final MigrationRepository migrations;
    private final TxRunner tx;
    private final Clock clock;

    public MigrationTransitions(MigrationRepository migrations, TxRunner tx, Clock clock) {
        this.migrations = migrations;
        this.tx = tx;
        this.clock = clock;
    }

    public Migration load(long id) throws Exception {
        return tx.required(() -> migrations.findById(id))
                .orElseThrow(() -> new ValidationException("Unknown migration id: " + id));
    }

    /**
     * 현재 상태가 from 일 때만 to 로 바꾼다.
     * @return 경합으로 상태가 이미 바뀌어 있었으면 false
     * @throws StateTransitionException from -> to 가 테이블에 없을 때
     */
    public boolean transitionIf(long id, MigrationStatus from, MigrationStatus to) throws Exception {
        requirePlain(to);
        from.checkTransition(to);
        return tx.required(() -> migrations.updateStatus(id, from, to, clock.now()));
    }

    /**
     * 최신 행을 읽어 decide 로 목표 상태를 정하고 전이한다. decide 가 null 이면 아무것도 하지 않는다.
     * @return 전이 후의 행, 아무것도 안 했으면 empty
     */
    public Optional<Migration> apply(long id, Function<Migration, MigrationStatus> decide) throws Exception {
        for (int i = 0; i < MAX_RACE_RETRIES; i++) {
            Migration current = load(id);
            MigrationStatus to = decide.apply(current);
            if (to == null) return Optional.empty();
            requirePlain(to);
            current.status().checkTransition(to);
            if (tx.required(() -> migrations.updateStatus(id, current.status(), to, clock.now()))) {
                return Optional.of(load(id));
            }
        }
        throw raceLost(id);
    }

    /** 현재 상태에서 to 로. 전이가 불법이면 예외. */
    public Migration transition(long id, MigrationStatus to) throws Exception {
        return apply(id, m -> to).orElseThrow();
    }

    /**
     * 실패 기록. attempts 를 1 올리고, 남아 있으면 ERRORED, 다 썼으면 FAILED.
     */
    public Migration recordFailure(long id, ErrorInfo error) throws Exception {
        for (int i = 0; i < MAX_RACE_RETRIES; i++) {
            Migration current = load(id);
            int attempts = current.attempts() + 1;
            MigrationStatus to = attempts >= current.maxAttempts() ? MigrationStatus.FAILED : MigrationStatus.ERRORED;
            current.status().checkTransition(to);
            if (tx.required(() -> migrations.recordFailure(id, current.status(), to, attempts, error, clock.now()))) {
                return load(id);
            }
        }
        throw raceLost(id);
    }

    /** FAILED -> PENDING. 커서는 그대로 두고 attempts/에러만 초기화한다. */
    public Migration retry(long id) throws Exception {
        Migration current = load(id);
        if (current.status() != MigrationStatus.FAILED) {
            throw new StateTransitionException(current.status(), MigrationStatus.PENDING,
                    "retry is only allowed from FAILED, migration " + id + " is " + current.status());
        }
        if (!tx.required(() -> migrations.resetForRetry(id, clock.now()))) {
            throw raceLost(id);
        }
        return load(id);
    }

    private static void requirePlain(MigrationStatus to) {
        if (to == MigrationStatus.ERRORED || to == MigrationStatus.FAILED) {
            throw new IllegalArgumentException("use recordFailure for " + to);
        }
    }

    private StateTransitionException raceLost(long id) throws Exception {
        MigrationStatus now = load(id).status();
        return new StateTransitionException(now, null,
                "Migration " + id + " status kept changing concurrently (now " + now + ")");
    }
}
