package net.stepwise.core.service;

import net.stepwise.core.model.ExecutionContext;
import net.stepwise.core.spi.MigrationExecutor;
import net.stepwise.core.spi.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 기본 실행기. 호출 스레드에서 끝나거나 멈추거나 실패할 때까지 슬라이스를 반복한다.
 * 스로틀 중에는 backoff 만큼 쉬었다가 다시 시도한다.
 */
public final class MigrationWorker implements MigrationExecutor {
    private static final Logger log = LoggerFactory.getLogger(MigrationWorker.class);

    private final MigrationRunner runner;
    private final Sleeper sleeper;
    private final Duration throttleBackoff;

    public MigrationWorker(MigrationRunner runner, Sleeper sleeper, EngineConfig config) {
        this.runner = runner;
        this.sleeper = sleeper;
        this.throttleBackoff = config.throttleBackoff();
    }

    @Override
    public void execute(ExecutionContext ctx, long migrationId) throws Exception {
        try {
            loop(ctx, migrationId);
        } finally {
            runner.release(migrationId);
        }
    }

    private void loop(ExecutionContext ctx, long migrationId) throws Exception {
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Worker interrupted, leaving migration {} for the next dispatch", migrationId);
                return;
            }
            Outcome outcome = runner.run(ctx, migrationId);
            if (outcome instanceof Outcome.Completed c) {
                if (c.finished()) return;
            } else if (outcome instanceof Outcome.Throttled) {
                try {
                    sleeper.sleep(throttleBackoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            } else {
                return;
            }
        }
    }
}
