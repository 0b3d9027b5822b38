package net.stepwise.core.spi;

import net.stepwise.core.model.ExecutionContext;

/** 스케줄러가 선택한 마이그레이션을 넘겨받아 실행하는 쪽. */
@FunctionalInterface
public interface MigrationExecutor {
    void execute(ExecutionContext ctx, long migrationId) throws Exception;
}
