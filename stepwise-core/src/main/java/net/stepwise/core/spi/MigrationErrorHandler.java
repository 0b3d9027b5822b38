package net.stepwise.core.spi;

import net.stepwise.core.model.Migration;

/**
 * 슬라이스 실패마다 한 번 호출된다. 여기서 던진 예외는 로그만 남기고 무시된다.
 */
@FunctionalInterface
public interface MigrationErrorHandler {
    void handle(Throwable error, Migration migration);

    MigrationErrorHandler NOOP = (error, migration) -> { };
}
