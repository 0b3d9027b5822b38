package net.stepwise.core.service;

import net.stepwise.core.model.MigrationStatus;

/** {@link MigrationRunner#run} 한 번의 결과 */
public sealed interface Outcome permits Outcome.Completed, Outcome.Stopped, Outcome.Throttled, Outcome.Failed {

    /**
     * 슬라이스 하나를 끝냈다.
     * @param finished true 면 구간이 끝나 SUCCEEDED 로 전이됨
     */
    record Completed(String cursor, boolean finished) implements Outcome { }

    /** pause/cancel 을 마무리했거나, 실행할 상태가 아니었다. */
    record Stopped(MigrationStatus status) implements Outcome { }

    record Throttled() implements Outcome { }

    /** @param terminal true 면 FAILED, false 면 ERRORED */
    record Failed(Throwable error, boolean terminal) implements Outcome { }
}
