package net.stepwise.core.spi;

import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.SliceRun;

import java.time.Instant;
import java.util.List;

public interface SliceRepository {
    /** (migrationId, min) 기준 upsert. 상태는 RUNNING, attempts 는 1 증가. */
    SliceRun begin(long migrationId, long min, long max, Instant at) throws Exception;

    void markSucceeded(long sliceId, Instant at) throws Exception;

    void markFailed(long sliceId, ErrorInfo error, Instant at) throws Exception;

    List<SliceRun> findByMigration(long migrationId) throws Exception;
}
