package net.stepwise.adapter.jdbc;

import net.stepwise.core.exception.ValidationException;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.model.SliceRun;
import net.stepwise.core.service.EnqueueOptions;
import net.stepwise.core.service.SchedulerOptions;
import net.stepwise.core.work.MigrationArguments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 기본 제공 JDBC 작업을 스케줄러 + 워커로 끝까지 돌린다.
 */
class JdbcWorkDescriptorsAcceptanceTest extends EngineAcceptanceSupport {

    static final Map<String, Object> SMALL_BATCHES = Map.of("batchSize", 100, "subBatchSize", 30, "subBatchPauseMs", 0);

    @BeforeEach
    void seedTables() throws Exception {
        exec(tx,
                "DROP TABLE IF EXISTS demo_orders",
                "DROP TABLE IF EXISTS demo_users",
                "CREATE TABLE demo_users (id BIGSERIAL PRIMARY KEY, name TEXT, active BOOLEAN, nickname TEXT)",
                "CREATE TABLE demo_orders (id BIGSERIAL PRIMARY KEY, user_id BIGINT)",
                "INSERT INTO demo_users(name) SELECT 'user-' || g FROM generate_series(1, 250) g",
                "INSERT INTO demo_orders(user_id) SELECT g FROM generate_series(1, 300) g");
    }

    @Test
    void backfillColumn_updatesEveryRowInSlices() throws Exception {
        Migration m = service().enqueue("BackfillColumn",
                MigrationArguments.of("demo_users", "active", true, SMALL_BATCHES)).get(0);
        assertEquals(3L, m.estimatedTotal());

        schedulerWithWorker().tick(SchedulerOptions.of(1));

        Migration done = tx.required(() -> migrations.findById(m.id())).orElseThrow();
        assertEquals(MigrationStatus.SUCCEEDED, done.status());
        assertEquals(3, done.processedCount());
        assertEquals("250", done.cursor());
        assertEquals(0, count("SELECT COUNT(*) FROM demo_users WHERE active IS DISTINCT FROM TRUE"));

        List<SliceRun> recorded = tx.required(() -> slices.findByMigration(m.id()));
        assertEquals(List.of(1L, 101L, 201L), recorded.stream().map(SliceRun::minValue).toList());
        assertTrue(recorded.stream().allMatch(s -> s.status() == SliceRun.Status.SUCCEEDED));
    }

    @Test
    void backfillColumn_textValue() throws Exception {
        Migration m = service().enqueue("BackfillColumn",
                MigrationArguments.of("demo_users", "nickname", "anon", SMALL_BATCHES)).get(0);

        schedulerWithWorker().tick(SchedulerOptions.of(1));

        assertEquals(MigrationStatus.SUCCEEDED, tx.required(() -> migrations.findById(m.id())).orElseThrow().status());
        assertEquals(250, count("SELECT COUNT(*) FROM demo_users WHERE nickname = 'anon'"));
    }

    @Test
    void copyColumn_copiesValues() throws Exception {
        service().enqueue("CopyColumn", MigrationArguments.of("demo_users", "name", "nickname", SMALL_BATCHES));

        schedulerWithWorker().tick(SchedulerOptions.of(1));

        assertEquals(0, count("SELECT COUNT(*) FROM demo_users WHERE nickname IS DISTINCT FROM name"));
    }

    @Test
    void deleteOrphanedRecords_keepsOrdersWithParent() throws Exception {
        service().enqueue("DeleteOrphanedRecords",
                MigrationArguments.of("demo_orders", "user_id", "demo_users", SMALL_BATCHES));

        schedulerWithWorker().tick(SchedulerOptions.of(1));

        assertEquals(250, count("SELECT COUNT(*) FROM demo_orders"));
        assertEquals(0, count("SELECT COUNT(*) FROM demo_orders WHERE user_id > 250"));
    }

    @Test
    void schemaStatement_runsOnceWithResourceKey() throws Exception {
        Migration m = service().enqueue("SchemaStatement",
                MigrationArguments.of("CREATE INDEX ix_demo_users_name ON demo_users (name)", 30),
                EnqueueOptions.defaults().withTableName("demo_users")).get(0);
        assertNotNull(m.resourceKey());

        schedulerWithWorker().tick(SchedulerOptions.of(1));

        assertEquals(MigrationStatus.SUCCEEDED, tx.required(() -> migrations.findById(m.id())).orElseThrow().status());
        assertEquals(1, count("SELECT COUNT(*) FROM pg_indexes WHERE indexname = 'ix_demo_users_name'"));
    }

    @Test
    void failingStatement_isRecordedAsErrored() throws Exception {
        Migration m = service().enqueue("SchemaStatement",
                MigrationArguments.of("ALTER TABLE demo_missing ADD COLUMN x INT")).get(0);

        schedulerWithWorker().tick(SchedulerOptions.of(1));

        Migration errored = tx.required(() -> migrations.findById(m.id())).orElseThrow();
        assertEquals(MigrationStatus.ERRORED, errored.status());
        assertEquals(1, errored.attempts());
        assertTrue(errored.error().errorClass().contains("PSQLException"));
    }

    @Test
    void invalidIdentifiers_areRejectedAtEnqueue() {
        assertThrows(ValidationException.class, () -> service().enqueue("BackfillColumn",
                MigrationArguments.of("demo_users; DROP TABLE demo_users", "active", true)));
        assertThrows(ValidationException.class, () -> service().enqueue("CopyColumn",
                MigrationArguments.of("demo_users", "name", "nick name")));
    }

    @Test
    void emptyTable_succeedsImmediately() throws Exception {
        exec(tx, "DELETE FROM demo_orders");
        Migration m = service().enqueue("DeleteOrphanedRecords",
                MigrationArguments.of("demo_orders", "user_id", "demo_users")).get(0);
        assertEquals(0L, m.estimatedTotal());

        schedulerWithWorker().tick(SchedulerOptions.of(1));

        Migration done = tx.required(() -> migrations.findById(m.id())).orElseThrow();
        assertEquals(MigrationStatus.SUCCEEDED, done.status());
        assertEquals(0, done.processedCount());
    }
}
