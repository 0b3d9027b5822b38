package net.stepwise.core.service;

import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.spi.MigrationExecutor;
import net.stepwise.core.support.EngineTestSupport;
import net.stepwise.core.work.MigrationArguments;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static net.stepwise.core.event.MigrationEvent.Type.*;
import static org.junit.jupiter.api.Assertions.*;

class MigrationSchedulerTest extends EngineTestSupport {

    private static final ErrorInfo BOOM = new ErrorInfo("java.lang.IllegalStateException", "boom", "");

    private Migration running(Migration m) throws Exception {
        assertTrue(transitions.transitionIf(m.id(), MigrationStatus.PENDING, MigrationStatus.ENQUEUED));
        assertTrue(transitions.transitionIf(m.id(), MigrationStatus.ENQUEUED, MigrationStatus.RUNNING));
        return reload(m.id());
    }

    private Migration errored(Migration m) throws Exception {
        running(m);
        return transitions.recordFailure(m.id(), BOOM);
    }

    @Test
    void pending_areDispatchedInCreationOrder_upToConcurrency() throws Exception {
        Migration a = enqueue("List", "a");
        Migration b = enqueue("List", "b");
        Migration c = enqueue("List", "c");
        var executor = new RecordingExecutor();
        var scheduler = scheduler(EngineConfig.defaults(), executor);

        var first = scheduler.tick(SchedulerOptions.of(2));

        assertFalse(first.lockSkipped);
        assertEquals(List.of(a.id(), b.id()), first.dispatched);
        assertEquals(List.of(a.id(), b.id()), executor.executed);
        assertEquals(MigrationStatus.ENQUEUED, reload(a.id()).status());
        assertEquals(MigrationStatus.PENDING, reload(c.id()).status());

        // 두 개가 아직 in-flight 라 자리가 없다
        var second = scheduler.tick(SchedulerOptions.of(2));
        assertEquals(2, second.active);
        assertTrue(second.dispatched.isEmpty());

        var third = scheduler.tick(SchedulerOptions.of(3));
        assertEquals(List.of(c.id()), third.dispatched);
    }

    @Test
    void rejectedDispatch_doesNotStopTheRest() throws Exception {
        var cfg = EngineConfig.defaults();
        Migration a = enqueue("List", "a");
        Migration b = enqueue("List", "b");
        var recording = new RecordingExecutor();
        MigrationExecutor executor = (ctx, id) -> {
            if (id == a.id()) throw new RejectedExecutionException("pool full");
            recording.execute(ctx, id);
        };
        var scheduler = scheduler(cfg, executor);

        var report = scheduler.tick(SchedulerOptions.of(2));

        assertEquals(List.of(b.id()), report.dispatched);
        assertEquals(List.of(a.id()), report.rejected);
        assertEquals(List.of(b.id()), recording.executed);
        // 거절된 건 ENQUEUED 로 남고 stuck 처리로 다시 잡힌다
        assertEquals(MigrationStatus.ENQUEUED, reload(a.id()).status());

        clock.advance(cfg.stuckTimeout().plusMillis(1));
        var later = scheduler(cfg, recording).tick(SchedulerOptions.of(2));
        assertTrue(later.dispatched.contains(a.id()));
    }

    @Test
    void zeroConcurrency_dispatchesNothing() throws Exception {
        enqueue("List", "a");
        var executor = new RecordingExecutor();

        var report = scheduler(EngineConfig.defaults(), executor).tick(SchedulerOptions.of(0));

        assertTrue(report.dispatched.isEmpty());
        assertTrue(executor.executed.isEmpty());
    }

    @Test
    void freshRunning_holdsASlot() throws Exception {
        Migration busy = running(enqueue("List", "a"));
        Migration waiting = enqueue("List", "b");
        var executor = new RecordingExecutor();

        var report = scheduler(EngineConfig.defaults(), executor).tick(SchedulerOptions.of(1));

        assertEquals(1, report.active);
        assertTrue(report.dispatched.isEmpty());
        assertEquals(MigrationStatus.RUNNING, reload(busy.id()).status());
        assertEquals(MigrationStatus.PENDING, reload(waiting.id()).status());
    }

    @Test
    void stuckRunning_isReEnqueuedAndDispatched() throws Exception {
        var cfg = EngineConfig.defaults();
        Migration m = running(enqueue("List", "a"));
        clock.advance(cfg.stuckTimeout().plusMillis(1));
        var executor = new RecordingExecutor();

        var report = scheduler(cfg, executor).tick(SchedulerOptions.of(1));

        assertEquals(List.of(m.id()), report.stuck);
        assertEquals(List.of(m.id()), report.dispatched);
        assertEquals(MigrationStatus.ENQUEUED, reload(m.id()).status());
    }

    @Test
    void stuckPausing_isDispatchedWithoutChangingStatus() throws Exception {
        var cfg = EngineConfig.defaults();
        Migration m = running(enqueue("List", "a"));
        assertTrue(transitions.transitionIf(m.id(), MigrationStatus.RUNNING, MigrationStatus.PAUSING));
        clock.advance(cfg.stuckTimeout().plusMillis(1));
        var executor = new RecordingExecutor();

        var report = scheduler(cfg, executor).tick(SchedulerOptions.of(1));

        assertEquals(List.of(m.id()), report.dispatched);
        Migration after = reload(m.id());
        assertEquals(MigrationStatus.PAUSING, after.status());
        assertTrue(after.updatedAt().isAfter(m.updatedAt()));
    }

    @Test
    void errored_withAttemptsLeft_isRetried() throws Exception {
        var cfg = EngineConfig.defaults();
        Migration m = errored(enqueue(cfg, "List", EnqueueOptions.defaults().withMaxAttempts(3), "a"));
        assertEquals(MigrationStatus.ERRORED, m.status());
        var executor = new RecordingExecutor();

        var report = scheduler(cfg, executor).tick(SchedulerOptions.of(1));

        assertEquals(List.of(m.id()), report.dispatched);
        assertEquals(MigrationStatus.RUNNING, reload(m.id()).status());
        assertEquals(List.of(RETRIED), eventTypes());
    }

    @Test
    void errored_withAttemptsExhausted_isNotDispatched() throws Exception {
        Migration m = enqueue(EngineConfig.defaults(), "List", EnqueueOptions.defaults().withMaxAttempts(2), "a");
        migrations.put(new Migration(m.id(), m.name(), m.arguments(), m.shard(), m.connectionName(), m.tableName(),
                MigrationStatus.ERRORED, null, 0, null, 2, 2, Duration.ZERO, BOOM,
                m.createdAt(), m.updatedAt(), m.createdAt(), null));
        var executor = new RecordingExecutor();

        var report = scheduler(EngineConfig.defaults(), executor).tick(SchedulerOptions.of(1));

        assertTrue(report.dispatched.isEmpty());
        assertEquals(MigrationStatus.ERRORED, reload(m.id()).status());
    }

    @Test
    void errored_waitsForRetryBackoff() throws Exception {
        var cfg = config().retryPolicy(RetryPolicy.fixed(Duration.ofMinutes(1))).build();
        Migration m = errored(enqueue(cfg, "List", EnqueueOptions.defaults(), "a"));
        var executor = new RecordingExecutor();
        var scheduler = scheduler(cfg, executor);

        assertTrue(scheduler.tick(SchedulerOptions.of(1)).dispatched.isEmpty());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(List.of(m.id()), scheduler.tick(SchedulerOptions.of(1)).dispatched);
    }

    @Test
    void lockHeldElsewhere_skipsTick() throws Exception {
        var cfg = EngineConfig.defaults();
        Migration m = enqueue("List", "a");
        lock.holdExternally(cfg.schedulerLockName());
        var executor = new RecordingExecutor();

        var report = scheduler(cfg, executor).tick(SchedulerOptions.of(5));

        assertTrue(report.lockSkipped);
        assertTrue(report.dispatched.isEmpty());
        assertEquals(MigrationStatus.PENDING, reload(m.id()).status());

        lock.releaseExternally(cfg.schedulerLockName());
        assertEquals(List.of(m.id()), scheduler(cfg, executor).tick(SchedulerOptions.of(5)).dispatched);
    }

    @Test
    void customLockName_isUsed() throws Exception {
        enqueue("List", "a");
        lock.holdExternally("stepwise-scheduler");

        var report = scheduler(EngineConfig.defaults(), new RecordingExecutor())
                .tick(new SchedulerOptions(1, null, "other-lock"));

        assertFalse(report.lockSkipped);
        assertEquals(1, report.dispatched.size());
    }

    @Test
    void shardFilter_onlyConsidersThatShard() throws Exception {
        List<Migration> children = service(EngineConfig.defaults())
                .enqueue("List", MigrationArguments.of("a"),
                        EnqueueOptions.defaults().withShards(List.of("s1", "s2")));
        var executor = new RecordingExecutor();

        var report = scheduler(EngineConfig.defaults(), executor).tick(SchedulerOptions.of(5).withShard("s2"));

        assertEquals(List.of(children.get(1).id()), report.dispatched);
        assertEquals(MigrationStatus.PENDING, reload(children.get(0).id()).status());
    }

    @Test
    void sameResourceKey_neverRunsConcurrently() throws Exception {
        var cfg = EngineConfig.defaults();
        var onUsers = EnqueueOptions.defaults().withTableName("users");
        Migration first = enqueue(cfg, "List", onUsers, "add-column");
        Migration second = enqueue(cfg, "List", onUsers, "add-index");
        Migration other = enqueue(cfg, "List", EnqueueOptions.defaults().withTableName("orders"), "add-column");
        var executor = new RecordingExecutor();
        var scheduler = scheduler(cfg, executor);

        var report = scheduler.tick(SchedulerOptions.of(5));

        assertEquals(List.of(first.id(), other.id()), report.dispatched);
        assertEquals(List.of(second.id()), report.blocked);

        // 첫 번째가 아직 in-flight
        var again = scheduler.tick(SchedulerOptions.of(5));
        assertEquals(List.of(second.id()), again.blocked);
        assertTrue(again.dispatched.isEmpty());
    }

    @Test
    void sameTableOnDifferentShards_isNotBlocked() throws Exception {
        List<Migration> children = service(EngineConfig.defaults())
                .enqueue("List", MigrationArguments.of("x"),
                        EnqueueOptions.defaults().withTableName("users").withShards(List.of("s1", "s2")));

        var report = scheduler(EngineConfig.defaults(), new RecordingExecutor()).tick(SchedulerOptions.of(5));

        assertEquals(children.stream().map(Migration::id).toList(), report.dispatched);
        assertTrue(report.blocked.isEmpty());
    }

    @Test
    void delayed_runsOnlyAfterApproval() throws Exception {
        var cfg = EngineConfig.defaults();
        Migration m = enqueue(cfg, "List", EnqueueOptions.defaults().withDelayed(true), "a");
        assertEquals(MigrationStatus.DELAYED, m.status());
        var executor = new RecordingExecutor();
        var scheduler = scheduler(cfg, executor);

        assertTrue(scheduler.tick(SchedulerOptions.of(1)).dispatched.isEmpty());

        assertTrue(service(cfg).approve(m.id()));
        assertEquals(List.of(m.id()), scheduler.tick(SchedulerOptions.of(1)).dispatched);
    }

    @Test
    void withWorker_runsMigrationToCompletionInOneTick() throws Exception {
        items.addAll(List.of("a", "b", "c"));
        Migration m = enqueue("List");

        var report = schedulerWithWorker(EngineConfig.defaults()).tick(SchedulerOptions.of(1));

        assertEquals(List.of(m.id()), report.dispatched);
        assertEquals(MigrationStatus.SUCCEEDED, reload(m.id()).status());
        assertEquals(List.of("a", "b", "c"), processed);
        assertEquals(List.of(STARTED, RAN_SLICE, RAN_SLICE, RAN_SLICE, COMPLETED), eventTypes());
    }

    @Test
    void withWorker_throttledMigrationBacksOffThenFinishes() throws Exception {
        items.add("a");
        var flags = new AtomicInteger();
        var cfg = config()
                .throttleCheckInterval(Duration.ZERO)
                .throttleBackoff(Duration.ofSeconds(3))
                .throttlePredicate(() -> flags.incrementAndGet() == 1)
                .build();
        Migration m = enqueue(cfg, "List", EnqueueOptions.defaults());

        schedulerWithWorker(cfg).tick(SchedulerOptions.of(1));

        assertEquals(MigrationStatus.SUCCEEDED, reload(m.id()).status());
        assertEquals(List.of(Duration.ofSeconds(3)), sleeps);
        assertEquals(0, reload(m.id()).attempts());
    }
}
