package net.stepwise.core.service;

import net.stepwise.core.event.MigrationEvent;
import net.stepwise.core.event.MigrationEvents;
import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.ExecutionContext;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.model.SliceRun;
import net.stepwise.core.spi.Clock;
import net.stepwise.core.spi.MigrationRepository;
import net.stepwise.core.spi.SliceRepository;
import net.stepwise.core.spi.Sleeper;
import net.stepwise.core.spi.TxRunner;
import net.stepwise.core.work.MigrationArguments;
import net.stepwise.core.work.SliceBounds;
import net.stepwise.core.work.WorkDescriptor;
import net.stepwise.core.work.WorkDescriptorRegistry;
import net.stepwise.core.work.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 마이그레이션 하나의 슬라이스 하나를 실행한다.
 * <ol>
 *   <li>PAUSING/CANCELLING 이면 최종 상태로 마무리하고 Stopped</li>
 *   <li>스로틀이 걸려 있으면 Throttled (attempts 소모 없음)</li>
 *   <li>다음 item 을 처리하고 커서/processedCount/heartbeat 저장</li>
 *   <li>3단계의 모든 예외는 여기서 잡아 ERRORED/FAILED 로 기록하고 Failed</li>
 * </ol>
 */
public final class MigrationRunner {
    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final MigrationRepository migrations;
    private final SliceRepository slices;
    private final WorkDescriptorRegistry registry;
    private final MigrationTransitions transitions;
    private final MigrationEvents events;
    private final TxRunner tx;
    private final Clock clock;
    private final Sleeper sleeper;
    private final EngineConfig config;
    private final Throttle throttle;

    // 디스패치 동안 재사용하는 WorkDescriptor 인스턴스
    private final Map<Long, WorkDescriptor<?>> live = new ConcurrentHashMap<>();

    public MigrationRunner(MigrationRepository migrations,
                           SliceRepository slices,
                           WorkDescriptorRegistry registry,
                           MigrationEvents events,
                           TxRunner tx,
                           Clock clock,
                           Sleeper sleeper,
                           EngineConfig config) {
        this.migrations = migrations;
        this.slices = slices;
        this.registry = registry;
        this.events = events;
        this.tx = tx;
        this.clock = clock;
        this.sleeper = sleeper;
        this.config = config;
        this.transitions = new MigrationTransitions(migrations, tx, clock);
        this.throttle = new Throttle(config.throttlePredicate(), config.throttleCheckInterval(), clock);
    }

    public Outcome run(ExecutionContext ctx, long migrationId) throws Exception {
        Migration m = transitions.load(migrationId);
        if (!Objects.equals(ctx.shard(), m.shard())) {
            throw new IllegalArgumentException("Migration " + m.describe() + " cannot run in shard context " + ctx.shard());
        }

        MigrationStatus status = m.status();
        if (status.isStopping()) {
            return stop(ctx, m);
        }

        Entry entry = Entry.NONE;
        if (status == MigrationStatus.ENQUEUED) {
            entry = m.startedAt() == null ? Entry.START : Entry.RESUME;
            var started = transitions.apply(migrationId,
                    cur -> cur.status() == MigrationStatus.ENQUEUED ? MigrationStatus.RUNNING : null);
            if (started.isEmpty()) return new Outcome.Stopped(transitions.load(migrationId).status());
            m = started.get();
            if (entry == Entry.START) events.publish(MigrationEvent.Type.STARTED, m);
        } else if (status == MigrationStatus.ERRORED) {
            // 스케줄러를 거치지 않고 직접 호출된 경우
            var resumed = transitions.apply(migrationId,
                    cur -> cur.status() == MigrationStatus.ERRORED ? MigrationStatus.RUNNING : null);
            if (resumed.isEmpty()) return new Outcome.Stopped(transitions.load(migrationId).status());
            m = resumed.get();
            entry = Entry.RESUME;
            events.publish(MigrationEvent.Type.RETRIED, m);
        } else if (status != MigrationStatus.RUNNING) {
            return new Outcome.Stopped(status);
        } else if (m.attempts() > 0 && !live.containsKey(migrationId)) {
            // 스케줄러가 ERRORED -> RUNNING 으로 클레임한 재시도의 첫 슬라이스
            entry = Entry.RESUME;
        }

        final Migration running = m;
        if (entry != Entry.NONE) {
            final Entry e = entry;
            Outcome failed = guarded(running, () -> {
                WorkDescriptor<?> d = descriptorFor(ctx, running);
                if (e == Entry.START) d.afterStart(); else d.afterResume();
                return null;
            });
            if (failed != null) return failed;
        }

        if (throttle.shouldThrottle()) {
            tx.required(() -> migrations.touch(migrationId, MigrationStatus.RUNNING, clock.now()));
            events.publish(MigrationEvent.Type.THROTTLED, running);
            return new Outcome.Throttled();
        }

        return guarded(running, () -> runSlice(running, descriptorFor(ctx, running)));
    }

    private <T> Outcome runSlice(Migration m, WorkDescriptor<T> d) throws Exception {
        long id = m.id();
        Iterator<WorkItem<T>> items = d.produceItems(m.cursor());
        if (!items.hasNext()) {
            return complete(m, d);
        }

        WorkItem<T> item = items.next();
        if (item.cursor() == null) {
            throw new IllegalStateException("Work item of " + m.describe() + " has no cursor");
        }
        if (m.cursor() != null && d.compareCursors(item.cursor(), m.cursor()) <= 0) {
            throw new IllegalStateException("Cursor of " + m.describe() + " did not advance: "
                    + m.cursor() + " -> " + item.cursor());
        }

        SliceRun slice = null;
        if (item.value() instanceof SliceBounds b) {
            slice = tx.required(() -> slices.begin(id, b.low(), b.high(), clock.now()));
        }

        try {
            d.process(item.value());
        } catch (Exception e) {
            if (slice != null) markSliceFailed(slice, e);
            throw e;
        }

        final SliceRun done = slice;
        boolean saved = tx.required(() -> {
            if (done != null) slices.markSucceeded(done.id(), clock.now());
            return migrations.recordProgress(id, m.cursor(), item.cursor(), 1, clock.now());
        });
        Migration after = transitions.load(id);
        if (!saved) {
            // 멈췄거나, stuck 으로 넘어가 다른 실행기가 커서를 먼저 옮겼다
            live.remove(id);
            log.warn("Progress of {} was not saved (cursor {} -> {}), now status={} cursor={}",
                    m.describe(), m.cursor(), item.cursor(), after.status(), after.cursor());
            return new Outcome.Stopped(after.status());
        }
        events.publish(MigrationEvent.Type.RAN_SLICE, after);

        pace(m.iterationPause());
        return new Outcome.Completed(item.cursor(), false);
    }

    private Outcome complete(Migration m, WorkDescriptor<?> d) throws Exception {
        var done = transitions.apply(m.id(), cur ->
                cur.status() == MigrationStatus.RUNNING || cur.status().isStopping() ? MigrationStatus.SUCCEEDED : null);
        if (done.isEmpty()) {
            return new Outcome.Stopped(transitions.load(m.id()).status());
        }
        live.remove(m.id());
        Migration finished = done.get();
        callback(finished, "afterComplete", d::afterComplete);
        events.publish(MigrationEvent.Type.COMPLETED, finished);
        log.info("Migration {} succeeded, processed={}", finished.describe(), finished.processedCount());
        return new Outcome.Completed(finished.cursor(), true);
    }

    private Outcome stop(ExecutionContext ctx, Migration m) throws Exception {
        MigrationStatus intent = m.status();
        MigrationStatus target = intent == MigrationStatus.PAUSING ? MigrationStatus.PAUSED : MigrationStatus.CANCELLED;
        var stopped = transitions.apply(m.id(), cur -> cur.status() == intent ? target : null);
        if (stopped.isEmpty()) {
            return new Outcome.Stopped(transitions.load(m.id()).status());
        }

        Migration after = stopped.get();
        WorkDescriptor<?> d = live.remove(m.id());
        if (d == null) {
            try {
                d = create(ctx, after);
            } catch (Exception e) {
                log.warn("Could not build work descriptor of {} for stop callbacks", after.describe(), e);
            }
        }
        if (d != null) {
            if (target == MigrationStatus.PAUSED) {
                callback(after, "afterPause", d::afterPause);
            } else {
                callback(after, "afterCancel", d::afterCancel);
                callback(after, "afterComplete", d::afterComplete);
            }
            callback(after, "afterStop", d::afterStop);
        }
        log.info("Migration {} {}", after.describe(), target == MigrationStatus.PAUSED ? "paused" : "cancelled");
        return new Outcome.Stopped(target);
    }

    /** 디스패치가 끝나면 캐시한 descriptor 를 버린다. */
    public void release(long migrationId) {
        live.remove(migrationId);
    }

    /** 예외를 실패 상태로 바꾼다. 정상 종료면 body 결과 */
    private Outcome guarded(Migration m, Callable<Outcome> body) throws Exception {
        try {
            return body.call();
        } catch (Exception e) {
            return fail(m, e);
        }
    }

    private Outcome fail(Migration m, Exception error) throws Exception {
        live.remove(m.id());
        ErrorInfo info = ErrorInfo.of(error, config.backtraceDepth(), config.backtraceFilter());
        Migration failed = transitions.recordFailure(m.id(), info);
        boolean terminal = failed.status() == MigrationStatus.FAILED;
        if (terminal) {
            log.error("Migration {} failed after {} attempt(s)", failed.describe(), failed.attempts(), error);
        } else {
            log.warn("Migration {} errored (attempt {}/{}): {}",
                    failed.describe(), failed.attempts(), failed.maxAttempts(), error.toString());
        }
        try {
            config.errorHandler().handle(error, failed);
        } catch (RuntimeException hookError) {
            log.warn("Error handler raised for {}", failed.describe(), hookError);
        }
        return new Outcome.Failed(error, terminal);
    }

    private void markSliceFailed(SliceRun slice, Exception cause) {
        try {
            ErrorInfo info = ErrorInfo.of(cause, 0, e -> false);
            tx.requiresNew(() -> { slices.markFailed(slice.id(), info, clock.now()); return null; });
        } catch (Exception e) {
            cause.addSuppressed(e);
        }
    }

    private WorkDescriptor<?> descriptorFor(ExecutionContext ctx, Migration m) throws Exception {
        WorkDescriptor<?> d = live.get(m.id());
        if (d == null) {
            d = create(ctx, m);
            live.put(m.id(), d);
        }
        return d;
    }

    private WorkDescriptor<?> create(ExecutionContext ctx, Migration m) throws Exception {
        return registry.create(m.name(), MigrationArguments.parse(m.arguments()), ctx);
    }

    private void pace(Duration pause) {
        if (pause == null || pause.isZero()) return;
        try {
            sleeper.sleep(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void callback(Migration m, String name, Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("{} callback of {} raised", name, m.describe(), e);
        }
    }

    private enum Entry { NONE, START, RESUME }
}
