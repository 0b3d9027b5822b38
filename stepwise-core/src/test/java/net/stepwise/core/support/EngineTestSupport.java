package net.stepwise.core.support;

import net.stepwise.core.event.MigrationEvent;
import net.stepwise.core.event.MigrationEvents;
import net.stepwise.core.model.ExecutionContext;
import net.stepwise.core.model.Migration;
import net.stepwise.core.service.EngineConfig;
import net.stepwise.core.service.EnqueueOptions;
import net.stepwise.core.service.MigrationRunner;
import net.stepwise.core.service.MigrationScheduler;
import net.stepwise.core.service.MigrationService;
import net.stepwise.core.service.MigrationTransitions;
import net.stepwise.core.service.MigrationWorker;
import net.stepwise.core.spi.MigrationExecutor;
import net.stepwise.core.spi.Sleeper;
import net.stepwise.core.work.MigrationArguments;
import net.stepwise.core.work.WorkDescriptorRegistry;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** 메모리 SPI 로 엔진을 조립하는 테스트 베이스 */
public abstract class EngineTestSupport {
    protected MutableClock clock;
    protected DirectTxRunner tx;
    protected InMemoryMigrationRepository migrations;
    protected InMemorySliceRepository slices;
    protected InMemoryExclusivityLock lock;
    protected WorkDescriptorRegistry registry;
    protected MigrationTransitions transitions;

    protected List<MigrationEvent> events;
    protected List<Duration> sleeps;
    protected Sleeper sleeper;

    // "List" descriptor 상태
    protected List<String> items;
    protected List<String> processed;
    protected List<String> hooks;
    protected AtomicInteger failures;

    // "Range" descriptor 상태
    protected List<long[]> ranges;
    protected Map<Long, Integer> failOnce;

    @BeforeEach
    void setUpEngine() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        tx = new DirectTxRunner();
        migrations = new InMemoryMigrationRepository();
        slices = new InMemorySliceRepository();
        lock = new InMemoryExclusivityLock();
        transitions = new MigrationTransitions(migrations, tx, clock);
        events = new CopyOnWriteArrayList<>();
        sleeps = new CopyOnWriteArrayList<>();
        sleeper = sleeps::add;

        items = new ArrayList<>();
        processed = new ArrayList<>();
        hooks = new ArrayList<>();
        failures = new AtomicInteger();
        ranges = new ArrayList<>();
        failOnce = new HashMap<>();

        registry = new WorkDescriptorRegistry()
                .register("List", (args, ctx) -> new ListWorkDescriptor(items, processed, hooks, failures))
                .register("Range", (args, ctx) -> new RecordingRangeDescriptor(
                        args.getLong(0), args.getLong(1), args.getLong(2), args.getLong(3), ranges, failOnce));
    }

    protected EngineConfig.Builder config() {
        return EngineConfig.builder();
    }

    protected MigrationEvents eventSink() {
        return new MigrationEvents(List.of(events::add), clock);
    }

    protected MigrationRunner runner(EngineConfig cfg) {
        return new MigrationRunner(migrations, slices, registry, eventSink(), tx, clock, sleeper, cfg);
    }

    protected MigrationService service(EngineConfig cfg) {
        return new MigrationService(migrations, registry, tx, clock, cfg);
    }

    protected MigrationScheduler scheduler(EngineConfig cfg, MigrationExecutor executor) {
        return new MigrationScheduler(migrations, lock, executor, eventSink(), tx, clock, cfg);
    }

    protected MigrationScheduler schedulerWithWorker(EngineConfig cfg) {
        return scheduler(cfg, new MigrationWorker(runner(cfg), sleeper, cfg));
    }

    protected Migration enqueue(EngineConfig cfg, String name, EnqueueOptions options, Object... args) throws Exception {
        return service(cfg).enqueue(name, MigrationArguments.of(args), options).get(0);
    }

    protected Migration enqueue(String name, Object... args) throws Exception {
        return enqueue(EngineConfig.defaults(), name, EnqueueOptions.defaults(), args);
    }

    protected Migration reload(long id) throws Exception {
        return migrations.findById(id).orElseThrow();
    }

    protected List<MigrationEvent.Type> eventTypes() {
        return events.stream().map(MigrationEvent::type).toList();
    }

    /** 실행기 대신 id 만 기록한다 */
    public static final class RecordingExecutor implements MigrationExecutor {
        public final List<Long> executed = new CopyOnWriteArrayList<>();

        public RecordingExecutor() { }

        @Override
        public void execute(ExecutionContext ctx, long migrationId) {
            executed.add(migrationId);
        }
    }
}
