package net.stepwise.core.service;

import net.stepwise.core.event.MigrationEvent;
import net.stepwise.core.event.MigrationEvents;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.model.ResourceKey;
import net.stepwise.core.spi.Clock;
import net.stepwise.core.spi.ExclusivityLock;
import net.stepwise.core.spi.MigrationExecutor;
import net.stepwise.core.spi.MigrationRepository;
import net.stepwise.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class MigrationScheduler {
    private static final Logger log = LoggerFactory.getLogger(MigrationScheduler.class);

    private final MigrationRepository migrations;
    private final MigrationTransitions transitions;
    private final ExclusivityLock lock;
    private final MigrationExecutor executor;
    private final MigrationEvents events;
    private final TxRunner tx;
    private final Clock clock;
    private final EngineConfig config;

    public MigrationScheduler(MigrationRepository migrations,
                              ExclusivityLock lock,
                              MigrationExecutor executor,
                              MigrationEvents events,
                              TxRunner tx,
                              Clock clock,
                              EngineConfig config) {
        this.migrations = migrations;
        this.lock = lock;
        this.executor = executor;
        this.events = events;
        this.tx = tx;
        this.clock = clock;
        this.config = config;
        this.transitions = new MigrationTransitions(migrations, tx, clock);
    }

    /**
     * 한 번의 틱. 락 안에서 후보를 골라 클레임하고, 락을 푼 뒤 실행기에 넘긴다.
     */
    public TickReport tick(SchedulerOptions options) throws Exception {
        TickReport r = new TickReport();
        r.timestamp = clock.now();

        Optional<List<Migration>> claimed = lock.tryWithLock(options.resolveLockName(config),
                () -> tx.requiresNew(() -> claim(options, r)));
        if (claimed.isEmpty()) {
            r.lockSkipped = true;
            log.debug("Scheduler lock '{}' is held elsewhere, skipping tick", options.resolveLockName(config));
            return r;
        }

        for (Migration m : claimed.get()) {
            log.info("Dispatching migration {} ({})", m.describe(), m.status());
            try {
                executor.execute(m.executionContext(), m.id());
                r.dispatched.add(m.id());
            } catch (Exception e) {
                // 클레임은 남아 있으므로 stuck 타임아웃 뒤 다시 잡힌다
                log.error("Dispatch of migration {} failed", m.describe(), e);
                r.rejected.add(m.id());
            }
        }
        return r;
    }

    private List<Migration> claim(SchedulerOptions options, TickReport r) throws Exception {
        Instant now = clock.now();
        Duration stuckTimeout = config.stuckTimeout();

        List<Migration> active = new ArrayList<>();
        List<Migration> pool = new ArrayList<>();
        for (Migration m : migrations.findSchedulable(options.shard())) {   // 생성 순
            MigrationStatus s = m.status();
            if (s.isInFlight()) {
                if (m.isStuck(now, stuckTimeout)) {
                    pool.add(m);
                    r.stuck.add(m.id());
                } else {
                    active.add(m);
                }
            } else if (s == MigrationStatus.PENDING) {
                pool.add(m);
            } else if (s == MigrationStatus.ERRORED && !m.attemptsExhausted() && retryDue(m, now)) {
                pool.add(m);
            }
        }
        r.active = active.size();

        int remaining = options.maxConcurrency() - active.size();
        if (remaining <= 0) return List.of();

        Set<ResourceKey> busy = new HashSet<>();
        for (Migration m : active) {
            if (m.resourceKey() != null) busy.add(m.resourceKey());
        }

        List<Migration> picked = new ArrayList<>();
        for (Migration c : pool) {
            if (picked.size() >= remaining) break;
            ResourceKey key = c.resourceKey();
            if (key != null && busy.contains(key)) {
                r.blocked.add(c.id());
                continue;
            }
            Optional<Migration> claimed = claimOne(c, now);
            if (claimed.isEmpty()) continue;
            picked.add(claimed.get());
            if (key != null) busy.add(key);
        }
        return picked;
    }

    /** 후보를 in-flight 상태로 만들고 heartbeat 를 갱신한다. 경합에서 지면 empty. */
    private Optional<Migration> claimOne(Migration c, Instant now) throws Exception {
        long id = c.id();
        boolean ok;
        switch (c.status()) {
            case PENDING -> ok = transitions.transitionIf(id, MigrationStatus.PENDING, MigrationStatus.ENQUEUED);
            case RUNNING -> {
                log.warn("Migration {} is stuck (last heartbeat {}), re-dispatching", c.describe(), c.updatedAt());
                ok = transitions.transitionIf(id, MigrationStatus.RUNNING, MigrationStatus.ENQUEUED);
            }
            case ERRORED -> {
                ok = transitions.transitionIf(id, MigrationStatus.ERRORED, MigrationStatus.RUNNING);
                if (ok) events.publish(MigrationEvent.Type.RETRIED, transitions.load(id));
            }
            default -> {
                // stuck ENQUEUED/PAUSING/CANCELLING: 상태는 두고 러너가 이어받는다
                log.warn("Migration {} is stuck in {}, re-dispatching", c.describe(), c.status());
                ok = migrations.touch(id, c.status(), now);
            }
        }
        return ok ? Optional.of(transitions.load(id)) : Optional.empty();
    }

    private boolean retryDue(Migration m, Instant now) {
        Duration backoff = config.retryPolicy().nextBackoff(m.attempts());
        return !m.updatedAt().plus(backoff).isAfter(now);
    }

    /** 틱 결과 */
    public static final class TickReport {
        public Instant timestamp;
        public boolean lockSkipped;
        public int active;
        public final List<Long> stuck = new ArrayList<>();
        public final List<Long> blocked = new ArrayList<>();
        public final List<Long> dispatched = new ArrayList<>();
        public final List<Long> rejected = new ArrayList<>();
    }
}
