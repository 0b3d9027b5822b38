package net.stepwise.integration.spring.sched;

import net.stepwise.core.service.MigrationScheduler;
import net.stepwise.core.service.SchedulerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 외부 타이머 역할. 주기는 stepwise.scheduler.tick-delay-ms, 나머지는 세터로 주입한다.
 */
public class StepwiseSchedulers {
    private static final Logger log = LoggerFactory.getLogger(StepwiseSchedulers.class);

    private final MigrationScheduler scheduler;

    private int maxConcurrency = 1;
    private String shard;
    private String lockName;

    public StepwiseSchedulers(MigrationScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Scheduled(fixedDelayString = "${stepwise.scheduler.tick-delay-ms:10000}")
    public void tick() throws Exception {
        var r = scheduler.tick(options());
        if (r.lockSkipped) return;
        if (!r.rejected.isEmpty()) {
            log.warn("Tick at {}: dispatch rejected for {}", r.timestamp, r.rejected);
        }
        if (!r.dispatched.isEmpty() || !r.stuck.isEmpty()) {
            log.info("Tick at {}: active={} dispatched={} stuck={} blocked={}",
                    r.timestamp, r.active, r.dispatched, r.stuck, r.blocked);
        } else {
            log.debug("Tick at {}: active={} blocked={}", r.timestamp, r.active, r.blocked);
        }
    }

    SchedulerOptions options() {
        return new SchedulerOptions(maxConcurrency, shard, lockName);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public void setShard(String shard) {
        this.shard = shard;
    }

    public void setLockName(String lockName) {
        this.lockName = lockName;
    }
}
