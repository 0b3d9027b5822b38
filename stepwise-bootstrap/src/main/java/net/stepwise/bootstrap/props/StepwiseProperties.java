package net.stepwise.bootstrap.props;

import net.stepwise.core.service.EngineConfig;
import net.stepwise.core.service.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("stepwise")
public class StepwiseProperties {
    private Engine engine = new Engine();
    private Scheduler scheduler = new Scheduler();
    private Catalog catalog = new Catalog();

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Engine {
        private int defaultMaxAttempts = 5;
        private Duration defaultIterationPause = Duration.ZERO;
        private Duration maxSliceDuration = Duration.ofMinutes(5);
        private Duration stuckMargin = Duration.ofMinutes(5);
        private Duration throttleCheckInterval = Duration.ofSeconds(5);
        private Duration throttleBackoff = Duration.ofSeconds(5);
        private int backtraceDepth = 30;
        private Duration retryBackoff = Duration.ZERO;
        // 지정하면 retryBackoff 를 시작값으로 하는 지수 백오프
        private Duration retryMaxBackoff;
        private String schedulerLockName = "stepwise-scheduler";

        /** throttle predicate / error handler 는 빈으로 받으므로 여기서는 비워 둔다. */
        public EngineConfig.Builder toBuilder() {
            RetryPolicy retry = retryMaxBackoff == null
                    ? RetryPolicy.fixed(retryBackoff)
                    : RetryPolicy.exponential(retryBackoff, retryMaxBackoff);
            return EngineConfig.builder()
                    .defaultMaxAttempts(defaultMaxAttempts)
                    .defaultIterationPause(defaultIterationPause)
                    .maxSliceDuration(maxSliceDuration)
                    .stuckMargin(stuckMargin)
                    .throttleCheckInterval(throttleCheckInterval)
                    .throttleBackoff(throttleBackoff)
                    .backtraceDepth(backtraceDepth)
                    .retryPolicy(retry)
                    .schedulerLockName(schedulerLockName);
        }

        public int getDefaultMaxAttempts() {
            return defaultMaxAttempts;
        }

        public void setDefaultMaxAttempts(int defaultMaxAttempts) {
            this.defaultMaxAttempts = defaultMaxAttempts;
        }

        public Duration getDefaultIterationPause() {
            return defaultIterationPause;
        }

        public void setDefaultIterationPause(Duration defaultIterationPause) {
            this.defaultIterationPause = defaultIterationPause;
        }

        public Duration getMaxSliceDuration() {
            return maxSliceDuration;
        }

        public void setMaxSliceDuration(Duration maxSliceDuration) {
            this.maxSliceDuration = maxSliceDuration;
        }

        public Duration getStuckMargin() {
            return stuckMargin;
        }

        public void setStuckMargin(Duration stuckMargin) {
            this.stuckMargin = stuckMargin;
        }

        public Duration getThrottleCheckInterval() {
            return throttleCheckInterval;
        }

        public void setThrottleCheckInterval(Duration throttleCheckInterval) {
            this.throttleCheckInterval = throttleCheckInterval;
        }

        public Duration getThrottleBackoff() {
            return throttleBackoff;
        }

        public void setThrottleBackoff(Duration throttleBackoff) {
            this.throttleBackoff = throttleBackoff;
        }

        public int getBacktraceDepth() {
            return backtraceDepth;
        }

        public void setBacktraceDepth(int backtraceDepth) {
            this.backtraceDepth = backtraceDepth;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getRetryMaxBackoff() {
            return retryMaxBackoff;
        }

        public void setRetryMaxBackoff(Duration retryMaxBackoff) {
            this.retryMaxBackoff = retryMaxBackoff;
        }

        public String getSchedulerLockName() {
            return schedulerLockName;
        }

        public void setSchedulerLockName(String schedulerLockName) {
            this.schedulerLockName = schedulerLockName;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 10000;
        private int maxConcurrency = 1;
        private String shard;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public String getShard() {
            return shard;
        }

        public void setShard(String shard) {
            this.shard = shard;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<MigrationDef> migrations = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<MigrationDef> getMigrations() {
            return migrations;
        }

        public void setMigrations(List<MigrationDef> migrations) {
            this.migrations = migrations;
        }
    }

    /** 기동 시 enqueue 할 마이그레이션 하나. arguments 는 JSON 배열 문자열. */
    public static class MigrationDef {
        private String name;
        private String arguments = "[]";
        private List<String> shards = new ArrayList<>();
        private String connectionName;
        private String tableName;
        private Integer maxAttempts;
        private Duration iterationPause;
        private boolean delayed;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getArguments() {
            return arguments;
        }

        public void setArguments(String arguments) {
            this.arguments = arguments;
        }

        public List<String> getShards() {
            return shards;
        }

        public void setShards(List<String> shards) {
            this.shards = shards;
        }

        public String getConnectionName() {
            return connectionName;
        }

        public void setConnectionName(String connectionName) {
            this.connectionName = connectionName;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public Integer getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getIterationPause() {
            return iterationPause;
        }

        public void setIterationPause(Duration iterationPause) {
            this.iterationPause = iterationPause;
        }

        public boolean isDelayed() {
            return delayed;
        }

        public void setDelayed(boolean delayed) {
            this.delayed = delayed;
        }

        @Override
        public String toString() {
            return "MigrationDef{" +
                    "name='" + name + '\'' +
                    ", arguments=" + arguments +
                    ", shards=" + shards +
                    ", tableName='" + tableName + '\'' +
                    ", delayed=" + delayed +
                    '}';
        }
    }
}
