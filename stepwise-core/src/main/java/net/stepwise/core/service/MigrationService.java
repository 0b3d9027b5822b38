package net.stepwise.core.service;

import net.stepwise.core.exception.UnknownWorkDescriptorException;
import net.stepwise.core.exception.ValidationException;
import net.stepwise.core.model.ExecutionContext;
import net.stepwise.core.model.GroupProgress;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationProgress;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.spi.Clock;
import net.stepwise.core.spi.MigrationRepository;
import net.stepwise.core.spi.TxRunner;
import net.stepwise.core.work.MigrationArguments;
import net.stepwise.core.work.WorkDescriptor;
import net.stepwise.core.work.WorkDescriptorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * 운영자 조작: enqueue / pause / cancel / resume / retry / approve / inspect.
 */
public final class MigrationService {
    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    private final MigrationRepository migrations;
    private final WorkDescriptorRegistry registry;
    private final MigrationTransitions transitions;
    private final TxRunner tx;
    private final Clock clock;
    private final EngineConfig config;

    public MigrationService(MigrationRepository migrations,
                            WorkDescriptorRegistry registry,
                            TxRunner tx,
                            Clock clock,
                            EngineConfig config) {
        this.migrations = migrations;
        this.registry = registry;
        this.tx = tx;
        this.clock = clock;
        this.config = config;
        this.transitions = new MigrationTransitions(migrations, tx, clock);
    }

    /**
     * 샤드마다 하나씩 만든다. 같은 (name, arguments, shard) 가 이미 있으면 그 행을 그대로 돌려준다.
     */
    public List<Migration> enqueue(String name, MigrationArguments arguments, EnqueueOptions options) throws Exception {
        if (!registry.contains(name)) throw new UnknownWorkDescriptorException(name);

        int maxAttempts = options.maxAttempts() != null ? options.maxAttempts() : config.defaultMaxAttempts();
        if (maxAttempts < 1) throw new ValidationException("maxAttempts must be >= 1, was " + maxAttempts);
        Duration pause = options.iterationPause() != null ? options.iterationPause() : config.defaultIterationPause();
        if (pause.isNegative()) throw new ValidationException("iterationPause must not be negative");

        String json = arguments.toJson();
        List<String> shards = options.shards().isEmpty() ? Collections.singletonList(null) : options.shards();
        MigrationStatus initial = options.delayed() ? MigrationStatus.DELAYED : MigrationStatus.PENDING;

        List<Migration> result = new ArrayList<>();
        for (String shard : shards) {
            Optional<Migration> existing = tx.required(() -> migrations.findByConfiguration(name, json, shard));
            if (existing.isPresent()) {
                log.debug("Migration {} already enqueued", existing.get().describe());
                result.add(existing.get());
                continue;
            }
            ExecutionContext ctx = new ExecutionContext(shard, options.connectionName());
            Long estimate = estimate(name, arguments, ctx);
            Migration draft = Migration.ofNew(name, json, shard, options.connectionName(), options.tableName(),
                    initial, estimate, maxAttempts, pause, clock.now());
            Migration saved = tx.required(() -> migrations.insertIfAbsent(draft));
            log.info("Enqueued migration {} args={} status={} estimated={}", saved.describe(), json, saved.status(), estimate);
            result.add(saved);
        }
        return result;
    }

    public List<Migration> enqueue(String name, MigrationArguments arguments) throws Exception {
        return enqueue(name, arguments, EnqueueOptions.defaults());
    }

    /** DELAYED -> PENDING */
    public boolean approve(long id) throws Exception {
        return transitions.apply(id, m -> m.status() == MigrationStatus.DELAYED ? MigrationStatus.PENDING : null).isPresent();
    }

    /**
     * 실행 중이면 PAUSING 을 걸고 러너가 슬라이스 경계에서 PAUSED 로 마무리한다.
     * @return 이미 멈췄거나 끝난 경우 false
     */
    public boolean pause(long id) throws Exception {
        return transitions.apply(id, m -> switch (m.status()) {
            case RUNNING -> MigrationStatus.PAUSING;
            case PAUSING, PAUSED, CANCELLING, SUCCEEDED, FAILED, CANCELLED -> null;
            default -> MigrationStatus.PAUSED;
        }).isPresent();
    }

    public boolean cancel(long id) throws Exception {
        return transitions.apply(id, m -> switch (m.status()) {
            case RUNNING, PAUSING -> MigrationStatus.CANCELLING;
            case CANCELLING, SUCCEEDED, FAILED, CANCELLED -> null;
            default -> MigrationStatus.CANCELLED;
        }).isPresent();
    }

    /** PAUSED -> PENDING. 다음 틱부터 저장된 커서 다음에서 이어간다. */
    public boolean resume(long id) throws Exception {
        return transitions.apply(id, m -> m.status() == MigrationStatus.PAUSED ? MigrationStatus.PENDING : null).isPresent();
    }

    public Migration retry(long id) throws Exception {
        Migration m = transitions.retry(id);
        log.info("Migration {} reset for retry from cursor {}", m.describe(), m.cursor());
        return m;
    }

    public MigrationProgress inspect(long id) throws Exception {
        return MigrationProgress.of(transitions.load(id));
    }

    public GroupProgress inspectGroup(String name, MigrationArguments arguments) throws Exception {
        String json = arguments.toJson();
        List<Migration> children = tx.required(() -> migrations.findByNameAndArguments(name, json));
        if (children.isEmpty()) throw new ValidationException("No migration " + name + " " + json);

        List<MigrationProgress> progress = new ArrayList<>();
        List<MigrationStatus> statuses = new ArrayList<>();
        double sum = 0;
        boolean known = true;
        for (Migration c : children) {
            MigrationProgress p = MigrationProgress.of(c);
            progress.add(p);
            statuses.add(c.status());
            if (p.percent().isPresent()) sum += p.percent().getAsDouble(); else known = false;
        }
        OptionalDouble percent = known ? OptionalDouble.of(sum / children.size()) : OptionalDouble.empty();
        return new GroupProgress(name, json, StatusAggregation.aggregate(statuses), percent, progress);
    }

    private Long estimate(String name, MigrationArguments arguments, ExecutionContext ctx) {
        try {
            WorkDescriptor<?> d = registry.create(name, arguments, ctx);
            OptionalLong count = d.estimateCount();
            return count.isPresent() ? count.getAsLong() : null;
        } catch (ValidationException e) {
            throw e;
        } catch (Exception e) {
            throw new ValidationException("Invalid arguments for migration '" + name + "': " + e.getMessage(), e);
        }
    }
}
