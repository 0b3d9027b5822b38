package net.stepwise.integration.spring.sched;

import net.stepwise.core.model.ExecutionContext;
import net.stepwise.core.spi.MigrationExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

/**
 * 디스패치된 마이그레이션을 스프링 {@link TaskExecutor} 스레드에서 돌린다.
 * 틱 스레드는 바로 돌아가고, 실패는 여기서 로그로 남긴다 (상태는 러너가 이미 기록).
 */
public final class TaskExecutorMigrationExecutor implements MigrationExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutorMigrationExecutor.class);

    private final MigrationExecutor delegate;
    private final TaskExecutor taskExecutor;

    public TaskExecutorMigrationExecutor(MigrationExecutor delegate, TaskExecutor taskExecutor) {
        this.delegate = delegate;
        this.taskExecutor = taskExecutor;
    }

    @Override
    public void execute(ExecutionContext ctx, long migrationId) {
        taskExecutor.execute(() -> {
            try {
                delegate.execute(ctx, migrationId);
            } catch (Exception e) {
                log.error("Dispatch of migration {} ended with an error", migrationId, e);
            }
        });
    }
}
