package net.stepwise.core.exception;

import net.stepwise.core.model.MigrationStatus;

/**
 * 전이 테이블에 없는 상태 쓰기. 경합이나 로직 버그를 뜻하며 호출자에게 그대로 전파된다.
 */
public class StateTransitionException extends StepwiseException {
    private final MigrationStatus from;
    private final MigrationStatus to;

    public StateTransitionException(MigrationStatus from, MigrationStatus to) {
        super("Illegal migration status transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public StateTransitionException(MigrationStatus from, MigrationStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public MigrationStatus getFrom() { return from; }
    public MigrationStatus getTo() { return to; }
}
