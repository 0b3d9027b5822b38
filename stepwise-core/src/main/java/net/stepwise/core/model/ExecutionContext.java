package net.stepwise.core.model;

/**
 * 실행 위치(샤드/커넥션). Runner/Scheduler/WorkDescriptor 팩토리에 그대로 전달된다.
 */
public record ExecutionContext(String shard, String connectionName) {
    public static final ExecutionContext DEFAULT = new ExecutionContext(null, null);
}
