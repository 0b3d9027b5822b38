package net.stepwise.core.work;

/** produceItems 가 내놓는 (item, 처리 후 저장할 커서) 쌍 */
public record WorkItem<T>(T value, String cursor) {
}
