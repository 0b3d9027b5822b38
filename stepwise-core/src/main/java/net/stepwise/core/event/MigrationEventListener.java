package net.stepwise.core.event;

@FunctionalInterface
public interface MigrationEventListener {
    void onEvent(MigrationEvent event);
}
