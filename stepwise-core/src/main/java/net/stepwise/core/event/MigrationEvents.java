package net.stepwise.core.event;

import net.stepwise.core.model.Migration;
import net.stepwise.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 리스너 목록으로 이벤트를 흘려보낸다. 리스너 예외는 로그만 남긴다.
 */
public final class MigrationEvents {
    private static final Logger log = LoggerFactory.getLogger(MigrationEvents.class);

    private final List<MigrationEventListener> listeners;
    private final Clock clock;

    public MigrationEvents(List<MigrationEventListener> listeners, Clock clock) {
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public static MigrationEvents none(Clock clock) {
        return new MigrationEvents(List.of(), clock);
    }

    public void publish(MigrationEvent.Type type, Migration migration) {
        if (listeners.isEmpty()) return;
        MigrationEvent event = new MigrationEvent(type, migration, clock.now());
        for (MigrationEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Migration event listener {} failed on '{}' for {}",
                        l.getClass().getName(), type.code(), migration.describe(), e);
            }
        }
    }
}
