package net.stepwise.core.event;

import net.stepwise.core.model.Migration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingMigrationEventListener implements MigrationEventListener {
    private static final Logger log = LoggerFactory.getLogger("net.stepwise.events");

    @Override
    public void onEvent(MigrationEvent event) {
        Migration m = event.migration();
        switch (event.type()) {
            case RAN_SLICE, THROTTLED ->
                    log.debug("[{}] {} cursor={} processed={}", event.type().code(), m.describe(), m.cursor(), m.processedCount());
            default ->
                    log.info("[{}] {} status={} processed={}", event.type().code(), m.describe(), m.status(), m.processedCount());
        }
    }
}
