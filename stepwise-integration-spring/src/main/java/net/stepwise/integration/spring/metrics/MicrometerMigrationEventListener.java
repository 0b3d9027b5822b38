package net.stepwise.integration.spring.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import net.stepwise.core.event.MigrationEvent;
import net.stepwise.core.event.MigrationEventListener;

/**
 * 이벤트마다 stepwise.migration.events 카운터를 올린다. 태그: event, migration, status.
 */
public final class MicrometerMigrationEventListener implements MigrationEventListener {
    public static final String METER_NAME = "stepwise.migration.events";

    private final MeterRegistry registry;

    public MicrometerMigrationEventListener(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onEvent(MigrationEvent event) {
        var m = event.migration();
        Counter.builder(METER_NAME)
                .description("Migration lifecycle notifications")
                .tag("event", event.type().code())
                .tag("migration", m.name())
                .tag("status", m.status().code())
                .register(registry)
                .increment();
    }
}
