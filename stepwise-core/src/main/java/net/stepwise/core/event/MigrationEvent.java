package net.stepwise.core.event;

import net.stepwise.core.model.Migration;

import java.time.Instant;

/** fire-and-forget 알림. 수신 측은 중복/순서 뒤바뀜을 견뎌야 한다. */
public record MigrationEvent(Type type, Migration migration, Instant at) {

    public enum Type {
        STARTED("started"),
        RAN_SLICE("ran-slice"),
        COMPLETED("completed"),
        RETRIED("retried"),
        THROTTLED("throttled");

        private final String code;

        Type(String code) { this.code = code; }

        public String code() { return code; }
    }
}
