package net.stepwise.core.model;

import java.time.Instant;

/** 범위형 마이그레이션의 슬라이스 실행 기록. 크래시 후 감사용 흔적으로 남는다. */
public record SliceRun(
        Long id,
        Long migrationId,
        long minValue,
        long maxValue,
        Status status,
        int attempts,
        String errorClass,
        String errorMessage,
        Instant startedAt,
        Instant finishedAt,
        Instant createdAt,
        Instant updatedAt
) {
    public enum Status {
        RUNNING, SUCCEEDED, FAILED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }
}
