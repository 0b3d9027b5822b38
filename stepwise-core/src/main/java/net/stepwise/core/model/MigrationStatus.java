package net.stepwise.core.model;

import net.stepwise.core.exception.StateTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Migration 상태. 허용 전이는 {@link #allowedNext()} 테이블이 유일한 기준이다.
 */
public enum MigrationStatus {
    PENDING, ENQUEUED, RUNNING, PAUSING, PAUSED, ERRORED, FAILED, SUCCEEDED, CANCELLING, CANCELLED, DELAYED;

    private static final Map<MigrationStatus, Set<MigrationStatus>> TRANSITIONS = new EnumMap<>(MigrationStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(ENQUEUED, PAUSED, CANCELLED));
        TRANSITIONS.put(ENQUEUED, EnumSet.of(RUNNING, PAUSED, CANCELLED, FAILED));
        TRANSITIONS.put(RUNNING, EnumSet.of(ENQUEUED, SUCCEEDED, PAUSING, CANCELLING, ERRORED, FAILED));
        TRANSITIONS.put(PAUSING, EnumSet.of(PAUSED, CANCELLING, SUCCEEDED, ERRORED, FAILED));
        TRANSITIONS.put(PAUSED, EnumSet.of(PENDING, CANCELLED));
        TRANSITIONS.put(ERRORED, EnumSet.of(RUNNING, FAILED, CANCELLED, PAUSED));
        TRANSITIONS.put(FAILED, EnumSet.of(PENDING));
        TRANSITIONS.put(SUCCEEDED, EnumSet.noneOf(MigrationStatus.class));
        TRANSITIONS.put(CANCELLING, EnumSet.of(CANCELLED, SUCCEEDED, ERRORED, FAILED));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(MigrationStatus.class));
        TRANSITIONS.put(DELAYED, EnumSet.of(PENDING, CANCELLED));
    }

    public Set<MigrationStatus> allowedNext() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(MigrationStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    /** 전이 불가하면 {@link StateTransitionException}. */
    public void checkTransition(MigrationStatus next) {
        if (!canTransitionTo(next)) {
            throw new StateTransitionException(this, next);
        }
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /** pause/cancel 요청이 들어와 러너가 슬라이스 경계에서 마무리해야 하는 상태 */
    public boolean isStopping() {
        return this == PAUSING || this == CANCELLING;
    }

    /** 실행 주체가 붙어 있다고 간주되는 상태. heartbeat 가 끊기면 stuck 이다. */
    public boolean isInFlight() {
        return this == ENQUEUED || this == RUNNING || this == PAUSING || this == CANCELLING;
    }

    public static MigrationStatus from(String s) {
        if (s == null) throw new IllegalArgumentException("status is null");
        return MigrationStatus.valueOf(s.trim().toUpperCase());
    }

    public String code() { return name(); }
}
