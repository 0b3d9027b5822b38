package net.stepwise.core.service;

import net.stepwise.core.model.MigrationStatus;

import java.util.Collection;
import java.util.EnumSet;

/**
 * 샤드별 자식 상태로부터 논리 마이그레이션 전체 상태를 구한다. 집계 규칙은 여기 한 곳에만 둔다.
 * <ul>
 *   <li>전부 SUCCEEDED 면 SUCCEEDED</li>
 *   <li>하나라도 FAILED 면 FAILED</li>
 *   <li>전부 종료됐고 CANCELLED 가 있으면 CANCELLED</li>
 *   <li>in-flight 또는 ERRORED 가 있으면 RUNNING</li>
 *   <li>그 외에는 PAUSED, PENDING, DELAYED 순으로 먼저 있는 것</li>
 * </ul>
 */
public final class StatusAggregation {
    private StatusAggregation() {}

    public static MigrationStatus aggregate(Collection<MigrationStatus> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("no child statuses to aggregate");
        }
        EnumSet<MigrationStatus> seen = EnumSet.copyOf(children);

        if (seen.size() == 1 && seen.contains(MigrationStatus.SUCCEEDED)) return MigrationStatus.SUCCEEDED;
        if (seen.contains(MigrationStatus.FAILED)) return MigrationStatus.FAILED;
        if (seen.stream().allMatch(MigrationStatus::isTerminal)) return MigrationStatus.CANCELLED;
        if (seen.stream().anyMatch(s -> s.isInFlight() || s == MigrationStatus.ERRORED)) return MigrationStatus.RUNNING;
        if (seen.contains(MigrationStatus.PAUSED)) return MigrationStatus.PAUSED;
        if (seen.contains(MigrationStatus.PENDING)) return MigrationStatus.PENDING;
        return MigrationStatus.DELAYED;
    }
}
