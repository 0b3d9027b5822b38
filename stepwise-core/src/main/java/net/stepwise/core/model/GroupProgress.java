package net.stepwise.core.model;

import java.util.List;
import java.util.OptionalDouble;

/** 한 논리 마이그레이션의 샤드별 자식들을 묶은 진행 상황. */
public record GroupProgress(
        String name,
        String arguments,
        MigrationStatus status,
        OptionalDouble percent,
        List<MigrationProgress> children
) {
}
