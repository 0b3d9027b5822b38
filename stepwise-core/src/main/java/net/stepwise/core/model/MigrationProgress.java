package net.stepwise.core.model;

import java.util.OptionalDouble;

/** inspect 결과. percent 는 0..100, 추정치가 없으면 비어 있다. */
public record MigrationProgress(
        Migration migration,
        OptionalDouble percent
) {
    public static MigrationProgress of(Migration m) {
        return new MigrationProgress(m, percentOf(m));
    }

    static OptionalDouble percentOf(Migration m) {
        if (m.status() == MigrationStatus.SUCCEEDED) return OptionalDouble.of(100.0);
        Long total = m.estimatedTotal();
        if (total == null) return OptionalDouble.empty();
        if (total <= 0) return OptionalDouble.of(0.0);
        double pct = m.processedCount() * 100.0 / total;
        return OptionalDouble.of(Math.min(100.0, pct));
    }
}
