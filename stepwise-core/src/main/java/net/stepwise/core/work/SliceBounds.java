package net.stepwise.core.work;

/** 닫힌 구간 [low, high] */
public record SliceBounds(long low, long high) {
    public SliceBounds {
        if (high < low) throw new IllegalArgumentException("high < low: [" + low + ", " + high + "]");
    }

    public long width() { return high - low + 1; }
}
