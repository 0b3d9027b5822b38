package net.stepwise.core.work;

import java.util.Optional;

/**
 * 닫힌 정수 구간 [start, end] 를 폭 width 로 자르는 순수 함수.
 * 같은 커서로 몇 번을 호출해도 같은 다음 슬라이스가 나온다.
 */
public final class CursorIterator {
    private CursorIterator() {}

    /**
     * @param cursor 마지막으로 처리 완료한 상한. 없으면 start 부터
     * @return 다음 슬라이스, 구간이 끝났으면 empty
     */
    public static Optional<SliceBounds> next(long start, long end, long width, Long cursor) {
        if (width <= 0) throw new IllegalArgumentException("width must be positive: " + width);
        long lower;
        if (cursor == null) {
            lower = start;
        } else {
            if (cursor == Long.MAX_VALUE) return Optional.empty();
            lower = Math.max(start, cursor + 1);
        }
        if (lower > end) return Optional.empty();

        long span = end - lower;                     // 음수면 overflow, 실제로는 매우 큼
        long upper = (span < 0 || span >= width - 1) ? lower + width - 1 : end;
        return Optional.of(new SliceBounds(lower, upper));
    }

    public static long sliceCount(long start, long end, long width) {
        if (width <= 0) throw new IllegalArgumentException("width must be positive: " + width);
        if (end < start) return 0;
        return (end - start) / width + 1;
    }
}
