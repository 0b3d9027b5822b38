package net.stepwise.core.work;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CursorIteratorTest {

    private static List<SliceBounds> drain(long start, long end, long width, Long cursor) {
        List<SliceBounds> out = new ArrayList<>();
        Optional<SliceBounds> next;
        while ((next = CursorIterator.next(start, end, width, cursor)).isPresent()) {
            out.add(next.get());
            cursor = next.get().high();
        }
        return out;
    }

    @Test
    void domain1to10_width3_producesFourSlicesThenNothing() {
        List<SliceBounds> slices = drain(1, 10, 3, null);

        assertEquals(List.of(
                new SliceBounds(1, 3),
                new SliceBounds(4, 6),
                new SliceBounds(7, 9),
                new SliceBounds(10, 10)), slices);
        assertTrue(CursorIterator.next(1, 10, 3, 10L).isEmpty());
    }

    @Test
    void resumeFromCursor_startsAtCursorPlusOne() {
        assertEquals(new SliceBounds(7, 9), CursorIterator.next(1, 10, 3, 6L).orElseThrow());
        assertEquals(List.of(new SliceBounds(7, 9), new SliceBounds(10, 10)), drain(1, 10, 3, 6L));
    }

    @Test
    void sameCursor_alwaysYieldsSameSlice() {
        var a = CursorIterator.next(100, 1_000, 50, 349L);
        var b = CursorIterator.next(100, 1_000, 50, 349L);
        assertEquals(a, b);
        assertEquals(new SliceBounds(350, 399), a.orElseThrow());
    }

    @Test
    void emptyDomain_producesNoSlices() {
        assertTrue(CursorIterator.next(5, 4, 3, null).isEmpty());
        assertEquals(0, CursorIterator.sliceCount(5, 4, 3));
    }

    @Test
    void cursorBeforeStart_isClampedToStart() {
        assertEquals(new SliceBounds(10, 12), CursorIterator.next(10, 20, 3, 2L).orElseThrow());
    }

    @Test
    void nearLongMax_doesNotOverflow() {
        long end = Long.MAX_VALUE;
        assertEquals(new SliceBounds(end - 1, end), CursorIterator.next(end - 1, end, 10, null).orElseThrow());
        assertTrue(CursorIterator.next(0, end, 10, end).isEmpty());
        assertEquals(new SliceBounds(Long.MIN_VALUE, Long.MIN_VALUE + 9),
                CursorIterator.next(Long.MIN_VALUE, end, 10, null).orElseThrow());
    }

    @Test
    void sliceCount_matchesDrainedSlices() {
        assertEquals(4, CursorIterator.sliceCount(1, 10, 3));
        assertEquals(drain(1, 1_000, 7, null).size(), CursorIterator.sliceCount(1, 1_000, 7));
    }

    @Test
    void nonPositiveWidth_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> CursorIterator.next(1, 10, 0, null));
    }
}
