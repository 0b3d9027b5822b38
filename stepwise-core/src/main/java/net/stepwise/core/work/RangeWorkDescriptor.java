package net.stepwise.core.work;

import net.stepwise.core.spi.Sleeper;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 정수 키 구간을 배치 폭으로 나눠 처리하는 WorkDescriptor.
 * 슬라이스 하나는 다시 서브배치로 나눠 {@link #processRange} 를 호출한다. 커서는 처리한 상한 값이다.
 */
public abstract class RangeWorkDescriptor implements WorkDescriptor<SliceBounds> {
    public static final long DEFAULT_BATCH_SIZE = 20_000;
    public static final long DEFAULT_SUB_BATCH_SIZE = 1_000;
    public static final Duration DEFAULT_SUB_BATCH_PAUSE = Duration.ofMillis(100);

    /** 빈 구간 */
    protected static final Domain EMPTY = new Domain(1, 0);

    private final long batchSize;
    private final long subBatchSize;
    private final Duration subBatchPause;
    private final Sleeper sleeper;
    private Domain domain;

    protected RangeWorkDescriptor(long batchSize, long subBatchSize, Duration subBatchPause, Sleeper sleeper) {
        if (batchSize <= 0 || subBatchSize <= 0) throw new IllegalArgumentException("batch sizes must be positive");
        this.batchSize = batchSize;
        this.subBatchSize = Math.min(subBatchSize, batchSize);
        this.subBatchPause = subBatchPause == null ? Duration.ZERO : subBatchPause;
        this.sleeper = sleeper;
    }

    protected RangeWorkDescriptor() {
        this(DEFAULT_BATCH_SIZE, DEFAULT_SUB_BATCH_SIZE, DEFAULT_SUB_BATCH_PAUSE, Sleeper.SYSTEM);
    }

    /** 작업 대상 구간. 인스턴스당 한 번만 계산된다. */
    protected abstract Domain resolveDomain() throws Exception;

    /** [low, high] 한 서브배치 처리. 재실행에 안전해야 한다. */
    protected abstract void processRange(long low, long high) throws Exception;

    public final Domain domain() throws Exception {
        if (domain == null) domain = resolveDomain();
        return domain;
    }

    public long batchSize() { return batchSize; }
    public long subBatchSize() { return subBatchSize; }

    @Override
    public Iterator<WorkItem<SliceBounds>> produceItems(String cursor) throws Exception {
        Domain d = domain();
        Long resume = cursor == null ? null : Long.valueOf(cursor);
        return new Iterator<>() {
            Long position = resume;
            Optional<SliceBounds> pending;

            @Override
            public boolean hasNext() {
                if (pending == null) pending = CursorIterator.next(d.start(), d.end(), batchSize, position);
                return pending.isPresent();
            }

            @Override
            public WorkItem<SliceBounds> next() {
                if (!hasNext()) throw new NoSuchElementException();
                SliceBounds s = pending.get();
                pending = null;
                position = s.high();
                return new WorkItem<>(s, Long.toString(s.high()));
            }
        };
    }

    @Override
    public void process(SliceBounds slice) throws Exception {
        Long sub = null;
        Optional<SliceBounds> next;
        boolean first = true;
        while ((next = CursorIterator.next(slice.low(), slice.high(), subBatchSize, sub)).isPresent()) {
            if (!first) sleeper.sleep(subBatchPause);
            first = false;
            SliceBounds b = next.get();
            processRange(b.low(), b.high());
            sub = b.high();
        }
    }

    /** 추정치는 슬라이스 개수. processedCount 가 슬라이스 단위로 올라가기 때문이다. */
    @Override
    public OptionalLong estimateCount() throws Exception {
        Domain d = domain();
        return OptionalLong.of(CursorIterator.sliceCount(d.start(), d.end(), batchSize));
    }

    @Override
    public int compareCursors(String a, String b) {
        return Long.compare(Long.parseLong(a), Long.parseLong(b));
    }

    public record Domain(long start, long end) {
        public boolean isEmpty() { return end < start; }
    }
}
