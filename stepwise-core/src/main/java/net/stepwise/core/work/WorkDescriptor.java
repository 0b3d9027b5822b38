package net.stepwise.core.work;

import java.util.Iterator;
import java.util.OptionalLong;

/**
 * "무엇을 할지"에 대한 사용자 정의.
 * <p>
 * 엔진은 at-least-once 로 item 을 전달한다. 처리 직후 커서가 저장되기 전에 프로세스가 죽으면
 * 같은 item 이 다시 오므로 {@link #process} 는 재실행해도 안전해야 한다.
 */
public interface WorkDescriptor<T> {

    /**
     * cursor 다음부터의 lazy 시퀀스. cursor 가 null 이면 처음부터.
     * 이전에 내보낸 어떤 커서에서도 다시 시작할 수 있어야 한다.
     */
    Iterator<WorkItem<T>> produceItems(String cursor) throws Exception;

    void process(T item) throws Exception;

    default OptionalLong estimateCount() throws Exception { return OptionalLong.empty(); }

    /** 커서 순서. 커서는 항상 증가해야 한다. */
    default int compareCursors(String a, String b) { return a.compareTo(b); }

    default void afterStart() { }
    default void afterResume() { }
    default void afterPause() { }
    default void afterCancel() { }
    default void afterStop() { }
    default void afterComplete() { }
}
