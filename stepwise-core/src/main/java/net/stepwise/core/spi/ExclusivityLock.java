package net.stepwise.core.spi;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 비차단 advisory 락. 스케줄러 중복 디스패치 방지용이며 슬라이스 실행 동안에는 잡지 않는다.
 */
public interface ExclusivityLock {
    /**
     * 락을 얻으면 body 를 실행하고 결과를 돌려준다. 이미 다른 쪽이 잡고 있으면 즉시 empty.
     */
    <T> Optional<T> tryWithLock(String name, Callable<T> body) throws Exception;
}
