package net.stepwise.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. 구현체가 커넥션을 스레드에 바인딩하고 리포지토리가 이를 사용한다.
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션과 무관하게 새 트랜잭션 */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
