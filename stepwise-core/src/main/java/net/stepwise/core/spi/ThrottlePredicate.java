package net.stepwise.core.spi;

/** DB 부하 등 외부 상태를 보고 진행을 잠시 멈출지 판단한다. */
@FunctionalInterface
public interface ThrottlePredicate {
    boolean shouldThrottle();

    ThrottlePredicate NEVER = () -> false;
}
