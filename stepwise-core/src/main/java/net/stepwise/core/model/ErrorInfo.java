package net.stepwise.core.model;

import java.util.Arrays;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * errored/failed 상태에서만 채워지는 실패 정보.
 */
public record ErrorInfo(String errorClass, String message, String backtrace) {

    /**
     * @param maxFrames 남길 최대 스택 프레임 수
     * @param keep      백트레이스 클리너. false 인 프레임은 버린다
     */
    public static ErrorInfo of(Throwable t, int maxFrames, Predicate<StackTraceElement> keep) {
        String trace = Arrays.stream(t.getStackTrace())
                .filter(keep)
                .limit(Math.max(0, maxFrames))
                .map(StackTraceElement::toString)
                .collect(Collectors.joining("\n"));
        return new ErrorInfo(t.getClass().getName(), t.getMessage(), trace);
    }
}
