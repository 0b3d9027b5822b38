package net.stepwise.core.exception;

/** enqueue 시점의 잘못된 인자/설정. 재시도하지 않는다. */
public class ValidationException extends StepwiseException {
    public ValidationException(String message) { super(message); }
    public ValidationException(String message, Throwable cause) { super(message, cause); }
}
