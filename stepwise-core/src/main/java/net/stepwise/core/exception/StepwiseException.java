package net.stepwise.core.exception;

public class StepwiseException extends RuntimeException {
    public StepwiseException(String message) { super(message); }
    public StepwiseException(String message, Throwable cause) { super(message, cause); }
}
