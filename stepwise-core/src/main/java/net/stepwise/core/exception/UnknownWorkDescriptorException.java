package net.stepwise.core.exception;

public class UnknownWorkDescriptorException extends ValidationException {
    private final String name;

    public UnknownWorkDescriptorException(String name) {
        super("No work descriptor registered under '" + name + "'");
        this.name = name;
    }

    public String getName() { return name; }
}
