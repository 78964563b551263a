package com.agilab.log_collecting.exception;

/**
 * Thrown when a filter value cannot be parsed, such as a malformed date.
 */
public final class InvalidFilterValueException extends RuntimeException implements LogCollectionException {
    private final String target;

    public InvalidFilterValueException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public InvalidFilterValueException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
