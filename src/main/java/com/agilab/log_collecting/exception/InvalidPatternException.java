package com.agilab.log_collecting.exception;

/**
 * Thrown when a regular expression filter does not compile.
 */
public final class InvalidPatternException extends RuntimeException implements LogCollectionException {
    private final String target;

    public InvalidPatternException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public InvalidPatternException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
