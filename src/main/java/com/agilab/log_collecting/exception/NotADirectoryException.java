package com.agilab.log_collecting.exception;

/**
 * Thrown when a directory was expected but the path is something else.
 */
public final class NotADirectoryException extends RuntimeException implements LogCollectionException {
    private final String target;

    public NotADirectoryException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public NotADirectoryException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
