package com.agilab.log_collecting.exception;

/**
 * Thrown when a local or remote path does not exist.
 */
public final class PathNotFoundException extends RuntimeException implements LogCollectionException {
    private final String target;

    public PathNotFoundException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public PathNotFoundException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
