package com.agilab.log_collecting.exception;

/**
 * Thrown when access to a path is denied. Kept apart from generic I/O failures so callers can skip instead of abort.
 */
public final class PathPermissionException extends RuntimeException implements LogCollectionException {
    private final String target;

    public PathPermissionException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public PathPermissionException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
