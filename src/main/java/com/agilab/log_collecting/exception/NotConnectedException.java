package com.agilab.log_collecting.exception;

/**
 * Thrown when a remote operation is attempted without a live session.
 */
public final class NotConnectedException extends RuntimeException implements LogCollectionException {
    private final String target;

    public NotConnectedException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public NotConnectedException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
