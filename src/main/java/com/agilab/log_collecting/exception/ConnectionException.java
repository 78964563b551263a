package com.agilab.log_collecting.exception;

/**
 * Thrown when a session cannot be established. The base type covers network failures and timeouts.
 */
public sealed class ConnectionException extends RuntimeException implements LogCollectionException
        permits AuthenticationException, SessionProtocolException {
    private final String target;

    public ConnectionException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public ConnectionException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
