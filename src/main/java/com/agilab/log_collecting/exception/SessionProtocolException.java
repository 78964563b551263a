package com.agilab.log_collecting.exception;

/**
 * Thrown when the handshake or transport fails after the socket was opened.
 */
public final class SessionProtocolException extends ConnectionException {

    public SessionProtocolException(String target, String message, Throwable cause) {
        super(target, message, cause);
    }

    public SessionProtocolException(String target, String message) {
        super(target, message);
    }
}
