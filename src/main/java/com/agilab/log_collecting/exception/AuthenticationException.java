package com.agilab.log_collecting.exception;

/**
 * Thrown when the remote host rejects the credentials.
 */
public final class AuthenticationException extends ConnectionException {

    public AuthenticationException(String target, String message, Throwable cause) {
        super(target, message, cause);
    }

    public AuthenticationException(String target, String message) {
        super(target, message);
    }
}
