package com.agilab.log_collecting.exception;

/**
 * Thrown when an archive kind cannot be applied to the given inputs.
 */
public final class UnsupportedArchiveKindException extends RuntimeException implements LogCollectionException {
    private final String target;

    public UnsupportedArchiveKindException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public UnsupportedArchiveKindException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
