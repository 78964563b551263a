package com.agilab.log_collecting.exception;

/**
 * Generic I/O failure while listing, copying, downloading, deleting or running a remote command.
 */
public final class TransferException extends RuntimeException implements LogCollectionException {
    private final String target;

    public TransferException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public TransferException(String target, String message) {
        super(message);
        this.target = target;
    }

    @Override
    public String getTarget() {
        return target;
    }
}
