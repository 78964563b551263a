package com.agilab.log_collecting.event;

/**
 * Byte-level progress of a single transfer.
 */
@FunctionalInterface
public interface TransferProgressListener {

    TransferProgressListener NONE = (transferred, total) -> {
    };

    void onBytes(long bytesTransferred, long totalBytes);
}
