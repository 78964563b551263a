package com.agilab.log_collecting.model;

import java.util.List;

/**
 * Outcome of a remote archive command. Exit codes 0 and 1 count as success; {@code failedFiles}
 * lists inputs the remote tool reported as unreadable.
 */
public record RemoteCompressionResult(boolean success,
                                      int exitCode,
                                      List<String> failedFiles,
                                      String stderr) {

    public boolean isPartial() {
        return success && !failedFiles.isEmpty();
    }
}
