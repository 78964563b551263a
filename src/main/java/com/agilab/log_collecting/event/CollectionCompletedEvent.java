package com.agilab.log_collecting.event;

import java.time.Instant;
import java.util.List;

/**
 * Published once a collection run has finished, successfully or not.
 */
public record CollectionCompletedEvent(String source,
                                       String destinationDirectory,
                                       boolean success,
                                       int totalFiles,
                                       int collectedFiles,
                                       int failedFiles,
                                       long totalBytes,
                                       String errorMessage,
                                       List<String> producedPaths,
                                       Instant timestamp) {
}
