package com.agilab.log_collecting.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one collection run. Filled in while the run progresses and handed to the caller once.
 */
@Data
@NoArgsConstructor
public class CollectionResult {
    private boolean success;
    private int totalFiles;
    private int collectedFiles;
    private int failedFiles;
    private long totalBytes;
    private String errorMessage;
    private List<String> producedPaths = new ArrayList<>();

    public void recordCollected(String producedPath) {
        collectedFiles++;
        producedPaths.add(producedPath);
    }

    public void recordFailed() {
        failedFiles++;
    }

    public double successRate() {
        if (totalFiles == 0) {
            return 0.0;
        }
        return (double) collectedFiles / totalFiles;
    }

    public String summary() {
        if (!success) {
            return "Failed: " + errorMessage;
        }
        return String.format("Collected %d/%d files", collectedFiles, totalFiles);
    }
}
