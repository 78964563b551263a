package com.agilab.log_collecting.model;

public record DeletionSummary(int successCount, int failureCount) {
}
