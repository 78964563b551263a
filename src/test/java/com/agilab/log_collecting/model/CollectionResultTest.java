package com.agilab.log_collecting.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CollectionResultTest {

    @Test
    void summaryReportsCountsOnSuccess() {
        var result = new CollectionResult();
        result.setSuccess(true);
        result.setTotalFiles(5);
        result.recordCollected("/dst/a.log");
        result.recordCollected("/dst/b.log");
        result.recordFailed();

        assertThat(result.summary()).isEqualTo("Collected 2/5 files");
        assertThat(result.successRate()).isEqualTo(0.4);
        assertThat(result.getProducedPaths()).containsExactly("/dst/a.log", "/dst/b.log");
        assertThat(result.getFailedFiles()).isEqualTo(1);
    }

    @Test
    void summaryReportsErrorOnFailure() {
        var result = new CollectionResult();
        result.setErrorMessage("Path not found: /logs");

        assertThat(result.summary()).isEqualTo("Failed: Path not found: /logs");
        assertThat(result.successRate()).isZero();
    }
}
