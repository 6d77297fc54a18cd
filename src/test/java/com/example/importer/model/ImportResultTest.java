package com.example.importer.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImportResultTest {

    @Test
    void statusFollowsCounters() {
        ImportResult clean = new ImportResult("a.csv", "A");
        clean.recordAttempted(2);
        clean.recordBatchWritten(2);
        assertThat(clean.finish(false)).isEqualTo(ImportStatus.SUCCEEDED);

        ImportResult partial = new ImportResult("b.csv", "B");
        partial.recordBatchWritten(5);
        partial.recordRowFailure(new RowFailure(3, "bad number"));
        assertThat(partial.finish(false)).isEqualTo(ImportStatus.PARTIALLY_FAILED);

        ImportResult failed = new ImportResult("c.csv", "C");
        failed.recordBatchFailed(5, "ORA-00001");
        assertThat(failed.finish(false)).isEqualTo(ImportStatus.FAILED);
        assertThat(failed.getMessages()).containsExactly("ORA-00001");

        assertThat(partial.finish(true)).isEqualTo(ImportStatus.SKIPPED_DRY_RUN);
    }

    @Test
    void revokingCommittedRowsMovesThemToFailed() {
        ImportResult result = new ImportResult("a.csv", "A");
        result.recordBatchWritten(10);
        result.recordBatchWritten(10);

        result.revokeCommitted(20, "rolled back");

        assertThat(result.getRowsCommitted()).isZero();
        assertThat(result.getRowsFailed()).isEqualTo(20);
        assertThat(result.getBatchesFailed()).isEqualTo(2);
        assertThat(result.getBatchesSucceeded()).isZero();
        assertThat(result.finish(false)).isEqualTo(ImportStatus.FAILED);
    }

    @Test
    void retriesAreCountedPerBatch() {
        ImportResult result = new ImportResult("a.csv", "A");
        result.recordRetry(1);
        result.recordRetry(1);
        result.recordRetry(3);

        assertThat(result.getBatchRetries()).containsEntry(1, 2).containsEntry(3, 1);
        assertThat(result.getTotalRetries()).isEqualTo(3);
        assertThat(result.toString()).contains("retries=3");
    }

    @Test
    void summaryTotalsAndFailures() {
        ImportRunSummary summary = new ImportRunSummary();
        ImportResult ok = new ImportResult("a.csv", "A");
        ok.recordAttempted(4);
        ok.recordBatchWritten(4);
        ok.finish(false);
        summary.add(ok);
        summary.add(ImportResult.failed("b.csv", "B", "Table B does not exist"));

        assertThat(summary.totalRowsAttempted()).isEqualTo(4);
        assertThat(summary.totalRowsCommitted()).isEqualTo(4);
        assertThat(summary.count(ImportStatus.FAILED)).isEqualTo(1);
        assertThat(summary.hasFailures()).isTrue();
    }
}
