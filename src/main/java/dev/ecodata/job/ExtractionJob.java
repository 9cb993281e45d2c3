package dev.ecodata.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of a job's progress.
 *
 * <p>Created and replaced by {@link JobTracker}; every change produces a new record.
 *
 * @param jobId the job identifier
 * @param status current lifecycle state
 * @param totalRows rows submitted
 * @param processedRows rows attempted so far, successful or errored; never decreases
 * @param erroredRows rows that finished with a row-level error
 * @param createdAt when the job was created
 * @param updatedAt when the snapshot last changed
 * @param startedAt when processing began, null while pending
 * @param completedAt when the job reached a terminal state, null before that
 * @param error job-level failure reason, null unless failed
 */
public record ExtractionJob(
    UUID jobId,
    JobStatus status,
    int totalRows,
    int processedRows,
    int erroredRows,
    Instant createdAt,
    Instant updatedAt,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt,
    @Nullable String error) {

  /** Share of rows processed, 0 to 100. A job without rows reports 0. */
  @JsonProperty("progressPercent")
  public int progressPercent() {
    return totalRows == 0 ? 0 : (int) (processedRows * 100L / totalRows);
  }

  ExtractionJob withStatus(JobStatus newStatus, Instant now) {
    return new ExtractionJob(
        jobId,
        newStatus,
        totalRows,
        processedRows,
        erroredRows,
        createdAt,
        now,
        newStatus == JobStatus.PROCESSING ? now : startedAt,
        newStatus.isTerminal() ? now : completedAt,
        error);
  }

  ExtractionJob withRowProcessed(boolean errored, Instant now) {
    return new ExtractionJob(
        jobId,
        status,
        totalRows,
        processedRows + 1,
        errored ? erroredRows + 1 : erroredRows,
        createdAt,
        now,
        startedAt,
        completedAt,
        error);
  }

  ExtractionJob failed(String reason, Instant now) {
    return new ExtractionJob(
        jobId,
        JobStatus.FAILED,
        totalRows,
        processedRows,
        erroredRows,
        createdAt,
        now,
        startedAt,
        now,
        reason);
  }
}
