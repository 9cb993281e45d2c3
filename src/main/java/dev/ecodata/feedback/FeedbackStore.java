package dev.ecodata.feedback;

import java.util.List;
import java.util.UUID;

/**
 * Append-only log of reviewer decisions.
 *
 * <p>Implementations never deduplicate or update: "latest wins" is applied by readers such as
 * {@link FeedbackAggregator}. Concurrent appends must all be retained.
 */
public interface FeedbackStore {

  /**
   * Appends one record.
   *
   * @throws FeedbackWriteException if the record could not be stored
   */
  default void append(ValidationFeedback feedback) {
    appendAll(List.of(feedback));
  }

  /**
   * Appends a batch atomically: either every record is stored or none is.
   *
   * @throws FeedbackWriteException if the batch could not be stored
   */
  void appendAll(List<ValidationFeedback> feedback);

  /** All feedback recorded for a job, oldest to newest. */
  List<ValidationFeedback> findByJob(UUID jobId);

  /** All feedback recorded for a category across jobs, oldest to newest. */
  List<ValidationFeedback> findByCategory(String category);
}
