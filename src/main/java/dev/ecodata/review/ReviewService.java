package dev.ecodata.review;

import dev.ecodata.extraction.CategoryExtraction;
import dev.ecodata.extraction.CategorySchema;
import dev.ecodata.extraction.Evidence;
import dev.ecodata.feedback.FeedbackStore;
import dev.ecodata.feedback.ValidationFeedback;
import dev.ecodata.job.JobNotFoundException;
import dev.ecodata.job.JobTracker;
import dev.ecodata.job.RowResult;
import dev.ecodata.text.Sentence;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records a review event on a finished row as {@link ValidationFeedback}.
 *
 * <p>All decisions of one event share a timestamp and are appended as one atomic batch. Each
 * record captures what the reviewer saw: the primary extracted value with its rationale and the
 * texts of the sentences the reviewer validated.
 */
@Service
public class ReviewService {

  private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

  private final JobTracker jobTracker;
  private final FeedbackStore feedbackStore;
  private final Clock clock;

  public ReviewService(JobTracker jobTracker, FeedbackStore feedbackStore, Clock clock) {
    this.jobTracker = jobTracker;
    this.feedbackStore = feedbackStore;
    this.clock = clock;
  }

  /**
   * Records one review event.
   *
   * @param jobId the job the row belongs to
   * @param rowId the reviewed row
   * @param decisions one decision per reviewed category
   * @return the stored records
   * @throws JobNotFoundException if the job is unknown
   * @throws IllegalArgumentException if the row has no result, a category is not part of the
   *     job, a category is decided twice, or a sentence id does not exist in the row
   * @throws dev.ecodata.feedback.FeedbackWriteException if the batch could not be stored
   */
  public List<ValidationFeedback> record(UUID jobId, String rowId, List<ReviewDecision> decisions) {
    if (decisions.isEmpty()) {
      throw new IllegalArgumentException("A review needs at least one decision");
    }
    RowResult row =
        jobTracker
            .result(jobId, rowId)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Row '%s' of job %s has no result yet".formatted(rowId, jobId)));
    Set<String> knownCategories =
        jobTracker.definition(jobId).schema().stream()
            .map(CategorySchema::name)
            .collect(Collectors.toSet());
    Map<Integer, String> sentenceTexts =
        row.sentences().stream().collect(Collectors.toMap(Sentence::id, Sentence::text));

    Instant timestamp = clock.instant();
    Set<String> decided = new HashSet<>();
    List<ValidationFeedback> records = new ArrayList<>();
    for (ReviewDecision decision : decisions) {
      if (!knownCategories.contains(decision.category())) {
        throw new IllegalArgumentException(
            "Category '%s' is not part of job %s".formatted(decision.category(), jobId));
      }
      if (!decided.add(decision.category())) {
        throw new IllegalArgumentException(
            "Category '%s' is decided more than once".formatted(decision.category()));
      }
      List<String> texts = new ArrayList<>();
      for (Integer id : decision.validatedSentenceIds()) {
        String text = sentenceTexts.get(id);
        if (text == null) {
          throw new IllegalArgumentException(
              "Sentence %d does not exist in row '%s'".formatted(id, rowId));
        }
        texts.add(text);
      }
      Optional<Evidence> shown =
          Optional.ofNullable(row.categories().get(decision.category()))
              .flatMap(CategoryExtraction::primary);
      records.add(
          new ValidationFeedback(
              jobId,
              rowId,
              decision.category(),
              decision.status(),
              decision.validatedSentenceIds(),
              texts,
              shown.map(Evidence::value).orElse(null),
              decision.manualValue(),
              shown.map(Evidence::rationale).orElse(null),
              decision.notes(),
              timestamp));
    }

    feedbackStore.appendAll(records);
    log.info("Recorded {} review decision(s) for row {} of job {}", records.size(), rowId, jobId);
    return List.copyOf(records);
  }

  /** All feedback recorded for a job, oldest first. */
  public List<ValidationFeedback> feedbackFor(UUID jobId) {
    return feedbackStore.findByJob(jobId);
  }
}
