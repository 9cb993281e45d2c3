package dev.ecodata.feedback;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Derives {@link RefinementContext} from the feedback log.
 *
 * <p>For each (job, row, category) only the latest decision counts; an equal timestamp goes to the
 * record appended later. Of those, confirmed and override decisions with a usable value become
 * examples, most recent first, ties going to the example with more validated sentences. Rejected
 * decisions never contribute.
 */
@Service
public class FeedbackAggregator {

  private static final Logger log = LoggerFactory.getLogger(FeedbackAggregator.class);

  private static final Comparator<ValidationFeedback> PREFERRED_FIRST =
      Comparator.comparing(ValidationFeedback::timestamp)
          .thenComparingInt(f -> f.validatedSentenceIds().size())
          .reversed();

  private final FeedbackStore feedbackStore;

  public FeedbackAggregator(FeedbackStore feedbackStore) {
    this.feedbackStore = feedbackStore;
  }

  /**
   * Builds the refinement context for one category.
   *
   * @param category the category name
   * @param maxExamples upper bound on examples returned
   * @return the context, or empty when no usable feedback exists
   */
  public Optional<RefinementContext> buildContext(String category, int maxExamples) {
    if (maxExamples < 0) {
      throw new IllegalArgumentException("maxExamples must not be negative: " + maxExamples);
    }
    List<ValidationFeedback> contributing =
        latestPerRow(feedbackStore.findByCategory(category)).stream()
            .filter(f -> f.status().isPositive())
            .filter(f -> f.effectiveValue() != null && !f.effectiveValue().isBlank())
            .sorted(PREFERRED_FIRST)
            .limit(maxExamples)
            .toList();
    if (contributing.isEmpty()) {
      return Optional.empty();
    }

    List<ConfirmedExample> examples = new ArrayList<>();
    Set<String> notes = new LinkedHashSet<>();
    for (ValidationFeedback feedback : contributing) {
      examples.add(
          new ConfirmedExample(
              feedback.effectiveValue().strip(),
              feedback.validatedSentenceTexts(),
              feedback.rationale()));
      if (feedback.notes() != null && !feedback.notes().isBlank()) {
        notes.add(feedback.notes().strip());
      }
    }
    log.debug("Built refinement context for '{}' with {} example(s)", category, examples.size());
    return Optional.of(new RefinementContext(category, examples, new ArrayList<>(notes)));
  }

  /**
   * Builds contexts for several categories, omitting those without usable feedback.
   *
   * @return category name to context, in the given order
   */
  public Map<String, RefinementContext> buildContexts(List<String> categories, int maxExamples) {
    Map<String, RefinementContext> contexts = new LinkedHashMap<>();
    for (String category : categories) {
      buildContext(category, maxExamples).ifPresent(context -> contexts.put(category, context));
    }
    return contexts;
  }

  private static List<ValidationFeedback> latestPerRow(List<ValidationFeedback> oldestFirst) {
    Map<RowKey, ValidationFeedback> latest = new LinkedHashMap<>();
    for (ValidationFeedback feedback : oldestFirst) {
      latest.merge(
          new RowKey(feedback),
          feedback,
          (current, candidate) ->
              candidate.timestamp().isBefore(current.timestamp()) ? current : candidate);
    }
    return List.copyOf(latest.values());
  }

  private record RowKey(UUID jobId, String rowId, String category) {
    RowKey(ValidationFeedback feedback) {
      this(feedback.jobId(), feedback.rowId(), feedback.category());
    }
  }
}
