package dev.ecodata.review;

import dev.ecodata.feedback.ValidationStatus;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A reviewer's decision on one category of a row.
 *
 * @param category the category name
 * @param status the verdict
 * @param validatedSentenceIds sentence ids the reviewer marked as supporting
 * @param manualValue the reviewer's value, required for an override
 * @param notes free-form guidance for future extractions
 */
public record ReviewDecision(
    String category,
    ValidationStatus status,
    List<Integer> validatedSentenceIds,
    @Nullable String manualValue,
    @Nullable String notes) {

  public ReviewDecision {
    validatedSentenceIds =
        validatedSentenceIds == null ? List.of() : List.copyOf(validatedSentenceIds);
  }
}
