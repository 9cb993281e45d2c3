package dev.ecodata.feedback;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * One reviewer decision on one category of one row. Immutable and append-only: a correction is a
 * new record, never an update.
 *
 * @param jobId the job the row was extracted in
 * @param rowId the caller's row identifier
 * @param category the category name
 * @param status the verdict
 * @param validatedSentenceIds sentence ids the reviewer marked as supporting
 * @param validatedSentenceTexts texts of those sentences, in the same order
 * @param extractedValue the value that was shown to the reviewer, if any
 * @param manualValue the reviewer's value, required for {@link ValidationStatus#OVERRIDE}
 * @param rationale the model's rationale for the shown value
 * @param notes free-form reviewer guidance
 * @param timestamp when the review event happened
 */
public record ValidationFeedback(
    UUID jobId,
    String rowId,
    String category,
    ValidationStatus status,
    List<Integer> validatedSentenceIds,
    List<String> validatedSentenceTexts,
    @Nullable String extractedValue,
    @Nullable String manualValue,
    @Nullable String rationale,
    @Nullable String notes,
    Instant timestamp) {

  public ValidationFeedback {
    if (jobId == null || rowId == null || category == null || status == null || timestamp == null) {
      throw new IllegalArgumentException(
          "jobId, rowId, category, status and timestamp are required");
    }
    if (category.isBlank()) {
      throw new IllegalArgumentException("Category must not be blank");
    }
    if (status == ValidationStatus.OVERRIDE && (manualValue == null || manualValue.isBlank())) {
      throw new IllegalArgumentException("An override requires a manual value");
    }
    validatedSentenceIds =
        validatedSentenceIds == null ? List.of() : List.copyOf(validatedSentenceIds);
    validatedSentenceTexts =
        validatedSentenceTexts == null ? List.of() : List.copyOf(validatedSentenceTexts);
  }

  /**
   * The value this decision vouches for: the manual value of an override, or for a confirmation
   * the manual value if given, otherwise the extracted value. Null for rejections.
   */
  public @Nullable String effectiveValue() {
    return switch (status) {
      case OVERRIDE -> manualValue;
      case CONFIRMED ->
          manualValue != null && !manualValue.isBlank() ? manualValue : extractedValue;
      case REJECTED -> null;
    };
  }
}
