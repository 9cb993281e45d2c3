package dev.ecodata.api;

import dev.ecodata.feedback.ValidationStatus;
import dev.ecodata.review.ReviewDecision;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Body of {@code POST /api/jobs/{id}/rows/{rowId}/feedback}: one review event. */
public record ReviewRequest(@NotEmpty @Valid List<Decision> decisions) {

  public record Decision(
      @NotBlank String category,
      @NotNull ValidationStatus status,
      List<Integer> validatedSentenceIds,
      String manualValue,
      String notes) {

    ReviewDecision toDecision() {
      return new ReviewDecision(category, status, validatedSentenceIds, manualValue, notes);
    }
  }

  List<ReviewDecision> toDecisions() {
    return decisions.stream().map(Decision::toDecision).toList();
  }
}
