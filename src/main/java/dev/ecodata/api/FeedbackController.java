package dev.ecodata.api;

import dev.ecodata.extraction.ExtractionProperties;
import dev.ecodata.feedback.FeedbackAggregator;
import dev.ecodata.feedback.RefinementContext;
import dev.ecodata.feedback.ValidationFeedback;
import dev.ecodata.review.ReviewService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Review capture and the refinement context derived from it. */
@RestController
public class FeedbackController {

  private final ReviewService reviewService;
  private final FeedbackAggregator feedbackAggregator;
  private final ExtractionProperties properties;

  public FeedbackController(
      ReviewService reviewService,
      FeedbackAggregator feedbackAggregator,
      ExtractionProperties properties) {
    this.reviewService = reviewService;
    this.feedbackAggregator = feedbackAggregator;
    this.properties = properties;
  }

  @PostMapping("/api/jobs/{jobId}/rows/{rowId}/feedback")
  @ResponseStatus(HttpStatus.CREATED)
  public List<ValidationFeedback> review(
      @PathVariable UUID jobId,
      @PathVariable String rowId,
      @Valid @RequestBody ReviewRequest request) {
    return reviewService.record(jobId, rowId, request.toDecisions());
  }

  @GetMapping("/api/jobs/{jobId}/feedback")
  public List<ValidationFeedback> feedback(@PathVariable UUID jobId) {
    return reviewService.feedbackFor(jobId);
  }

  /** Returns 204 when the category has no usable feedback yet. */
  @GetMapping("/api/refinement/{category}")
  public ResponseEntity<RefinementContext> refinement(
      @PathVariable String category, @RequestParam(required = false) Integer maxExamples) {
    int max = maxExamples != null ? maxExamples : properties.getMaxExamples();
    return feedbackAggregator
        .buildContext(category, max)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
