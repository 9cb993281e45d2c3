package dev.ecodata.extraction;

/**
 * A sentence the model considers possibly relevant when it found no value for a category.
 *
 * @param sentenceId id of the suggested sentence within the row
 * @param relevanceScore relevance in {@code [0, 1]}
 * @param reason why the sentence may hold the value
 */
public record CandidateSentence(int sentenceId, double relevanceScore, String reason) {

  public CandidateSentence {
    if (sentenceId < 1) {
      throw new IllegalArgumentException("sentenceId must be positive, got: " + sentenceId);
    }
    if (Double.isNaN(relevanceScore) || relevanceScore < 0.0 || relevanceScore > 1.0) {
      throw new IllegalArgumentException(
          "relevanceScore must be in [0, 1], got: " + relevanceScore);
    }
    reason = reason == null ? "" : reason;
  }
}
