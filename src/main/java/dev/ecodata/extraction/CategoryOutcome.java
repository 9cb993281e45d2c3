package dev.ecodata.extraction;

import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Closed set of shapes a single model answer for a category can take once the tolerant adapter
 * in {@link ResponseParser} has normalized it.
 *
 * <p>Sentence ids and scores here are still raw model output: ids may be out of range and
 * scores may lie outside {@code [0, 1]} or be absent. {@link EvidenceMapper} enforces the row's
 * invariants when turning outcomes into {@link Evidence} and {@link CandidateSentence}s.
 */
public sealed interface CategoryOutcome {

  /** A value citing one or more sentences. */
  record Grounded(
      String value, Set<Integer> sentenceRefs, @Nullable Double confidence, String rationale)
      implements CategoryOutcome {
    public Grounded {
      sentenceRefs = Set.copyOf(sentenceRefs);
    }
  }

  /** A value without any sentence citation. */
  record Inferred(String value, @Nullable Double confidence, String rationale)
      implements CategoryOutcome {}

  /** No value found; possibly some sentences worth a human look. */
  record NotFound(List<RawCandidate> candidates, String rationale) implements CategoryOutcome {
    public NotFound {
      candidates = List.copyOf(candidates);
    }
  }

  /**
   * Unvalidated candidate suggestion.
   *
   * @param sentenceId the cited id, not yet range-checked
   * @param relevance the model's relevance score, or null when absent
   * @param reason the model's reason
   */
  record RawCandidate(int sentenceId, @Nullable Double relevance, String reason) {}
}
