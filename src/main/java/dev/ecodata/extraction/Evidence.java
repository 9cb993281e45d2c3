package dev.ecodata.extraction;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * One candidate value for a category, with its grounding.
 *
 * <p>Invariants: confidence lies in {@code [0, 1]}; a non-inferred Evidence cites at least one
 * sentence. Range checks of {@code sentenceRefs} against the row happen in {@link EvidenceMapper},
 * which is the only producer of Evidence from model output.
 *
 * @param value the extracted value, or null
 * @param sentenceRefs ids of the sentences that support the value, ascending
 * @param rationale short explanation, possibly carrying parser caveats
 * @param inferred true when the value has no valid sentence citation
 * @param confidence confidence in {@code [0, 1]}
 */
public record Evidence(
    @Nullable String value,
    Set<Integer> sentenceRefs,
    String rationale,
    boolean inferred,
    double confidence) {

  public Evidence {
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
    }
    SortedSet<Integer> refs = new TreeSet<>(sentenceRefs == null ? Set.of() : sentenceRefs);
    if (refs.stream().anyMatch(id -> id < 1)) {
      throw new IllegalArgumentException("sentence ids must be positive: " + refs);
    }
    if (!inferred && refs.isEmpty()) {
      throw new IllegalArgumentException("grounded evidence must cite at least one sentence");
    }
    sentenceRefs = Collections.unmodifiableSortedSet(refs);
    rationale = rationale == null ? "" : rationale;
  }
}
