package dev.ecodata.job;

import dev.ecodata.extraction.CandidateSentence;
import dev.ecodata.extraction.CategoryExtraction;
import dev.ecodata.extraction.Evidence;
import dev.ecodata.text.Sentence;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one row. Written once per row id and never modified.
 *
 * <p>Categories fail independently: a category whose payload was unusable is present with no
 * evidence. A non-null {@code error} means the row as a whole could not be extracted; its
 * categories are then empty.
 *
 * @param rowId the row identifier
 * @param categories extraction per category name, in schema order
 * @param sentences the row's enumerated sentences, the address space of all sentence refs
 * @param error row-level failure, or null
 * @param processingTimeMs wall-clock time spent on the row
 */
public record RowResult(
    String rowId,
    Map<String, CategoryExtraction> categories,
    List<Sentence> sentences,
    @Nullable String error,
    long processingTimeMs) {

  public RowResult {
    categories = Collections.unmodifiableMap(new LinkedHashMap<>(categories));
    sentences = List.copyOf(sentences);
  }

  static RowResult failed(
      String rowId, List<Sentence> sentences, String error, long processingTimeMs) {
    return new RowResult(rowId, Map.of(), sentences, error, processingTimeMs);
  }

  public boolean hasError() {
    return error != null;
  }

  /** Evidence for a category, most confident first; empty when not found. */
  public List<Evidence> evidence(String category) {
    CategoryExtraction extraction = categories.get(category);
    return extraction == null ? List.of() : extraction.evidence();
  }

  /** Candidate sentences for a category without a value. */
  public List<CandidateSentence> candidates(String category) {
    CategoryExtraction extraction = categories.get(category);
    return extraction == null ? List.of() : extraction.candidates();
  }

  /** The primary value of a category, or null when not found. */
  public @Nullable String primaryValue(String category) {
    CategoryExtraction extraction = categories.get(category);
    return extraction == null ? null : extraction.primaryValue();
  }
}
