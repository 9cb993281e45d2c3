package dev.ecodata.extraction;

import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Parsed result for one category of one row.
 *
 * <p>{@code evidence} is ordered by confidence descending; its first entry is the primary value.
 * {@code candidates} is only populated when {@code evidence} is empty. A non-null {@code
 * parseNote} means the category's payload was missing or malformed; such a category renders as
 * "not found".
 *
 * @param category the category name
 * @param evidence competing values, most confident first
 * @param candidates suggested sentences when no value was found
 * @param warnings non-fatal issues such as a value outside the expected-value set
 * @param parseNote why the payload could not be used, or null
 */
public record CategoryExtraction(
    String category,
    List<Evidence> evidence,
    List<CandidateSentence> candidates,
    List<String> warnings,
    @Nullable String parseNote) {

  public CategoryExtraction {
    evidence = List.copyOf(evidence);
    candidates = List.copyOf(candidates);
    warnings = List.copyOf(warnings);
  }

  /** An empty extraction for a category whose payload could not be used. */
  public static CategoryExtraction notFound(String category, String parseNote) {
    return new CategoryExtraction(category, List.of(), List.of(), List.of(), parseNote);
  }

  public Optional<Evidence> primary() {
    return evidence.isEmpty() ? Optional.empty() : Optional.of(evidence.get(0));
  }

  /** The primary value, or null when nothing was found. */
  public @Nullable String primaryValue() {
    return primary().map(Evidence::value).orElse(null);
  }

  public boolean found() {
    return primaryValue() != null;
  }
}
