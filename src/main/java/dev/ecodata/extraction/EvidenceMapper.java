package dev.ecodata.extraction;

import dev.ecodata.text.Sentence;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns normalized {@link CategoryOutcome}s into typed {@link Evidence} and {@link
 * CandidateSentence}s for one category of one row.
 *
 * <p>Enforces the row-level invariants: cited ids outside the row's sentence range are dropped
 * and noted in the rationale, {@code inferred} is recomputed from the surviving ids, scores are
 * clamped to {@code [0, 1]} and missing scores get the configured defaults. Values differing only
 * in case or spacing are merged with their citations combined. Evidence is ordered by confidence
 * descending. Candidates are kept only when no value was found.
 */
@Component
public class EvidenceMapper {

  private static final Logger log = LoggerFactory.getLogger(EvidenceMapper.class);

  private final ExtractionProperties properties;

  public EvidenceMapper(ExtractionProperties properties) {
    this.properties = properties;
  }

  /**
   * Maps the outcomes of one category.
   *
   * @param category the category name
   * @param outcomes normalized model answers, in response order
   * @param sentences the row's sentences, defining the valid id range
   * @param schema the category definition, or null when unknown
   * @return the category extraction, never null
   */
  public CategoryExtraction map(
      String category,
      List<CategoryOutcome> outcomes,
      List<Sentence> sentences,
      @Nullable CategorySchema schema) {
    Set<Integer> validIds = sentences.stream().map(Sentence::id).collect(Collectors.toSet());
    List<String> warnings = new ArrayList<>();

    Map<String, Evidence> byValue = new LinkedHashMap<>();
    for (CategoryOutcome outcome : outcomes) {
      Evidence evidence = null;
      if (outcome instanceof CategoryOutcome.Grounded grounded) {
        evidence = toEvidence(category, grounded, validIds);
      } else if (outcome instanceof CategoryOutcome.Inferred inferred) {
        evidence =
            new Evidence(
                inferred.value(),
                Set.of(),
                inferred.rationale(),
                true,
                score(inferred.confidence(), properties.getInferredDefaultConfidence()));
      }
      if (evidence != null) {
        byValue.merge(valueKey(evidence.value()), evidence, EvidenceMapper::mergeDuplicates);
      }
    }

    List<Evidence> evidence = new ArrayList<>(byValue.values());
    evidence.sort(Comparator.comparingDouble(Evidence::confidence).reversed());

    List<CandidateSentence> candidates = List.of();
    if (evidence.isEmpty()) {
      candidates = toCandidates(category, outcomes, validIds, warnings);
    } else if (schema != null && !schema.accepts(evidence.get(0).value())) {
      warnings.add(
          "value '%s' is not one of the expected values %s"
              .formatted(evidence.get(0).value(), schema.expectedValues()));
    }

    return new CategoryExtraction(category, evidence, candidates, warnings, null);
  }

  private Evidence toEvidence(
      String category, CategoryOutcome.Grounded grounded, Set<Integer> validIds) {
    SortedSet<Integer> kept = new TreeSet<>();
    SortedSet<Integer> dropped = new TreeSet<>();
    for (Integer id : grounded.sentenceRefs()) {
      (validIds.contains(id) ? kept : dropped).add(id);
    }

    String rationale = grounded.rationale();
    if (!dropped.isEmpty()) {
      log.warn("Dropped out-of-range sentence ids {} cited for '{}'", dropped, category);
      rationale = appendCaveat(rationale, "dropped out-of-range sentence ids " + dropped);
    }

    boolean inferred = kept.isEmpty();
    double fallback =
        inferred
            ? properties.getInferredDefaultConfidence()
            : properties.getGroundedDefaultConfidence();
    return new Evidence(
        grounded.value(), kept, rationale, inferred, score(grounded.confidence(), fallback));
  }

  private List<CandidateSentence> toCandidates(
      String category,
      List<CategoryOutcome> outcomes,
      Set<Integer> validIds,
      List<String> warnings) {
    Map<Integer, CandidateSentence> byId = new LinkedHashMap<>();
    SortedSet<Integer> dropped = new TreeSet<>();
    for (CategoryOutcome outcome : outcomes) {
      if (!(outcome instanceof CategoryOutcome.NotFound notFound)) {
        continue;
      }
      for (CategoryOutcome.RawCandidate raw : notFound.candidates()) {
        if (!validIds.contains(raw.sentenceId())) {
          dropped.add(raw.sentenceId());
          continue;
        }
        String reason = raw.reason().isBlank() ? notFound.rationale() : raw.reason();
        CandidateSentence candidate =
            new CandidateSentence(
                raw.sentenceId(),
                score(raw.relevance(), properties.getDefaultCandidateRelevance()),
                reason);
        byId.merge(
            raw.sentenceId(),
            candidate,
            (a, b) -> a.relevanceScore() >= b.relevanceScore() ? a : b);
      }
    }
    if (!dropped.isEmpty()) {
      log.warn("Dropped out-of-range candidate sentence ids {} for '{}'", dropped, category);
      warnings.add("dropped out-of-range candidate sentence ids " + dropped);
    }
    return byId.values().stream()
        .sorted(
            Comparator.comparingDouble(CandidateSentence::relevanceScore)
                .reversed()
                .thenComparingInt(CandidateSentence::sentenceId))
        .limit(properties.getMaxCandidates())
        .toList();
  }

  static double score(@Nullable Double explicit, double fallback) {
    if (explicit == null || explicit.isNaN()) {
      return fallback;
    }
    return Math.max(0.0, Math.min(1.0, explicit));
  }

  private static String appendCaveat(String rationale, String caveat) {
    return rationale.isBlank() ? "(" + caveat + ")" : rationale + " (" + caveat + ")";
  }

  private static String valueKey(@Nullable String value) {
    return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
  }

  /**
   * Folds two answers that differ only in case or spacing. The more confident one (grounded on a
   * tie) supplies value, score and rationale; the sentence refs of both are kept, so a grounded
   * duplicate is never erased by an inferred one.
   */
  private static Evidence mergeDuplicates(Evidence a, Evidence b) {
    Evidence primary;
    if (a.confidence() != b.confidence()) {
      primary = a.confidence() > b.confidence() ? a : b;
    } else {
      primary = a.inferred() && !b.inferred() ? b : a;
    }
    Evidence other = primary == a ? b : a;
    SortedSet<Integer> refs = new TreeSet<>(a.sentenceRefs());
    refs.addAll(b.sentenceRefs());
    String rationale = primary.rationale().isBlank() ? other.rationale() : primary.rationale();
    return new Evidence(primary.value(), refs, rationale, refs.isEmpty(), primary.confidence());
  }
}
