package dev.ecodata.job;

import dev.ecodata.extraction.CandidateSentence;
import dev.ecodata.extraction.CategoryExtraction;
import dev.ecodata.extraction.CategorySchema;
import dev.ecodata.extraction.Evidence;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Flattens {@link RowResult}s into the shape consumed by rendering and export: the primary value
 * per category, optionally with every piece of evidence and candidate.
 */
@Component
public class ResultProjector {

  /**
   * A row as exported.
   *
   * @param rowId the row identifier
   * @param values primary value per category in schema order, null for "not found"
   * @param error the row-level error, or null
   * @param details full evidence per category, or null unless requested
   */
  public record RowProjection(
      String rowId,
      Map<String, @Nullable String> values,
      @Nullable String error,
      @Nullable Map<String, CategoryDetail> details) {}

  /**
   * All evidence of one category.
   *
   * @param evidence competing values, most confident first, each with its sentence ids
   * @param candidates suggested sentences when nothing was found
   * @param warnings non-fatal issues
   */
  public record CategoryDetail(
      List<Evidence> evidence, List<CandidateSentence> candidates, List<String> warnings) {}

  public RowProjection project(
      RowResult result, List<CategorySchema> schema, boolean includeAllEvidence) {
    Map<String, @Nullable String> values = new LinkedHashMap<>();
    Map<String, CategoryDetail> details = includeAllEvidence ? new LinkedHashMap<>() : null;
    for (CategorySchema category : schema) {
      values.put(category.name(), result.primaryValue(category.name()));
      if (details != null) {
        CategoryExtraction extraction = result.categories().get(category.name());
        details.put(
            category.name(),
            extraction == null
                ? new CategoryDetail(List.of(), List.of(), List.of())
                : new CategoryDetail(
                    extraction.evidence(), extraction.candidates(), extraction.warnings()));
      }
    }
    return new RowProjection(
        result.rowId(),
        Collections.unmodifiableMap(values),
        result.error(),
        details == null ? null : Collections.unmodifiableMap(details));
  }

  public List<RowProjection> projectAll(
      List<RowResult> results, List<CategorySchema> schema, boolean includeAllEvidence) {
    return results.stream().map(r -> project(r, schema, includeAllEvidence)).toList();
  }
}
