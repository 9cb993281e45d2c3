package dev.ecodata.api;

import dev.ecodata.extraction.CategorySchema;
import dev.ecodata.job.RowInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Body of {@code POST /api/jobs}.
 *
 * @param rows rows to extract from; may be empty, which completes immediately
 * @param categories at least one category definition
 */
public record SubmitJobRequest(
    @NotNull @Valid List<Row> rows, @NotEmpty @Valid List<Category> categories) {

  public record Row(@NotBlank String rowId, String text) {
    RowInput toInput() {
      return new RowInput(rowId, text);
    }
  }

  public record Category(@NotBlank String name, String prompt, List<String> expectedValues) {
    CategorySchema toSchema() {
      return new CategorySchema(name, prompt, expectedValues);
    }
  }

  List<RowInput> toInputs() {
    return rows.stream().map(Row::toInput).toList();
  }

  List<CategorySchema> toSchema() {
    return categories.stream().map(Category::toSchema).toList();
  }
}
