package dev.ecodata.job;

import org.jspecify.annotations.Nullable;

/**
 * One row handed in by the upload layer.
 *
 * @param rowId caller-chosen identifier, unique within a job
 * @param text the free text to extract from; null is treated as empty
 */
public record RowInput(String rowId, @Nullable String text) {

  public RowInput {
    if (rowId == null || rowId.isBlank()) {
      throw new IllegalArgumentException("Row id must not be blank");
    }
  }
}
