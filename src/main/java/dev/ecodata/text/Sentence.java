package dev.ecodata.text;

/**
 * One addressable sentence of a row's text.
 *
 * <p>Ids are 1-based, contiguous and in document order within a row. A model cites sentences by
 * this id, so the id is only meaningful alongside the row that produced it.
 *
 * @param id positive sentence id, unique within the row
 * @param text the stripped, non-blank sentence text
 */
public record Sentence(int id, String text) {

  public Sentence {
    if (id < 1) {
      throw new IllegalArgumentException("Sentence id must be positive, got: " + id);
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Sentence text must not be blank");
    }
  }
}
