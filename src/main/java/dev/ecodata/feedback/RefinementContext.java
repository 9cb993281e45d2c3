package dev.ecodata.feedback;

import java.util.List;

/**
 * Bounded guidance for one category, derived on demand from stored feedback.
 *
 * @param category the category name
 * @param examples confirmed examples, most recent first
 * @param notes reviewer notes attached to the contributing feedback
 */
public record RefinementContext(
    String category, List<ConfirmedExample> examples, List<String> notes) {

  public RefinementContext {
    examples = List.copyOf(examples);
    notes = List.copyOf(notes);
  }
}
