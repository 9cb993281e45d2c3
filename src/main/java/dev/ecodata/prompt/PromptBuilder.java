package dev.ecodata.prompt;

import dev.ecodata.extraction.CategorySchema;
import dev.ecodata.extraction.ExtractionProperties;
import dev.ecodata.feedback.ConfirmedExample;
import dev.ecodata.feedback.RefinementContext;
import dev.ecodata.text.Sentence;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the extraction request for one row.
 *
 * <p>The row text is embedded once as numbered sentences ({@code [1] ...}) so the model can cite
 * supporting sentences by id. Every category asks for a value, cited ids, a short rationale and a
 * confidence, or, when nothing is found, ranked candidate sentences with relevance and reason.
 * Up to {@code ecodata.extraction.max-examples} confirmed examples per category are appended
 * verbatim when refinement context exists; the requested response format never changes.
 *
 * <p>Building is pure and never fails, including for an empty schema or an empty sentence list.
 */
@Component
public class PromptBuilder {

  static final String SYSTEM_MESSAGE =
      "You are a research assistant specialised in data extraction. You read the provided text "
          + "carefully, extract the requested information and respond ONLY with valid JSON in the "
          + "requested format. You never invent data that is not supported by the text. Every "
          + "value must cite the ids of the sentences that support it. If a value is not present, "
          + "use null and suggest the sentences most likely to be relevant instead.";

  private final ExtractionProperties properties;

  public PromptBuilder(ExtractionProperties properties) {
    this.properties = properties;
  }

  /**
   * Builds the prompt.
   *
   * @param schema the categories to extract, possibly empty
   * @param sentences the row's enumerated sentences, possibly empty
   * @param contexts refinement context keyed by category name; categories without one are
   *     simply prompted without examples
   * @return the prompt, never null
   */
  public ExtractionPrompt build(
      List<CategorySchema> schema,
      List<Sentence> sentences,
      Map<String, RefinementContext> contexts) {
    StringBuilder user = new StringBuilder();

    user.append("ENUMERATED TEXT:\n");
    if (sentences.isEmpty()) {
      user.append("(no text)\n");
    }
    for (Sentence sentence : sentences) {
      user.append('[').append(sentence.id()).append("] ").append(sentence.text()).append('\n');
    }

    user.append("\nCATEGORIES TO EXTRACT:\n");
    if (schema.isEmpty()) {
      user.append("(none)\n");
    }
    for (CategorySchema category : schema) {
      user.append("- ").append(category.name()).append(": ").append(category.instruction());
      if (!category.expectedValues().isEmpty()) {
        user.append(" Expected values: ")
            .append(String.join(", ", category.expectedValues()))
            .append('.');
      }
      user.append('\n');
    }

    appendInstructions(user, schema);
    appendExamples(user, schema, contexts);

    user.append("\nReturn only valid JSON.");
    return new ExtractionPrompt(SYSTEM_MESSAGE, user.toString());
  }

  private static void appendInstructions(StringBuilder user, List<CategorySchema> schema) {
    user.append(
        """

        INSTRUCTIONS:
        1. For each category give one or more values, most likely first. For each value give:
           - "value": the extracted value
           - "sentence_ids": ids of the sentences that support it, e.g. [1, 3]
           - "rationale": a short explanation citing those sentences
           - "confidence": a number between 0.0 and 1.0
        2. If a category is not present in the text, return an empty "values" list and give
           "candidates": up to 5 sentences where the information might be found, each with
           "sentence_id", "relevance" (0.0 to 1.0) and "reason".
        3. Only cite ids that appear in the enumerated text.

        RESPONSE FORMAT:
        {
        """);
    String key = schema.isEmpty() ? "category_name" : schema.get(0).name();
    user.append("  \"")
        .append(escape(key))
        .append(
            """
            ": {
                "values": [
                  {"value": "...", "sentence_ids": [1], "rationale": "...", "confidence": 0.9}
                ],
                "candidates": [
                  {"sentence_id": 2, "relevance": 0.6, "reason": "..."}
                ]
              }
            }
            """);
    user.append("Use exactly one key per category name listed above.\n");
  }

  private void appendExamples(
      StringBuilder user, List<CategorySchema> schema, Map<String, RefinementContext> contexts) {
    boolean headerWritten = false;
    for (CategorySchema category : schema) {
      RefinementContext context = contexts.get(category.name());
      if (context == null || context.examples().isEmpty() && context.notes().isEmpty()) {
        continue;
      }
      if (!headerWritten) {
        user.append("\nCONFIRMED EXAMPLES FROM PREVIOUS REVIEWS:\n");
        headerWritten = true;
      }
      user.append("Category \"").append(category.name()).append("\":\n");
      List<ConfirmedExample> examples =
          context.examples().stream().limit(properties.getMaxExamples()).toList();
      for (ConfirmedExample example : examples) {
        user.append("- value: \"").append(example.value()).append('"');
        if (!example.sentences().isEmpty()) {
          user.append("; supported by: ");
          user.append(String.join(" | ", example.sentences()));
        }
        if (!example.rationale().isBlank()) {
          user.append("; rationale: ").append(example.rationale());
        }
        user.append('\n');
      }
      for (String note : context.notes()) {
        user.append("- reviewer note: ").append(note).append('\n');
      }
    }
  }

  private static String escape(String key) {
    return key.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
