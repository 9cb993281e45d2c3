package dev.ecodata.extraction;

import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * A user-defined extraction category.
 *
 * <p>The prompt template may contain the {@value #TEXT_PLACEHOLDER} insertion point. Because the
 * row text is embedded once per request as an enumerated block, {@link #instruction()} replaces
 * the placeholder with a reference to that block.
 *
 * @param name unique category name, used as the response key
 * @param promptTemplate extraction instruction for this category
 * @param expectedValues optional closed set of acceptable values, empty when unconstrained
 */
public record CategorySchema(String name, String promptTemplate, List<String> expectedValues) {

  public static final String TEXT_PLACEHOLDER = "{text}";

  static final String TEXT_REFERENCE = "the enumerated text";

  public CategorySchema {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Category name must not be blank");
    }
    name = name.strip();
    promptTemplate = promptTemplate == null ? "" : promptTemplate;
    expectedValues = expectedValues == null ? List.of() : List.copyOf(expectedValues);
  }

  public CategorySchema(String name, String promptTemplate) {
    this(name, promptTemplate, List.of());
  }

  /** Returns the instruction text with the insertion point pointing at the enumerated text. */
  public String instruction() {
    String instruction = promptTemplate.replace(TEXT_PLACEHOLDER, TEXT_REFERENCE).strip();
    return instruction.isEmpty()
        ? "Extract the " + name + " from " + TEXT_REFERENCE + "."
        : instruction;
  }

  /**
   * Checks a value against the expected-value set, case-insensitively.
   *
   * @return true when no set is configured, the value is null, or the value is a member
   */
  public boolean accepts(@Nullable String value) {
    if (expectedValues.isEmpty() || value == null) {
      return true;
    }
    String normalized = value.strip().toLowerCase(Locale.ROOT);
    return expectedValues.stream()
        .anyMatch(expected -> expected.strip().toLowerCase(Locale.ROOT).equals(normalized));
  }
}
