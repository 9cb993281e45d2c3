package dev.ecodata.feedback;

import java.util.List;

/**
 * A past reviewer-approved extraction, embedded verbatim into future prompts.
 *
 * @param value the approved value
 * @param sentences the validated supporting sentence texts
 * @param rationale why the value holds, may be empty
 */
public record ConfirmedExample(String value, List<String> sentences, String rationale) {

  public ConfirmedExample {
    sentences = sentences == null ? List.of() : List.copyOf(sentences);
    rationale = rationale == null ? "" : rationale;
  }
}
