package dev.ecodata.extraction;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.ecodata.text.Sentence;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts a raw model response into one {@link CategoryExtraction} per requested category.
 *
 * <p>This is the only place that knows about the many shapes a model answer takes. The response
 * is located inside surrounding commentary or Markdown fences and read with a lenient JSON reader
 * (comments, single quotes, trailing commas, unquoted keys). Each category section is then
 * adapted into {@link CategoryOutcome}s and handed to {@link EvidenceMapper}.
 *
 * <p>Categories are isolated: when the response as a whole is not valid JSON, every section is
 * salvaged individually, and a missing or malformed section yields an empty extraction with a
 * parse note for that category only. Parsing never throws.
 */
@Component
public class ResponseParser {

  private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

  private static final List<String> VALUE_KEYS = List.of("value", "extracted_value", "answer");
  private static final List<String> REF_KEYS =
      List.of(
          "sentence_ids",
          "supporting_sentence_ids",
          "sentence_refs",
          "sentence_numbers",
          "sentences",
          "citations");
  private static final List<String> CONFIDENCE_KEYS = List.of("confidence", "score", "probability");
  private static final List<String> RATIONALE_KEYS =
      List.of("rationale", "justification", "reason", "explanation");
  private static final List<String> ALTERNATIVE_KEYS =
      List.of("values", "alternatives", "answers", "extractions");
  private static final List<String> CANDIDATE_KEYS =
      List.of("candidates", "candidate_sentences");
  private static final List<String> WRAPPER_KEYS =
      List.of("categories", "extractions", "results", "data");
  private static final Set<String> NULLISH =
      Set.of("", "null", "none", "n/a", "na", "not found", "not_found", "not available");

  private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?");
  // "-1" keeps its sign; "3-5" reads as 3 and 5
  private static final Pattern SIGNED_DIGITS = Pattern.compile("(?<!\\d)-?\\d+");

  private final EvidenceMapper evidenceMapper;
  private final JsonMapper lenientMapper;

  public ResponseParser(EvidenceMapper evidenceMapper) {
    this.evidenceMapper = evidenceMapper;
    this.lenientMapper =
        JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_YAML_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();
  }

  /**
   * Parses a raw response for the given categories.
   *
   * @param rawResponse the model's raw text, possibly null or garbage
   * @param sentences the row's sentences, used to validate cited ids
   * @param schema the requested categories
   * @return one extraction per schema category, in schema order
   */
  public Map<String, CategoryExtraction> parse(
      @Nullable String rawResponse, List<Sentence> sentences, List<CategorySchema> schema) {
    Map<String, CategoryExtraction> result = new LinkedHashMap<>();
    if (schema.isEmpty()) {
      return result;
    }

    String body = rawResponse == null ? "" : FENCE.matcher(rawResponse).replaceAll("");
    JsonNode root = readRoot(body, schema);

    for (CategorySchema category : schema) {
      String name = category.name();
      try {
        List<CategoryOutcome> outcomes =
            root != null ? sectionOutcomes(root, name) : salvageSection(body, name);
        if (outcomes == null) {
          String note =
              root == null && body.indexOf('{') < 0
                  ? "response contained no JSON object"
                  : "category missing from response";
          result.put(name, CategoryExtraction.notFound(name, note));
          continue;
        }
        result.put(name, evidenceMapper.map(name, outcomes, sentences, category));
      } catch (MalformedSectionException | RuntimeException e) {
        log.warn("Malformed section for category '{}': {}", name, e.getMessage());
        result.put(name, CategoryExtraction.notFound(name, "malformed section: " + e.getMessage()));
      }
    }
    return result;
  }

  private @Nullable JsonNode readRoot(String body, List<CategorySchema> schema) {
    int start = body.indexOf('{');
    int end = body.lastIndexOf('}');
    if (start < 0 || end <= start) {
      return null;
    }
    try {
      JsonNode root = lenientMapper.readTree(body.substring(start, end + 1));
      return root != null && root.isObject() ? unwrap(root, schema) : null;
    } catch (JsonProcessingException e) {
      log.debug("Response is not a single JSON object, salvaging per category: {}", e.getMessage());
      return null;
    }
  }

  /** Descends into a single wrapper object such as {@code {"categories": {...}}}. */
  private JsonNode unwrap(JsonNode root, List<CategorySchema> schema) {
    if (schema.stream().anyMatch(category -> field(root, category.name()) != null)) {
      return root;
    }
    for (String key : WRAPPER_KEYS) {
      JsonNode inner = field(root, key);
      if (inner != null && (inner.isObject() || inner.isArray()) && root.size() == 1) {
        return inner.isArray() ? indexByCategory(inner) : inner;
      }
    }
    return root;
  }

  /** Turns {@code [{"category": "x", ...}, ...]} into {@code {"x": {...}, ...}}. */
  private JsonNode indexByCategory(JsonNode array) {
    var indexed = lenientMapper.createObjectNode();
    for (JsonNode element : array) {
      JsonNode name = element.isObject() ? firstField(element, List.of("category", "name")) : null;
      if (name != null && name.isTextual()) {
        indexed.set(name.asText(), element);
      }
    }
    return indexed;
  }

  private @Nullable List<CategoryOutcome> sectionOutcomes(JsonNode root, String category)
      throws MalformedSectionException {
    JsonNode section = field(root, category);
    return section == null ? null : adapt(section);
  }

  /**
   * Reads a single category section straight from the raw text, for responses whose overall JSON
   * is broken. Every occurrence of the key is tried in order, since the name may also appear
   * inside another section's text; the first value that adapts cleanly wins.
   *
   * @return the outcomes, or null when no occurrence holds a complete value
   * @throws MalformedSectionException if complete values were found but none could be adapted
   */
  private @Nullable List<CategoryOutcome> salvageSection(String body, String category)
      throws MalformedSectionException {
    Pattern key =
        Pattern.compile(
            "(?<![\\p{L}\\p{N}_])[\"']?" + Pattern.quote(category) + "[\"']?\\s*:",
            Pattern.CASE_INSENSITIVE);
    Matcher matcher = key.matcher(body);
    MalformedSectionException malformed = null;
    while (matcher.find()) {
      JsonNode value;
      try (JsonParser parser = lenientMapper.createParser(body.substring(matcher.end()))) {
        value = lenientMapper.readTree(parser);
      } catch (IOException e) {
        log.debug("Could not salvage section '{}' at offset {}", category, matcher.start());
        continue;
      }
      if (value == null) {
        continue;
      }
      try {
        return adapt(value);
      } catch (MalformedSectionException e) {
        log.debug(
            "Skipping unusable value for '{}' at offset {}: {}",
            category,
            matcher.start(),
            e.getMessage());
        malformed = e;
      }
    }
    if (malformed != null) {
      throw malformed;
    }
    return null;
  }

  private List<CategoryOutcome> adapt(JsonNode section) throws MalformedSectionException {
    if (section.isNull()) {
      return List.of(new CategoryOutcome.NotFound(List.of(), ""));
    }
    if (section.isTextual()) {
      String value = nullableText(section);
      return value == null
          ? List.of(new CategoryOutcome.NotFound(List.of(), ""))
          : List.of(new CategoryOutcome.Inferred(value, null, ""));
    }
    if (section.isArray()) {
      List<CategoryOutcome> outcomes = new ArrayList<>();
      for (JsonNode element : section) {
        outcomes.addAll(adapt(element));
      }
      return outcomes;
    }
    if (!section.isObject()) {
      throw new MalformedSectionException("unexpected " + section.getNodeType() + " payload");
    }

    List<CategoryOutcome> outcomes = new ArrayList<>();
    alternative(section).ifPresent(outcomes::add);
    JsonNode alternatives = firstField(section, ALTERNATIVE_KEYS);
    if (alternatives != null && alternatives.isArray()) {
      for (JsonNode element : alternatives) {
        if (element.isObject()) {
          alternative(element).ifPresent(outcomes::add);
        } else if (nullableText(element) != null) {
          outcomes.add(new CategoryOutcome.Inferred(nullableText(element), null, ""));
        }
      }
    }
    if (outcomes.isEmpty()) {
      outcomes.add(new CategoryOutcome.NotFound(candidates(section), rationale(section)));
    }
    return outcomes;
  }

  private Optional<CategoryOutcome> alternative(JsonNode node) {
    String value = nullableText(firstField(node, VALUE_KEYS));
    if (value == null) {
      return Optional.empty();
    }
    Set<Integer> refs = ids(firstField(node, REF_KEYS));
    Double confidence = number(firstField(node, CONFIDENCE_KEYS));
    String rationale = rationale(node);
    if (refs.isEmpty()) {
      return Optional.of(new CategoryOutcome.Inferred(value, confidence, rationale));
    }
    return Optional.of(
        new CategoryOutcome.Grounded(value, refs, confidence, rationale));
  }

  private List<CategoryOutcome.RawCandidate> candidates(JsonNode section) {
    List<CategoryOutcome.RawCandidate> candidates = new ArrayList<>();
    JsonNode structured = firstField(section, CANDIDATE_KEYS);
    if (structured != null && structured.isArray()) {
      for (JsonNode element : structured) {
        if (element.isObject()) {
          Set<Integer> ids = ids(firstField(element, List.of("sentence_id", "id", "sentence")));
          Double relevance =
              number(firstField(element, List.of("relevance", "relevance_score", "score")));
          String reason = rationale(element);
          for (Integer id : ids) {
            candidates.add(new CategoryOutcome.RawCandidate(id, relevance, reason));
          }
        } else {
          for (Integer id : ids(element)) {
            candidates.add(new CategoryOutcome.RawCandidate(id, null, ""));
          }
        }
      }
    }

    JsonNode flatIds = field(section, "candidate_sentence_ids");
    if (flatIds != null) {
      JsonNode relevance = field(section, "candidate_relevance");
      String reason = textOrEmpty(field(section, "candidate_justifications"));
      for (Integer id : ids(flatIds)) {
        Double score = relevance != null && relevance.isObject()
            ? number(relevance.get(String.valueOf(id)))
            : null;
        candidates.add(new CategoryOutcome.RawCandidate(id, score, reason));
      }
    }
    return candidates;
  }

  private String rationale(JsonNode node) {
    return textOrEmpty(firstField(node, RATIONALE_KEYS));
  }

  /**
   * Accepts {@code [1, "3", "[4]", 5.0]}, a bare number, or a string such as {@code "1, 2"}. Signs
   * are kept so that {@link EvidenceMapper} drops negative ids; ids beyond int range are skipped.
   */
  static Set<Integer> ids(@Nullable JsonNode node) {
    Set<Integer> ids = new LinkedHashSet<>();
    if (node == null || node.isNull()) {
      return ids;
    }
    if (node.isArray()) {
      for (JsonNode element : node) {
        ids.addAll(ids(element));
      }
    } else if (node.isIntegralNumber() || isWholeNumber(node)) {
      if (node.canConvertToInt()) {
        ids.add(node.intValue());
      } else {
        log.debug("Ignoring sentence id out of int range: {}", node.asText());
      }
    } else if (node.isTextual()) {
      Matcher digits = SIGNED_DIGITS.matcher(node.asText());
      while (digits.find()) {
        try {
          ids.add(Integer.parseInt(digits.group()));
        } catch (NumberFormatException e) {
          log.debug("Ignoring sentence id out of int range: {}", digits.group());
        }
      }
    }
    return ids;
  }

  private static boolean isWholeNumber(JsonNode node) {
    return node.isNumber() && node.doubleValue() == Math.rint(node.doubleValue());
  }

  /** Reads a score from a number, a numeric string, or a percentage string. */
  static @Nullable Double number(@Nullable JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (!node.isTextual()) {
      return null;
    }
    String text = node.asText().strip();
    boolean percent = text.endsWith("%");
    if (percent) {
      text = text.substring(0, text.length() - 1).strip();
    }
    try {
      double value = Double.parseDouble(text);
      return percent ? value / 100.0 : value;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static @Nullable String nullableText(@Nullable JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    String text = node.asText().strip();
    return NULLISH.contains(text.toLowerCase(Locale.ROOT)) ? null : text;
  }

  private static String textOrEmpty(@Nullable JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return "";
    }
    return node.asText().strip();
  }

  private static @Nullable JsonNode firstField(JsonNode node, List<String> keys) {
    for (String key : keys) {
      JsonNode value = field(node, key);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** Field lookup ignoring case, spaces, dashes and underscores in the key. */
  private static @Nullable JsonNode field(JsonNode node, String key) {
    JsonNode exact = node.get(key);
    if (exact != null) {
      return exact;
    }
    String wanted = normalizeKey(key);
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      if (normalizeKey(entry.getKey()).equals(wanted)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static String normalizeKey(String key) {
    return key.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
  }

  /** A category section whose shape cannot be interpreted. */
  static class MalformedSectionException extends Exception {
    MalformedSectionException(String message) {
      super(message);
    }
  }
}
