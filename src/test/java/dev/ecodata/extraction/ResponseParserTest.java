package dev.ecodata.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ecodata.text.Sentence;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ResponseParserTest {

  private static final List<Sentence> SENTENCES =
      List.of(
          new Sentence(1, "The company earned $5M in 2023."), new Sentence(2, "Growth was 25%."));

  private static final CategorySchema REVENUE = new CategorySchema("revenue", "Annual revenue");
  private static final CategorySchema FOUNDER = new CategorySchema("founder", "Founder name");

  private final ResponseParser parser =
      new ResponseParser(new EvidenceMapper(new ExtractionProperties()));

  @Test
  void parsesGroundedValueInRequestedFormat() {
    String raw =
        """
        {"revenue": {"values": [{"value": "$5M", "sentence_ids": [1],
          "rationale": "Sentence [1] states earnings.", "confidence": 0.95}],
          "candidates": []}}
        """;

    CategoryExtraction revenue = parser.parse(raw, SENTENCES, List.of(REVENUE)).get("revenue");

    assertThat(revenue.evidence())
        .containsExactly(
            new Evidence("$5M", Set.of(1), "Sentence [1] states earnings.", false, 0.95));
    assertThat(revenue.parseNote()).isNull();
  }

  @Test
  void parsesFlatShapeWithSupportingIdsAndJustification() {
    String raw =
        """
        {"revenue": {"value": "$5M", "confidence": 0.95,
          "supporting_sentence_ids": [1], "justification": "See [1]."}}
        """;

    Evidence evidence =
        parser.parse(raw, SENTENCES, List.of(REVENUE)).get("revenue").primary().orElseThrow();

    assertThat(evidence.value()).isEqualTo("$5M");
    assertThat(evidence.sentenceRefs()).containsExactly(1);
    assertThat(evidence.rationale()).isEqualTo("See [1].");
    assertThat(evidence.inferred()).isFalse();
  }

  @Test
  void parsesStructuredCandidatesWhenNoValue() {
    String raw =
        """
        {"revenue": {"values": [], "candidates": [
          {"sentence_id": 2, "relevance": 0.7, "reason": "mentions growth figures"}]}}
        """;

    CategoryExtraction revenue = parser.parse(raw, SENTENCES, List.of(REVENUE)).get("revenue");

    assertThat(revenue.evidence()).isEmpty();
    assertThat(revenue.candidates())
        .containsExactly(new CandidateSentence(2, 0.7, "mentions growth figures"));
  }

  @Test
  void parsesFlatCandidateFields() {
    String raw =
        """
        {"revenue": {"value": null, "candidate_sentence_ids": [2, 1],
          "candidate_relevance": {"2": 0.7, "1": "40%"},
          "candidate_justifications": "Both sentences discuss figures."}}
        """;

    CategoryExtraction revenue = parser.parse(raw, SENTENCES, List.of(REVENUE)).get("revenue");

    assertThat(revenue.candidates())
        .containsExactly(
            new CandidateSentence(2, 0.7, "Both sentences discuss figures."),
            new CandidateSentence(1, 0.4, "Both sentences discuss figures."));
  }

  @Test
  void outOfRangeCitationOnlyLeavesAnInferredValue() {
    String raw = "{\"founder\": {\"value\": \"Jane Doe\", \"sentence_ids\": [99]}}";

    Evidence evidence =
        parser.parse(raw, SENTENCES, List.of(FOUNDER)).get("founder").primary().orElseThrow();

    assertThat(evidence.sentenceRefs()).isEmpty();
    assertThat(evidence.inferred()).isTrue();
    assertThat(evidence.rationale()).contains("99");
  }

  @Test
  void idBeyondIntRangeIsNotNarrowedIntoACitation() {
    String raw = "{\"founder\": {\"value\": \"Jane\", \"sentence_ids\": [4294967297]}}";

    Evidence evidence =
        parser.parse(raw, SENTENCES, List.of(FOUNDER)).get("founder").primary().orElseThrow();

    assertThat(evidence.sentenceRefs()).isEmpty();
    assertThat(evidence.inferred()).isTrue();
  }

  @Test
  void negativeTextualIdKeepsItsSignAndIsDropped() {
    String raw = "{\"founder\": {\"value\": \"Jane\", \"sentence_ids\": \"-1\"}}";

    Evidence evidence =
        parser.parse(raw, SENTENCES, List.of(FOUNDER)).get("founder").primary().orElseThrow();

    assertThat(evidence.sentenceRefs()).isEmpty();
    assertThat(evidence.inferred()).isTrue();
    assertThat(evidence.rationale()).contains("dropped out-of-range sentence ids [-1]");
  }

  @Test
  void malformedCategoryDoesNotAffectSiblings() {
    String raw =
        """
        {"revenue": {"value": "$5M", "sentence_ids": [1], "confidence": 0.9},
         "founder": 42}
        """;

    Map<String, CategoryExtraction> parsed =
        parser.parse(raw, SENTENCES, List.of(REVENUE, FOUNDER));

    assertThat(parsed.get("revenue").primaryValue()).isEqualTo("$5M");
    assertThat(parsed.get("founder").evidence()).isEmpty();
    assertThat(parsed.get("founder").parseNote()).startsWith("malformed section");
  }

  @Test
  void toleratesFencesCommentaryAndLenientSyntax() {
    String raw =
        """
        Sure! Here is what I found:
        ```json
        {
          // model comment
          'revenue': {value: '$5M', 'sentence_ids': ['[1]'], confidence: '95%',},
        }
        ```
        Let me know if you need anything else.
        """;

    Evidence evidence =
        parser.parse(raw, SENTENCES, List.of(REVENUE)).get("revenue").primary().orElseThrow();

    assertThat(evidence.value()).isEqualTo("$5M");
    assertThat(evidence.sentenceRefs()).containsExactly(1);
    assertThat(evidence.confidence()).isEqualTo(0.95);
  }

  @Test
  void salvagesIntactCategoriesFromTruncatedResponse() {
    String raw =
        "{\"revenue\": {\"value\": \"$5M\", \"sentence_ids\": [1]}, "
            + "\"founder\": {\"value\": \"Jane\", \"sentence_ids\": [1";

    Map<String, CategoryExtraction> parsed =
        parser.parse(raw, SENTENCES, List.of(REVENUE, FOUNDER));

    assertThat(parsed.get("revenue").primaryValue()).isEqualTo("$5M");
    assertThat(parsed.get("founder").found()).isFalse();
    assertThat(parsed.get("founder").parseNote()).isNotNull();
  }

  @Test
  void salvageSkipsCategoryNameQuotedInsideAnotherSection() {
    String raw =
        "{\"founder\": {\"value\": \"Jane\", \"sentence_ids\": [2], "
            + "\"rationale\": \"revenue: 5 noted\"}, "
            + "\"revenue\": {\"value\": \"$5M\", \"sentence_ids\": [1]}, "
            + "\"growth\": {\"value\": \"25";

    Map<String, CategoryExtraction> parsed =
        parser.parse(raw, SENTENCES, List.of(REVENUE, FOUNDER));

    CategoryExtraction revenue = parsed.get("revenue");
    assertThat(revenue.parseNote()).isNull();
    assertThat(revenue.primaryValue()).isEqualTo("$5M");
    assertThat(revenue.primary().orElseThrow().sentenceRefs()).containsExactly(1);
    assertThat(parsed.get("founder").primaryValue()).isEqualTo("Jane");
  }

  @Test
  void salvageReportsMalformedSectionWhenNoLaterMatchFits() {
    String raw = "{\"revenue\": 5, \"founder\": {\"value\": \"Jane\"";

    CategoryExtraction revenue = parser.parse(raw, SENTENCES, List.of(REVENUE)).get("revenue");

    assertThat(revenue.found()).isFalse();
    assertThat(revenue.parseNote()).startsWith("malformed section");
  }

  @Test
  void responseWithoutJsonYieldsEmptyCategoriesWithNote() {
    Map<String, CategoryExtraction> parsed =
        parser.parse("I am unable to help with that.", SENTENCES, List.of(REVENUE, FOUNDER));

    assertThat(parsed).containsOnlyKeys("revenue", "founder");
    assertThat(parsed.values())
        .allSatisfy(
            extraction -> {
              assertThat(extraction.evidence()).isEmpty();
              assertThat(extraction.parseNote()).isEqualTo("response contained no JSON object");
            });
  }

  @Test
  void nullResponseIsTreatedAsGarbage() {
    assertThat(parser.parse(null, SENTENCES, List.of(REVENUE)).get("revenue").found()).isFalse();
  }

  @Test
  void missingCategoryIsReportedAsNotFound() {
    String raw = "{\"revenue\": \"$5M\"}";

    Map<String, CategoryExtraction> parsed =
        parser.parse(raw, SENTENCES, List.of(REVENUE, FOUNDER));

    assertThat(parsed.get("revenue").primary().orElseThrow().inferred()).isTrue();
    assertThat(parsed.get("founder").parseNote()).isEqualTo("category missing from response");
  }

  @Test
  void keysMatchIgnoringCaseAndSeparators() {
    CategorySchema growthDriver = new CategorySchema("growth_driver", "Main growth driver");
    String raw = "{\"Growth Driver\": {\"value\": \"exports\", \"sentence_ids\": [2]}}";

    CategoryExtraction extraction =
        parser.parse(raw, SENTENCES, List.of(growthDriver)).get("growth_driver");

    assertThat(extraction.primaryValue()).isEqualTo("exports");
  }

  @Test
  void unwrapsCategoryArrayWrapper() {
    String raw =
        """
        {"extractions": [
          {"category": "revenue", "value": "$5M", "sentence_ids": [1]},
          {"category": "founder", "value": "N/A"}]}
        """;

    Map<String, CategoryExtraction> parsed =
        parser.parse(raw, SENTENCES, List.of(REVENUE, FOUNDER));

    assertThat(parsed.get("revenue").primaryValue()).isEqualTo("$5M");
    assertThat(parsed.get("founder").found()).isFalse();
    assertThat(parsed.get("founder").parseNote()).isNull();
  }

  @Test
  void categoryNamedLikeAWrapperIsNotUnwrapped() {
    CategorySchema data = new CategorySchema("data", "Data source");
    String raw = "{\"data\": {\"value\": \"survey\", \"sentence_ids\": [1]}}";

    assertThat(parser.parse(raw, SENTENCES, List.of(data)).get("data").primaryValue())
        .isEqualTo("survey");
  }

  @Test
  void arrayOfValuesBecomesAlternatives() {
    String raw = "{\"founder\": [\"Jane Doe\", {\"value\": \"John Roe\", \"confidence\": 0.9}]}";

    CategoryExtraction founder = parser.parse(raw, SENTENCES, List.of(FOUNDER)).get("founder");

    assertThat(founder.evidence())
        .extracting(Evidence::value)
        .containsExactly("John Roe", "Jane Doe");
    assertThat(founder.evidence()).allMatch(Evidence::inferred);
  }

  @Test
  void emptySchemaYieldsEmptyResult() {
    assertThat(parser.parse("{\"revenue\": \"$5M\"}", SENTENCES, List.of())).isEmpty();
  }

  @Test
  void sentenceIdsAreReadFromMixedRepresentations() {
    assertThat(
            ResponseParser.ids(
                new ObjectMapper().valueToTree(List.of(1, "2", "[3]", 4.0, "sentences 5 and 6"))))
        .containsExactly(1, 2, 3, 4, 5, 6);
  }

  @Test
  void sentenceIdsKeepSignsAndSkipValuesBeyondIntRange() {
    assertThat(
            ResponseParser.ids(
                new ObjectMapper()
                    .valueToTree(List.of(4294967297L, "-2", "3-5", "99999999999", 1.0e12, 0))))
        .containsExactly(-2, 3, 5, 0);
  }
}
