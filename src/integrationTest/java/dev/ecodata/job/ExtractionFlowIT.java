package dev.ecodata.job;

import dev.ecodata.BaseIntegrationTest;
import dev.ecodata.extraction.CategorySchema;
import dev.ecodata.feedback.ValidationFeedbackRepository;
import dev.ecodata.feedback.ValidationStatus;
import dev.ecodata.llm.ModelGateway;
import dev.ecodata.prompt.ExtractionPrompt;
import dev.ecodata.review.ReviewDecision;
import dev.ecodata.review.ReviewService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Runs a job through the wired pipeline with a stubbed model, reviews a row, and checks that the
 * next job's prompt carries the reviewer's correction.
 */
class ExtractionFlowIT extends BaseIntegrationTest {

    private static final List<CategorySchema> SCHEMA = List.of(
            new CategorySchema("revenue", "What was the annual revenue in {text}?"),
            new CategorySchema("founder", "Who founded the company?"));

    @MockitoBean
    private ModelGateway modelGateway;

    @Autowired
    private ExtractionOrchestrator orchestrator;

    @Autowired
    private JobTracker jobTracker;

    @Autowired
    private ReviewService reviewService;

    @Autowired
    private ValidationFeedbackRepository feedbackRepository;

    @BeforeEach
    void cleanLog() {
        feedbackRepository.deleteAllInBatch();
    }

    @Test
    void reviewedCorrectionRefinesTheNextJob() {
        given(modelGateway.complete(any(ExtractionPrompt.class))).willReturn("""
                ```json
                {"revenue": {"values": [{"value": "$5M", "sentence_ids": [1],
                   "rationale": "Sentence [1] states earnings.", "confidence": 0.95}]},
                 "founder": {"values": [], "candidates": [
                   {"sentence_id": 2, "relevance": 0.7, "reason": "mentions leadership"}]}}
                ```
                """);

        ExtractionJob first = orchestrator.execute(
                List.of(new RowInput("D5", "The company earned $5M in 2023. The CEO is Jane Doe.")),
                SCHEMA);

        assertThat(first.status()).isEqualTo(JobStatus.COMPLETED);
        RowResult row = jobTracker.result(first.jobId(), "D5").orElseThrow();
        assertThat(row.primaryValue("revenue")).isEqualTo("$5M");
        assertThat(row.evidence("revenue").get(0).sentenceRefs()).containsExactly(1);
        assertThat(row.primaryValue("founder")).isNull();
        assertThat(row.candidates("founder")).extracting(c -> c.sentenceId()).containsExactly(2);

        reviewService.record(first.jobId(), "D5", List.of(
                new ReviewDecision("revenue", ValidationStatus.OVERRIDE, List.of(1), "$5.2M",
                        "Use the audited figure.")));

        orchestrator.execute(List.of(new RowInput("E7", "Revenue reached $9M.")), SCHEMA);

        ArgumentCaptor<ExtractionPrompt> prompts = ArgumentCaptor.forClass(ExtractionPrompt.class);
        verify(modelGateway, times(2)).complete(prompts.capture());
        assertThat(prompts.getAllValues().get(0).userMessage()).doesNotContain("CONFIRMED EXAMPLES");
        assertThat(prompts.getAllValues().get(1).userMessage())
                .contains("- value: \"$5.2M\"; supported by: The company earned $5M in 2023.")
                .contains("- reviewer note: Use the audited figure.");
    }
}
