package dev.ecodata.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.ecodata.extraction.ExtractionProperties;
import dev.ecodata.feedback.ConfirmedExample;
import dev.ecodata.feedback.FeedbackAggregator;
import dev.ecodata.feedback.RefinementContext;
import dev.ecodata.job.ExtractionJob;
import dev.ecodata.job.ExtractionOrchestrator;
import dev.ecodata.job.JobNotFoundException;
import dev.ecodata.job.JobStatus;
import dev.ecodata.job.JobTracker;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    private static final UUID JOB_ID = UUID.fromString("6f1c2a4e-8d9b-4c3a-9e7f-1a2b3c4d5e6f");
    private static final Instant CREATED = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    JobTracker jobTracker;

    @Mock
    ExtractionOrchestrator orchestrator;

    @Mock
    FeedbackAggregator feedbackAggregator;

    McpToolService mcpToolService;

    @BeforeEach
    void setUp() {
        mcpToolService = new McpToolService(
                jobTracker, orchestrator, feedbackAggregator, new ExtractionProperties());
    }

    @Test
    void jobStatusFormatsProgress() {
        given(jobTracker.get(JOB_ID)).willReturn(Optional.of(job(JobStatus.PROCESSING, 40, 3, null)));

        String result = mcpToolService.jobStatus(JOB_ID.toString());

        assertThat(result).contains("processing").contains("40/100 rows (40%)").contains("3 with errors");
        assertThat(result).doesNotContain("Error");
    }

    @Test
    void jobStatusIncludesFailureReason() {
        given(jobTracker.get(JOB_ID))
                .willReturn(Optional.of(job(JobStatus.FAILED, 3, 3, "Model provider failed")));

        assertThat(mcpToolService.jobStatus(JOB_ID.toString()))
                .contains("failed")
                .contains("Error: Model provider failed");
    }

    @Test
    void jobStatusReportsUnknownJob() {
        given(jobTracker.get(JOB_ID)).willReturn(Optional.empty());

        assertThat(mcpToolService.jobStatus(JOB_ID.toString())).startsWith("Error: Job").contains("not found");
    }

    @Test
    void jobStatusRejectsMalformedId() {
        assertThat(mcpToolService.jobStatus("not-a-uuid")).contains("Invalid job ID format");
    }

    @Test
    void cancelJobRequestsCancellation() {
        given(orchestrator.requestCancel(JOB_ID)).willReturn(true);
        given(jobTracker.require(JOB_ID)).willReturn(job(JobStatus.PROCESSING, 10, 0, null));

        assertThat(mcpToolService.cancelJob(JOB_ID.toString())).startsWith("Cancellation requested");
    }

    @Test
    void cancelJobOnFinishedJobExplains() {
        given(orchestrator.requestCancel(JOB_ID)).willReturn(false);
        given(jobTracker.require(JOB_ID)).willReturn(job(JobStatus.COMPLETED, 100, 0, null));

        assertThat(mcpToolService.cancelJob(JOB_ID.toString())).contains("already finished (completed)");
    }

    @Test
    void cancelJobReportsUnknownJob() {
        given(orchestrator.requestCancel(JOB_ID)).willThrow(new JobNotFoundException(JOB_ID));

        assertThat(mcpToolService.cancelJob(JOB_ID.toString())).startsWith("Error: Job");
    }

    @Test
    void refinementContextListsExamplesAndNotes() {
        given(feedbackAggregator.buildContext("revenue", 5))
                .willReturn(Optional.of(new RefinementContext(
                        "revenue",
                        List.of(new ConfirmedExample("$5.2M", List.of("The company earned $5.2M."), "")),
                        List.of("Use audited figures."))));

        String result = mcpToolService.refinementContext("revenue", null);

        assertThat(result)
                .contains("\"$5.2M\" <- The company earned $5.2M.")
                .contains("Note: Use audited figures.");
    }

    @Test
    void refinementContextWithoutFeedback() {
        given(feedbackAggregator.buildContext("founder", 2)).willReturn(Optional.empty());

        assertThat(mcpToolService.refinementContext("founder", 2)).startsWith("No confirmed examples");
    }

    @Test
    void refinementContextRejectsBlankCategory() {
        assertThat(mcpToolService.refinementContext(" ", null)).startsWith("Error:");
        verify(feedbackAggregator, never()).buildContext(anyString(), anyInt());
    }

    @Test
    void refinementContextReportsStoreFailure() {
        given(feedbackAggregator.buildContext("revenue", 5)).willThrow(new IllegalStateException("db down"));

        assertThat(mcpToolService.refinementContext("revenue", 0)).contains("db down");
    }

    private static ExtractionJob job(JobStatus status, int processed, int errored, String error) {
        return new ExtractionJob(JOB_ID, status, 100, processed, errored, CREATED, CREATED,
                CREATED, status.isTerminal() ? CREATED : null, error);
    }
}
