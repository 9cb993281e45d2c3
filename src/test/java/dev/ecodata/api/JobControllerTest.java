package dev.ecodata.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.ecodata.config.GlobalExceptionHandler;
import dev.ecodata.extraction.CategorySchema;
import dev.ecodata.extraction.EvidenceMapper;
import dev.ecodata.extraction.ExtractionProperties;
import dev.ecodata.extraction.ResponseParser;
import dev.ecodata.feedback.FeedbackAggregator;
import dev.ecodata.feedback.InMemoryFeedbackStore;
import dev.ecodata.job.ExtractionJob;
import dev.ecodata.job.ExtractionOrchestrator;
import dev.ecodata.job.JobTracker;
import dev.ecodata.job.ResultProjector;
import dev.ecodata.job.RowInput;
import dev.ecodata.llm.ModelGateway;
import dev.ecodata.prompt.PromptBuilder;
import dev.ecodata.text.SentenceEnumerator;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class JobControllerTest {

  private static final String RESPONSE =
      """
      {"revenue": {"values": [{"value": "$5M", "sentence_ids": [1], "confidence": 0.95}]},
       "founder": {"values": [], "candidates": [{"sentence_id": 2, "relevance": 0.4}]}}
      """;

  private JobTracker tracker;
  private ExtractionOrchestrator orchestrator;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    ExtractionProperties properties = new ExtractionProperties();
    Executor direct = Runnable::run;
    ModelGateway gateway = prompt -> RESPONSE;
    tracker = new JobTracker(Clock.systemUTC());
    orchestrator =
        new ExtractionOrchestrator(
            new SentenceEnumerator(),
            new PromptBuilder(properties),
            gateway,
            new ResponseParser(new EvidenceMapper(properties)),
            new FeedbackAggregator(new InMemoryFeedbackStore()),
            tracker,
            properties,
            direct,
            direct);
    mvc =
        MockMvcBuilders.standaloneSetup(
                new JobController(orchestrator, tracker, new ResultProjector()))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  void submitAcceptsJob() throws Exception {
    mvc.perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"rows": [{"rowId": "D5", "text": "The company earned $5M. Growth was 25%."}],
                     "categories": [{"name": "revenue", "prompt": "Revenue in {text}?"},
                                    {"name": "founder", "prompt": "Founder?"}]}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("pending"))
        .andExpect(jsonPath("$.totalRows").value(1));

    mvc.perform(get("/api/jobs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].status").value("completed"))
        .andExpect(jsonPath("$[0].progressPercent").value(100));
  }

  @Test
  void submitRejectsInvalidBody() throws Exception {
    mvc.perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rows\": [{\"rowId\": \"\", \"text\": \"x\"}], \"categories\": []}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void submitRejectsDuplicateRowIds() throws Exception {
    mvc.perform(
            post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"rows": [{"rowId": "A", "text": "x"}, {"rowId": "A", "text": "y"}],
                     "categories": [{"name": "revenue"}]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail", containsString("Duplicate row id")));
  }

  @Test
  void statusOfUnknownJobIsNotFound() throws Exception {
    mvc.perform(get("/api/jobs/{id}", UUID.randomUUID())).andExpect(status().isNotFound());
  }

  @Test
  void resultsReturnPrimaryValuesOrFullEvidence() throws Exception {
    ExtractionJob job = runJob();

    mvc.perform(get("/api/jobs/{id}/results", job.jobId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].rowId").value("D5"))
        .andExpect(jsonPath("$[0].values.revenue").value("$5M"))
        .andExpect(jsonPath("$[0].values.founder").value(nullValue()))
        .andExpect(jsonPath("$[0].details").value(nullValue()));

    mvc.perform(get("/api/jobs/{id}/results", job.jobId()).param("all", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].details.revenue.evidence[0].sentenceRefs[0]").value(1))
        .andExpect(jsonPath("$[0].details.revenue.evidence[0].confidence").value(0.95))
        .andExpect(jsonPath("$[0].details.founder.candidates[0].sentenceId").value(2));
  }

  @Test
  void cancelOfFinishedJobIsNotAccepted() throws Exception {
    ExtractionJob job = runJob();

    mvc.perform(post("/api/jobs/{id}/cancel", job.jobId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accepted").value(false))
        .andExpect(jsonPath("$.status").value("completed"));
  }

  @Test
  void cancelOfPendingJobIsAccepted() throws Exception {
    UUID jobId = tracker.create(List.of(new RowInput("D5", "Text.")), schema()).jobId();

    mvc.perform(post("/api/jobs/{id}/cancel", jobId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.accepted").value(true))
        .andExpect(jsonPath("$.status").value("cancelled"));
  }

  @Test
  void retryCreatesNewJob() throws Exception {
    ExtractionJob job = runJob();

    mvc.perform(
            post("/api/jobs/{id}/retry", job.jobId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rowIds\": [\"D5\"]}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.totalRows").value(1));
  }

  @Test
  void retryOfUnfinishedJobConflicts() throws Exception {
    UUID jobId = tracker.create(List.of(new RowInput("D5", "Text.")), schema()).jobId();

    mvc.perform(
            post("/api/jobs/{id}/retry", jobId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rowIds\": [\"D5\"]}"))
        .andExpect(status().isConflict());
  }

  @Test
  void deleteRemovesFinishedJob() throws Exception {
    ExtractionJob job = runJob();

    mvc.perform(delete("/api/jobs/{id}", job.jobId())).andExpect(status().isNoContent());

    mvc.perform(get("/api/jobs/{id}", job.jobId())).andExpect(status().isNotFound());
    mvc.perform(get("/api/jobs/{id}/results", job.jobId())).andExpect(status().isNotFound());
    mvc.perform(get("/api/jobs")).andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void deleteOfUnfinishedJobConflicts() throws Exception {
    UUID jobId = tracker.create(List.of(new RowInput("D5", "Text.")), schema()).jobId();

    mvc.perform(delete("/api/jobs/{id}", jobId))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.detail", containsString("only finished jobs can be removed")));
    mvc.perform(get("/api/jobs/{id}", jobId)).andExpect(status().isOk());
  }

  @Test
  void deleteOfUnknownJobIsNotFound() throws Exception {
    mvc.perform(delete("/api/jobs/{id}", UUID.randomUUID())).andExpect(status().isNotFound());
  }

  private ExtractionJob runJob() {
    return orchestrator.execute(
        List.of(new RowInput("D5", "The company earned $5M. Growth was 25%.")), schema());
  }

  private static List<CategorySchema> schema() {
    return List.of(
        new CategorySchema("revenue", "Revenue"), new CategorySchema("founder", "Founder"));
  }
}
