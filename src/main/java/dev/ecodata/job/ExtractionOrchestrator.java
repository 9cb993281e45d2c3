package dev.ecodata.job;

import dev.ecodata.extraction.CategoryExtraction;
import dev.ecodata.extraction.CategorySchema;
import dev.ecodata.extraction.ExtractionProperties;
import dev.ecodata.extraction.ResponseParser;
import dev.ecodata.feedback.FeedbackAggregator;
import dev.ecodata.feedback.RefinementContext;
import dev.ecodata.llm.ModelGateway;
import dev.ecodata.llm.ProviderFatalException;
import dev.ecodata.llm.ProviderTransientException;
import dev.ecodata.prompt.ExtractionPrompt;
import dev.ecodata.prompt.PromptBuilder;
import dev.ecodata.text.EnumerationException;
import dev.ecodata.text.Sentence;
import dev.ecodata.text.SentenceEnumerator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs extraction jobs: rows in parallel, each row as one sequential pipeline.
 *
 * <p>Per row: enumerate sentences, load the current refinement context for every category, build
 * the prompt, call the model, parse the answer, then store the {@link RowResult} and count the
 * row. Row-level failures are recorded on the result and never fail the job. Rows run on the
 * shared {@code rowExecutor}, whose pool size bounds concurrent model calls across all jobs.
 *
 * <p>Cancellation is cooperative and checked before each row starts; rows already running finish
 * and keep their results. When fatal provider errors reach {@code fatal-error-threshold} rows, no
 * further rows start and the job ends failed.
 */
@Service
public class ExtractionOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

  private final SentenceEnumerator sentenceEnumerator;
  private final PromptBuilder promptBuilder;
  private final ModelGateway modelGateway;
  private final ResponseParser responseParser;
  private final FeedbackAggregator feedbackAggregator;
  private final JobTracker jobTracker;
  private final ExtractionProperties properties;
  private final Executor rowExecutor;
  private final Executor jobExecutor;

  public ExtractionOrchestrator(
      SentenceEnumerator sentenceEnumerator,
      PromptBuilder promptBuilder,
      ModelGateway modelGateway,
      ResponseParser responseParser,
      FeedbackAggregator feedbackAggregator,
      JobTracker jobTracker,
      ExtractionProperties properties,
      @Qualifier("rowExecutor") Executor rowExecutor,
      @Qualifier("jobExecutor") Executor jobExecutor) {
    this.sentenceEnumerator = sentenceEnumerator;
    this.promptBuilder = promptBuilder;
    this.modelGateway = modelGateway;
    this.responseParser = responseParser;
    this.feedbackAggregator = feedbackAggregator;
    this.jobTracker = jobTracker;
    this.properties = properties;
    this.rowExecutor = rowExecutor;
    this.jobExecutor = jobExecutor;
  }

  /**
   * Creates a job and starts it in the background.
   *
   * @param rows the rows to extract from
   * @param schema the categories to extract
   * @return the pending job snapshot
   * @throws IllegalArgumentException if row ids or category names are duplicated
   */
  public ExtractionJob submit(List<RowInput> rows, List<CategorySchema> schema) {
    ExtractionJob job = jobTracker.create(rows, schema);
    log.info(
        "Created job {} with {} row(s) and {} categor(ies)",
        job.jobId(),
        rows.size(),
        schema.size());
    try {
      jobExecutor.execute(() -> run(job.jobId()));
    } catch (RejectedExecutionException e) {
      log.error("Could not schedule job {}: {}", job.jobId(), e.getMessage());
      return jobTracker.fail(job.jobId(), "Job could not be scheduled: " + e.getMessage());
    }
    return job;
  }

  /**
   * Creates a job and runs it on the calling thread.
   *
   * @return the terminal job snapshot
   */
  public ExtractionJob execute(List<RowInput> rows, List<CategorySchema> schema) {
    ExtractionJob job = jobTracker.create(rows, schema);
    run(job.jobId());
    return jobTracker.require(job.jobId());
  }

  /**
   * Requests cooperative cancellation.
   *
   * @return false if the job had already finished
   * @throws JobNotFoundException if the job is unknown
   */
  public boolean requestCancel(UUID jobId) {
    boolean accepted = jobTracker.requestCancel(jobId);
    if (accepted) {
      log.info("Cancellation requested for job {}", jobId);
    }
    return accepted;
  }

  /**
   * Resubmits selected rows of a finished job as a new job with the same schema. The source job
   * and its results are left untouched.
   *
   * @param jobId the finished job
   * @param rowIds rows to run again
   * @return the new pending job
   * @throws JobNotFoundException if the job is unknown
   * @throws IllegalStateException if the job has not finished
   * @throws IllegalArgumentException if a row id is not part of the job, or none is given
   */
  public ExtractionJob retryRows(UUID jobId, List<String> rowIds) {
    ExtractionJob source = jobTracker.require(jobId);
    if (!source.status().isTerminal()) {
      throw new IllegalStateException(
          "Job %s is still %s; only finished jobs can be retried"
              .formatted(jobId, source.status().value()));
    }
    if (rowIds.isEmpty()) {
      throw new IllegalArgumentException("At least one row id is required");
    }
    JobTracker.JobDefinition definition = jobTracker.definition(jobId);
    Map<String, RowInput> byId = new LinkedHashMap<>();
    definition.rows().forEach(row -> byId.put(row.rowId(), row));

    Set<String> requested = new HashSet<>(rowIds);
    for (String rowId : requested) {
      if (!byId.containsKey(rowId)) {
        throw new IllegalArgumentException(
            "Row '%s' is not part of job %s".formatted(rowId, jobId));
      }
    }
    List<RowInput> subset =
        byId.values().stream().filter(row -> requested.contains(row.rowId())).toList();
    log.info("Retrying {} row(s) of job {}", subset.size(), jobId);
    return submit(subset, definition.schema());
  }

  /**
   * Removes a finished job and its results from tracking.
   *
   * @throws JobNotFoundException if the job is unknown
   * @throws IllegalStateException if the job has not finished
   */
  public void remove(UUID jobId) {
    ExtractionJob removed = jobTracker.remove(jobId);
    log.info(
        "Removed job {} ({}, {} row result(s))",
        jobId,
        removed.status().value(),
        removed.processedRows());
  }

  void run(UUID jobId) {
    if (!jobTracker.start(jobId)) {
      log.info("Job {} is no longer pending, not starting", jobId);
      return;
    }
    JobTracker.JobDefinition definition = jobTracker.definition(jobId);
    log.info("Started job {} ({} rows)", jobId, definition.rows().size());

    try {
      List<CompletableFuture<Void>> rows = new ArrayList<>();
      for (RowInput row : definition.rows()) {
        rows.add(
            CompletableFuture.runAsync(
                () -> processRowIfActive(jobId, row, definition.schema()), rowExecutor));
      }
      CompletableFuture.allOf(rows.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException | RejectedExecutionException e) {
      Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
      log.error("Job {} failed: {}", jobId, cause.getMessage(), cause);
      jobTracker.fail(jobId, "Row processing failed: " + cause.getMessage());
      return;
    }

    int fatal = jobTracker.fatalErrorCount(jobId);
    if (fatal >= properties.getFatalErrorThreshold()) {
      ExtractionJob failed =
          jobTracker.fail(
              jobId, "Model provider failed for %d row(s); stopping job".formatted(fatal));
      log.error("Job {} failed: {}", jobId, failed.error());
      return;
    }
    ExtractionJob finished = jobTracker.finish(jobId);
    log.info(
        "Job {} {}: {}/{} rows processed, {} with errors",
        jobId,
        finished.status().value(),
        finished.processedRows(),
        finished.totalRows(),
        finished.erroredRows());
  }

  private void processRowIfActive(UUID jobId, RowInput row, List<CategorySchema> schema) {
    if (jobTracker.isCancelRequested(jobId)) {
      log.debug("Job {} cancelled, skipping row {}", jobId, row.rowId());
      return;
    }
    if (jobTracker.fatalErrorCount(jobId) >= properties.getFatalErrorThreshold()) {
      log.debug("Job {} is failing, skipping row {}", jobId, row.rowId());
      return;
    }
    jobTracker.recordRow(jobId, processRow(jobId, row, schema));
  }

  RowResult processRow(UUID jobId, RowInput row, List<CategorySchema> schema) {
    long started = System.nanoTime();
    List<Sentence> sentences = List.of();
    try {
      sentences = sentenceEnumerator.enumerate(row.text());
      Map<String, CategoryExtraction> categories;
      if (sentences.isEmpty()) {
        categories = new LinkedHashMap<>();
        for (CategorySchema category : schema) {
          categories.put(
              category.name(), CategoryExtraction.notFound(category.name(), "row has no text"));
        }
      } else {
        ExtractionPrompt prompt =
            promptBuilder.build(schema, sentences, refinementContexts(schema));
        String raw = modelGateway.complete(prompt);
        categories = responseParser.parse(raw, sentences, schema);
      }
      return new RowResult(row.rowId(), categories, sentences, null, elapsedMs(started));
    } catch (EnumerationException e) {
      log.warn("Row {} of job {} has unusable text: {}", row.rowId(), jobId, e.getMessage());
      return RowResult.failed(
          row.rowId(), sentences, "Invalid text: " + e.getMessage(), elapsedMs(started));
    } catch (ProviderTransientException e) {
      log.warn("Row {} of job {} failed after retries: {}", row.rowId(), jobId, e.getMessage());
      return RowResult.failed(row.rowId(), sentences, e.getMessage(), elapsedMs(started));
    } catch (ProviderFatalException e) {
      int count = jobTracker.recordFatalError(jobId);
      log.warn(
          "Row {} of job {} hit fatal provider error ({} so far): {}",
          row.rowId(),
          jobId,
          count,
          e.getMessage());
      return RowResult.failed(row.rowId(), sentences, e.getMessage(), elapsedMs(started));
    } catch (RuntimeException e) {
      log.error("Row {} of job {} failed unexpectedly", row.rowId(), jobId, e);
      return RowResult.failed(
          row.rowId(), sentences, "Unexpected error: " + e.getMessage(), elapsedMs(started));
    }
  }

  private Map<String, RefinementContext> refinementContexts(List<CategorySchema> schema) {
    try {
      return feedbackAggregator.buildContexts(
          schema.stream().map(CategorySchema::name).toList(), properties.getMaxExamples());
    } catch (RuntimeException e) {
      log.warn("Refinement context unavailable, prompting without examples: {}", e.getMessage());
      return Map.of();
    }
  }

  private static long elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }
}
