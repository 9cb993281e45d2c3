package dev.ecodata.api;

import dev.ecodata.job.ExtractionJob;
import dev.ecodata.job.ExtractionOrchestrator;
import dev.ecodata.job.JobTracker;
import dev.ecodata.job.ResultProjector;
import dev.ecodata.job.ResultProjector.RowProjection;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Job submission, status polling, results, cancellation, row retry and removal. */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

  private final ExtractionOrchestrator orchestrator;
  private final JobTracker jobTracker;
  private final ResultProjector resultProjector;

  public JobController(
      ExtractionOrchestrator orchestrator, JobTracker jobTracker, ResultProjector resultProjector) {
    this.orchestrator = orchestrator;
    this.jobTracker = jobTracker;
    this.resultProjector = resultProjector;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.ACCEPTED)
  public ExtractionJob submit(@Valid @RequestBody SubmitJobRequest request) {
    return orchestrator.submit(request.toInputs(), request.toSchema());
  }

  @GetMapping
  public List<ExtractionJob> list() {
    return jobTracker.list();
  }

  @GetMapping("/{jobId}")
  public ExtractionJob status(@PathVariable UUID jobId) {
    return jobTracker.require(jobId);
  }

  /**
   * Results recorded so far. By default each row carries only the primary value per category;
   * {@code all=true} adds every evidence entry with its sentence ids and the candidates.
   */
  @GetMapping("/{jobId}/results")
  public List<RowProjection> results(
      @PathVariable UUID jobId, @RequestParam(defaultValue = "false") boolean all) {
    return resultProjector.projectAll(
        jobTracker.results(jobId), jobTracker.definition(jobId).schema(), all);
  }

  @PostMapping("/{jobId}/cancel")
  public CancelResponse cancel(@PathVariable UUID jobId) {
    boolean accepted = orchestrator.requestCancel(jobId);
    return new CancelResponse(jobId, accepted, jobTracker.require(jobId).status());
  }

  @PostMapping("/{jobId}/retry")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public ExtractionJob retry(
      @PathVariable UUID jobId, @Valid @RequestBody RetryRowsRequest request) {
    return orchestrator.retryRows(jobId, request.rowIds());
  }

  /** Forgets a finished job together with its results. Pending or processing jobs give 409. */
  @DeleteMapping("/{jobId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void remove(@PathVariable UUID jobId) {
    orchestrator.remove(jobId);
  }
}
