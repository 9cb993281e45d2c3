package dev.ecodata.job;

import dev.ecodata.extraction.CategorySchema;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory registry of extraction jobs.
 *
 * <p>Holds one {@link ExtractionJob} snapshot per job in a {@link ConcurrentHashMap}. Every update
 * atomically reads the current snapshot, builds a new immutable record and writes it back with
 * {@code compute()}, so concurrent row workers never lose a progress increment. Row results are
 * write-once per row id.
 *
 * <p>Jobs own their inputs and results; both live as long as the job entry and are dropped by
 * {@link #remove(UUID)}. Contents are lost on restart.
 */
@Component
public class JobTracker {

  /**
   * Inputs a job was created from, kept so that selected rows can be resubmitted.
   *
   * @param rows the submitted rows, in submission order
   * @param schema the requested categories
   */
  public record JobDefinition(List<RowInput> rows, List<CategorySchema> schema) {

    public JobDefinition {
      rows = List.copyOf(rows);
      schema = List.copyOf(schema);
    }
  }

  private final ConcurrentHashMap<UUID, ExtractionJob> jobs = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<UUID, JobDefinition> definitions = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<UUID, ConcurrentHashMap<String, RowResult>> results =
      new ConcurrentHashMap<>();
  private final Set<UUID> cancelRequests = ConcurrentHashMap.newKeySet();
  private final ConcurrentHashMap<UUID, AtomicInteger> fatalErrors = new ConcurrentHashMap<>();

  private final Clock clock;

  public JobTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Registers a new pending job.
   *
   * @throws IllegalArgumentException if row ids or category names are duplicated
   */
  public ExtractionJob create(List<RowInput> rows, List<CategorySchema> schema) {
    requireUnique(rows.stream().map(RowInput::rowId).toList(), "row id");
    requireUnique(schema.stream().map(CategorySchema::name).toList(), "category name");

    UUID jobId = UUID.randomUUID();
    var now = clock.instant();
    ExtractionJob job =
        new ExtractionJob(jobId, JobStatus.PENDING, rows.size(), 0, 0, now, now, null, null, null);
    definitions.put(jobId, new JobDefinition(rows, schema));
    results.put(jobId, new ConcurrentHashMap<>());
    fatalErrors.put(jobId, new AtomicInteger());
    jobs.put(jobId, job);
    return job;
  }

  /**
   * Moves a pending job to processing.
   *
   * @return true if the job was pending; false if it was cancelled, already started or removed
   */
  public boolean start(UUID jobId) {
    AtomicBoolean started = new AtomicBoolean();
    jobs.computeIfPresent(
        jobId,
        (id, job) -> {
          if (job.status() != JobStatus.PENDING) {
            return job;
          }
          started.set(true);
          return job.withStatus(JobStatus.PROCESSING, clock.instant());
        });
    return started.get();
  }

  /**
   * Stores a row's result and counts the row as processed.
   *
   * @throws IllegalStateException if a result for this row was already stored
   */
  public void recordRow(UUID jobId, RowResult result) {
    ConcurrentHashMap<String, RowResult> rows = results.get(jobId);
    if (rows == null) {
      throw new JobNotFoundException(jobId);
    }
    if (rows.putIfAbsent(result.rowId(), result) != null) {
      throw new IllegalStateException(
          "Result for row '%s' of job %s already recorded".formatted(result.rowId(), jobId));
    }
    update(jobId, job -> job.withRowProcessed(result.hasError(), clock.instant()));
  }

  /** Counts a row that failed with a fatal provider error and returns the new total. */
  public int recordFatalError(UUID jobId) {
    return fatalErrors.computeIfAbsent(jobId, id -> new AtomicInteger()).incrementAndGet();
  }

  public int fatalErrorCount(UUID jobId) {
    AtomicInteger count = fatalErrors.get(jobId);
    return count == null ? 0 : count.get();
  }

  /**
   * Requests cancellation. A pending job is cancelled at once; a processing job stops starting
   * new rows and is cancelled when in-flight rows finish.
   *
   * @return false if the job had already finished
   * @throws JobNotFoundException if the job is unknown
   */
  public boolean requestCancel(UUID jobId) {
    AtomicBoolean accepted = new AtomicBoolean();
    update(
        jobId,
        job -> {
          if (job.status() == JobStatus.PENDING) {
            accepted.set(true);
            return job.withStatus(JobStatus.CANCELLED, clock.instant());
          }
          if (job.status() == JobStatus.PROCESSING) {
            accepted.set(true);
            cancelRequests.add(jobId);
          }
          return job;
        });
    return accepted.get();
  }

  public boolean isCancelRequested(UUID jobId) {
    return cancelRequests.contains(jobId);
  }

  /** Ends a processing job as completed, or cancelled if cancellation was requested. */
  public ExtractionJob finish(UUID jobId) {
    return update(
        jobId,
        job -> {
          if (job.status() != JobStatus.PROCESSING) {
            return job;
          }
          JobStatus end =
              cancelRequests.contains(jobId) ? JobStatus.CANCELLED : JobStatus.COMPLETED;
          return job.withStatus(end, clock.instant());
        });
  }

  /** Ends a non-terminal job as failed. */
  public ExtractionJob fail(UUID jobId, String reason) {
    return update(
        jobId, job -> job.status().isTerminal() ? job : job.failed(reason, clock.instant()));
  }

  /**
   * Stops tracking a finished job and drops its inputs and row results.
   *
   * @return the last snapshot of the removed job
   * @throws JobNotFoundException if the job is unknown
   * @throws IllegalStateException if the job is still pending or processing
   */
  public ExtractionJob remove(UUID jobId) {
    AtomicReference<ExtractionJob> removed = new AtomicReference<>();
    jobs.computeIfPresent(
        jobId,
        (id, job) -> {
          if (!job.status().isTerminal()) {
            throw new IllegalStateException(
                "Job %s is still %s; only finished jobs can be removed"
                    .formatted(jobId, job.status().value()));
          }
          removed.set(job);
          return null;
        });
    if (removed.get() == null) {
      throw new JobNotFoundException(jobId);
    }
    definitions.remove(jobId);
    results.remove(jobId);
    cancelRequests.remove(jobId);
    fatalErrors.remove(jobId);
    return removed.get();
  }

  public Optional<ExtractionJob> get(UUID jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  /**
   * Returns the job snapshot.
   *
   * @throws JobNotFoundException if the job is unknown
   */
  public ExtractionJob require(UUID jobId) {
    return get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /** All tracked jobs, newest first. */
  public List<ExtractionJob> list() {
    return jobs.values().stream()
        .sorted(Comparator.comparing(ExtractionJob::createdAt).reversed())
        .toList();
  }

  /**
   * Returns the inputs the job was created from.
   *
   * @throws JobNotFoundException if the job is unknown
   */
  public JobDefinition definition(UUID jobId) {
    JobDefinition definition = definitions.get(jobId);
    if (definition == null) {
      throw new JobNotFoundException(jobId);
    }
    return definition;
  }

  /** Results recorded so far, in submission order of their rows. */
  public List<RowResult> results(UUID jobId) {
    ConcurrentHashMap<String, RowResult> rows = results.get(jobId);
    if (rows == null) {
      throw new JobNotFoundException(jobId);
    }
    List<RowResult> ordered = new ArrayList<>();
    for (RowInput input : definition(jobId).rows()) {
      RowResult result = rows.get(input.rowId());
      if (result != null) {
        ordered.add(result);
      }
    }
    return ordered;
  }

  public Optional<RowResult> result(UUID jobId, String rowId) {
    ConcurrentHashMap<String, RowResult> rows = results.get(jobId);
    if (rows == null) {
      throw new JobNotFoundException(jobId);
    }
    return Optional.ofNullable(rows.get(rowId));
  }

  private ExtractionJob update(UUID jobId, UnaryOperator<ExtractionJob> change) {
    ExtractionJob updated = jobs.computeIfPresent(jobId, (id, job) -> change.apply(job));
    if (updated == null) {
      throw new JobNotFoundException(jobId);
    }
    return updated;
  }

  private static void requireUnique(List<String> values, String what) {
    Set<String> seen = new HashSet<>();
    for (String value : values) {
      if (!seen.add(value)) {
        throw new IllegalArgumentException("Duplicate " + what + ": " + value);
      }
    }
  }
}
