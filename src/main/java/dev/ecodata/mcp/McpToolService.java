package dev.ecodata.mcp;

import dev.ecodata.extraction.ExtractionProperties;
import dev.ecodata.feedback.ConfirmedExample;
import dev.ecodata.feedback.FeedbackAggregator;
import dev.ecodata.feedback.RefinementContext;
import dev.ecodata.job.ExtractionJob;
import dev.ecodata.job.ExtractionOrchestrator;
import dev.ecodata.job.JobNotFoundException;
import dev.ecodata.job.JobTracker;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing job monitoring and refinement context as tools.
 *
 * <p>Tool methods never throw: every failure is returned as a descriptive {@code Error: ...}
 * string the calling agent can act on.
 *
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private final JobTracker jobTracker;
  private final ExtractionOrchestrator orchestrator;
  private final FeedbackAggregator feedbackAggregator;
  private final ExtractionProperties properties;

  public McpToolService(
      JobTracker jobTracker,
      ExtractionOrchestrator orchestrator,
      FeedbackAggregator feedbackAggregator,
      ExtractionProperties properties) {
    this.jobTracker = jobTracker;
    this.orchestrator = orchestrator;
    this.feedbackAggregator = feedbackAggregator;
    this.properties = properties;
  }

  @Tool(
      name = "job_status",
      description =
          "Check the status and progress of an extraction job: rows processed, rows with errors, "
              + "and the failure reason if the job failed.")
  public String jobStatus(@ToolParam(description = "UUID of the extraction job") String jobId) {
    try {
      Optional<ExtractionJob> found = jobTracker.get(parseUuid(jobId));
      if (found.isEmpty()) {
        return "Error: Job %s not found.".formatted(jobId);
      }
      return formatJob(found.get());
    } catch (IllegalArgumentException e) {
      return "Error: Invalid job ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error checking job status: " + e.getMessage();
    }
  }

  @Tool(
      name = "cancel_job",
      description =
          "Cancel an extraction job. Rows already running finish and keep their results; "
              + "no new rows start.")
  public String cancelJob(@ToolParam(description = "UUID of the extraction job") String jobId) {
    try {
      UUID uuid = parseUuid(jobId);
      if (!orchestrator.requestCancel(uuid)) {
        return "Job %s already finished (%s); nothing to cancel."
            .formatted(jobId, jobTracker.require(uuid).status().value());
      }
      return "Cancellation requested for job %s (status: %s)."
          .formatted(jobId, jobTracker.require(uuid).status().value());
    } catch (JobNotFoundException e) {
      return "Error: Job %s not found.".formatted(jobId);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid job ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error cancelling job: " + e.getMessage();
    }
  }

  @Tool(
      name = "refinement_context",
      description =
          "Show the reviewer-confirmed examples and notes that future extraction prompts will "
              + "include for a category.")
  public String refinementContext(
      @ToolParam(description = "Category name") @Nullable String category,
      @ToolParam(description = "Maximum number of examples (default 5)", required = false)
          @Nullable Integer maxExamples) {
    try {
      if (category == null || category.isBlank()) {
        return "Error: Category must not be empty.";
      }
      int max = maxExamples != null && maxExamples > 0 ? maxExamples : properties.getMaxExamples();
      Optional<RefinementContext> context = feedbackAggregator.buildContext(category, max);
      if (context.isEmpty()) {
        return "No confirmed examples for category '%s' yet.".formatted(category);
      }
      return formatContext(context.get());
    } catch (Exception e) {
      return "Error building refinement context: " + e.getMessage();
    }
  }

  private static String formatJob(ExtractionJob job) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        "Job %s: %s | %d/%d rows (%d%%) | %d with errors%n"
            .formatted(
                job.jobId(),
                job.status().value(),
                job.processedRows(),
                job.totalRows(),
                job.progressPercent(),
                job.erroredRows()));
    sb.append("Created: ").append(job.createdAt());
    if (job.completedAt() != null) {
      sb.append(" | Finished: ").append(job.completedAt());
    }
    if (job.error() != null) {
      sb.append(System.lineSeparator()).append("Error: ").append(job.error());
    }
    return sb.toString();
  }

  private static String formatContext(RefinementContext context) {
    StringBuilder sb = new StringBuilder();
    sb.append("Refinement context for '%s':%n".formatted(context.category()));
    for (ConfirmedExample example : context.examples()) {
      sb.append("- \"").append(example.value()).append('"');
      if (!example.sentences().isEmpty()) {
        sb.append(" <- ").append(String.join(" | ", example.sentences()));
      }
      sb.append(System.lineSeparator());
    }
    for (String note : context.notes()) {
      sb.append("Note: ").append(note).append(System.lineSeparator());
    }
    return sb.toString();
  }

  private static UUID parseUuid(String value) {
    return UUID.fromString(value);
  }
}
