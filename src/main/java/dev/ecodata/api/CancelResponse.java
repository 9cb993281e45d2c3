package dev.ecodata.api;

import dev.ecodata.job.JobStatus;
import java.util.UUID;

/**
 * Result of a cancellation request.
 *
 * @param jobId the job
 * @param accepted false when the job had already finished
 * @param status the job status right after the request
 */
public record CancelResponse(UUID jobId, boolean accepted, JobStatus status) {}
