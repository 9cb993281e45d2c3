package dev.ecodata.job;

import java.util.UUID;

/** Thrown when a job id is not known to the tracker. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(UUID jobId) {
    super("Job " + jobId + " not found");
  }
}
