package dev.ecodata.feedback;

/**
 * Thrown when feedback could not be persisted. Nothing from the failed write is stored, so the
 * caller may retry the whole batch.
 */
public class FeedbackWriteException extends RuntimeException {

  public FeedbackWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
