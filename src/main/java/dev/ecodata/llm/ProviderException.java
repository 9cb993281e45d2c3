package dev.ecodata.llm;

/** A failed model call. */
public abstract class ProviderException extends RuntimeException {

  protected ProviderException(String message, Throwable cause) {
    super(message, cause);
  }

  protected ProviderException(String message) {
    super(message);
  }
}
