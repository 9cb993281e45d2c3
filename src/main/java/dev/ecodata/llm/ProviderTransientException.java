package dev.ecodata.llm;

/** A model call failure that may succeed when retried: timeout, rate limit, server overload. */
public class ProviderTransientException extends ProviderException {

  public ProviderTransientException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProviderTransientException(String message) {
    super(message);
  }
}
