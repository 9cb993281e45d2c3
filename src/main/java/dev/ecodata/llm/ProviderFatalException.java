package dev.ecodata.llm;

/** A model call failure that retrying cannot fix: authentication, invalid request, no route. */
public class ProviderFatalException extends ProviderException {

  public ProviderFatalException(String message, Throwable cause) {
    super(message, cause);
  }

  public ProviderFatalException(String message) {
    super(message);
  }
}
