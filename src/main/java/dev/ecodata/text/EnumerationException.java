package dev.ecodata.text;

/**
 * Signals row text that cannot be split into sentences (control characters, broken surrogate
 * pairs). Fatal to the row being enumerated only.
 */
public class EnumerationException extends RuntimeException {

  public EnumerationException(String message) {
    super(message);
  }
}
