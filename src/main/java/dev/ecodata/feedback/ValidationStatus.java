package dev.ecodata.feedback;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** A reviewer's verdict on one extracted category. */
public enum ValidationStatus {
  /** The extracted value (or the reviewer's restatement of it) is correct. */
  CONFIRMED("confirmed"),
  /** The extracted value is wrong; recorded but never used as an example. */
  REJECTED("rejected"),
  /** The reviewer replaced the value with a manual one. */
  OVERRIDE("override");

  private final String value;

  ValidationStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ValidationStatus fromValue(String value) {
    for (ValidationStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Invalid validation status: " + value);
  }

  /** Whether feedback with this status may become a positive example. */
  public boolean isPositive() {
    return this == CONFIRMED || this == OVERRIDE;
  }
}
