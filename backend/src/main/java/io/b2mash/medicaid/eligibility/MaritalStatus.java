package io.b2mash.medicaid.eligibility;

import io.b2mash.medicaid.exception.InvalidHouseholdInputException;

public enum MaritalStatus {
  SINGLE,
  MARRIED;

  /**
   * Parses a marital status. Only "single" and "married" are supported; anything else is rejected
   * rather than defaulted.
   *
   * @throws InvalidHouseholdInputException for null or unsupported values
   */
  public static MaritalStatus from(String value) {
    if (value != null) {
      switch (value.trim().toLowerCase()) {
        case "single":
          return SINGLE;
        case "married":
          return MARRIED;
        default:
          break;
      }
    }
    throw new InvalidHouseholdInputException(
        "Marital status must be one of: single, married (got '" + value + "')");
  }
}
