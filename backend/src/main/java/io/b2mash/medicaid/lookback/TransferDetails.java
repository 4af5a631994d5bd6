package io.b2mash.medicaid.lookback;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Set;

/**
 * Structured sub-fields attached to a transfer, mainly describing a care arrangement.
 *
 * @param yearsOfCare how long care was provided
 * @param hoursPerWeek weekly hours of care
 * @param relationship relationship of the recipient to the applicant, e.g. "daughter"
 * @param careDescription free-form description of the care provided
 */
public record TransferDetails(
    BigDecimal yearsOfCare, BigDecimal hoursPerWeek, String relationship, String careDescription) {

  private static final Set<String> FAMILY_TERMS =
      Set.of(
          "child",
          "son",
          "daughter",
          "grandchild",
          "grandson",
          "granddaughter",
          "sibling",
          "brother",
          "sister",
          "niece",
          "nephew",
          "spouse",
          "husband",
          "wife",
          "stepchild",
          "stepson",
          "stepdaughter",
          "children",
          "grandchildren",
          "family");

  /** True when both a care duration and a weekly-hours figure are recorded. */
  public boolean documentsQualifyingCare() {
    return yearsOfCare != null
        && yearsOfCare.signum() > 0
        && hoursPerWeek != null
        && hoursPerWeek.signum() > 0;
  }

  /** True when the given relationship or recipient label names a family member. */
  static boolean isFamily(String label) {
    if (label == null || label.isBlank()) {
      return false;
    }
    return Arrays.stream(label.toLowerCase().split("[^a-z]+")).anyMatch(FAMILY_TERMS::contains);
  }
}
