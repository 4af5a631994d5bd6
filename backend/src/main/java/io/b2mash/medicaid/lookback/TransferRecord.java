package io.b2mash.medicaid.lookback;

import java.math.BigDecimal;

/**
 * One historical asset movement as supplied by the planner. The date is kept exactly as entered;
 * the analyzer decides whether it is usable.
 *
 * @param date transfer date as entered (ISO {@code yyyy-MM-dd} or {@code MM/dd/yyyy})
 * @param amount transferred value, expected to be positive
 * @param recipient free-form recipient identifier, e.g. "child"
 * @param purpose free-form purpose tag, e.g. "gift" or "caregiver compensation"
 * @param documentation reference to supporting paperwork, or null if none
 * @param details structured sub-fields such as care hours, or null
 */
public record TransferRecord(
    String date,
    BigDecimal amount,
    String recipient,
    String purpose,
    String documentation,
    TransferDetails details) {

  public boolean hasDocumentation() {
    return documentation != null && !documentation.isBlank();
  }

  /** True when the details show qualifying care provided by a family member. */
  public boolean showsFamilyCare() {
    return details != null
        && details.documentsQualifyingCare()
        && (TransferDetails.isFamily(details.relationship())
            || TransferDetails.isFamily(recipient));
  }
}
