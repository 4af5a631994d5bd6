package io.b2mash.medicaid.rules;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable Medicaid long-term-care thresholds for one jurisdiction and rules year.
 *
 * <p>Construction validates what the engine relies on: monetary values are non-negative,
 * the lookback window is positive and the penalty divisor is strictly positive. A rule set that
 * violates them is rejected where it is built, so no calculator ever divides by zero.
 *
 * @param jurisdiction canonical jurisdiction the rules apply to
 * @param year rules year
 * @param resourceLimitSingle countable resource limit for a single applicant
 * @param resourceLimitMarried countable resource limit for a married applicant
 * @param incomeLimitSingle monthly income limit for a single applicant
 * @param incomeLimitMarried monthly income limit for a married applicant
 * @param lookbackMonths length of the transfer lookback window in calendar months
 * @param annualGiftExclusion amount excluded per recipient per calendar year
 * @param penaltyDivisor average monthly cost of care used to convert transfers into months
 * @param exemptTransferCategories purpose tags whose transfers never count toward a penalty
 */
public record RuleSet(
    Jurisdiction jurisdiction,
    int year,
    BigDecimal resourceLimitSingle,
    BigDecimal resourceLimitMarried,
    BigDecimal incomeLimitSingle,
    BigDecimal incomeLimitMarried,
    int lookbackMonths,
    BigDecimal annualGiftExclusion,
    BigDecimal penaltyDivisor,
    Set<String> exemptTransferCategories) {

  public RuleSet {
    Objects.requireNonNull(jurisdiction, "jurisdiction must not be null");
    requireNonNegative("resourceLimitSingle", resourceLimitSingle);
    requireNonNegative("resourceLimitMarried", resourceLimitMarried);
    requireNonNegative("incomeLimitSingle", incomeLimitSingle);
    requireNonNegative("incomeLimitMarried", incomeLimitMarried);
    requireNonNegative("annualGiftExclusion", annualGiftExclusion);
    Objects.requireNonNull(penaltyDivisor, "penaltyDivisor must not be null");
    if (penaltyDivisor.signum() <= 0) {
      throw new IllegalArgumentException(
          "penaltyDivisor must be positive for " + jurisdiction + " " + year);
    }
    if (lookbackMonths <= 0) {
      throw new IllegalArgumentException(
          "lookbackMonths must be positive for " + jurisdiction + " " + year);
    }
    exemptTransferCategories =
        exemptTransferCategories == null
            ? Set.of()
            : exemptTransferCategories.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(c -> c.trim().toLowerCase())
                .collect(Collectors.toUnmodifiableSet());
  }

  private static void requireNonNegative(String field, BigDecimal value) {
    Objects.requireNonNull(value, field + " must not be null");
    if (value.signum() < 0) {
      throw new IllegalArgumentException(field + " must not be negative: " + value);
    }
  }
}
