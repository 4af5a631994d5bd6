package io.b2mash.medicaid.eligibility;

import java.math.BigDecimal;

/**
 * Resource and income eligibility against the limits of one rule set.
 *
 * @param countableAssets assets counted toward the resource limit
 * @param nonCountableAssets exempt assets
 * @param totalMonthlyIncome summed monthly income
 * @param isResourceEligible countable assets at or below the resource limit
 * @param isIncomeEligible income at or below the income limit
 * @param excessResources countable assets above the limit, never negative
 * @param excessIncome income above the limit, never negative
 * @param resourceLimit limit applied for the marital status
 * @param incomeLimit limit applied for the marital status
 * @param maritalStatus marital status the limits were selected for
 */
public record EligibilityVerdict(
    BigDecimal countableAssets,
    BigDecimal nonCountableAssets,
    BigDecimal totalMonthlyIncome,
    boolean isResourceEligible,
    boolean isIncomeEligible,
    BigDecimal excessResources,
    BigDecimal excessIncome,
    BigDecimal resourceLimit,
    BigDecimal incomeLimit,
    MaritalStatus maritalStatus) {

  public boolean isEligible() {
    return isResourceEligible && isIncomeEligible;
  }
}
