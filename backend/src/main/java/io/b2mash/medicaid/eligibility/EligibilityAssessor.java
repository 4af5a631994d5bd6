package io.b2mash.medicaid.eligibility;

import io.b2mash.medicaid.classification.AssetClassification;
import io.b2mash.medicaid.rules.RuleSet;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Stateless service comparing classified assets and income against a rule set's limits. */
@Service
public class EligibilityAssessor {

  private static final Logger log = LoggerFactory.getLogger(EligibilityAssessor.class);

  /**
   * Assesses resource and income eligibility. Limits are inclusive upper bounds: a household
   * exactly at a limit is eligible.
   */
  public EligibilityVerdict assess(
      AssetClassification classified,
      BigDecimal totalIncome,
      RuleSet rules,
      MaritalStatus maritalStatus) {
    BigDecimal resourceLimit =
        maritalStatus == MaritalStatus.MARRIED
            ? rules.resourceLimitMarried()
            : rules.resourceLimitSingle();
    BigDecimal incomeLimit =
        maritalStatus == MaritalStatus.MARRIED
            ? rules.incomeLimitMarried()
            : rules.incomeLimitSingle();

    BigDecimal countable = classified.countable();
    boolean resourceEligible = countable.compareTo(resourceLimit) <= 0;
    boolean incomeEligible = totalIncome.compareTo(incomeLimit) <= 0;
    BigDecimal excessResources = countable.subtract(resourceLimit).max(BigDecimal.ZERO);
    BigDecimal excessIncome = totalIncome.subtract(incomeLimit).max(BigDecimal.ZERO);

    log.debug(
        "Eligibility assessed: jurisdiction={}, maritalStatus={}, resourceEligible={},"
            + " incomeEligible={}",
        rules.jurisdiction(),
        maritalStatus,
        resourceEligible,
        incomeEligible);
    return new EligibilityVerdict(
        countable,
        classified.nonCountable(),
        totalIncome,
        resourceEligible,
        incomeEligible,
        excessResources,
        excessIncome,
        resourceLimit,
        incomeLimit,
        maritalStatus);
  }
}
