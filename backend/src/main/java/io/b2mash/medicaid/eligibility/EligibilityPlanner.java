package io.b2mash.medicaid.eligibility;

import io.b2mash.medicaid.config.PlanningProperties;
import io.b2mash.medicaid.household.ClientInfo;
import io.b2mash.medicaid.rules.RuleSet;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the planning guidance that accompanies an eligibility verdict: spend-down strategies,
 * half-a-loaf gifting options for excess resources, next steps and verification warnings.
 */
@Service
public class EligibilityPlanner {

  private static final Logger log = LoggerFactory.getLogger(EligibilityPlanner.class);

  private static final BigDecimal GIFTING_CEILING = new BigDecimal("50000");

  private final PlanningProperties planningProperties;

  public EligibilityPlanner(PlanningProperties planningProperties) {
    this.planningProperties = planningProperties;
  }

  public EligibilityAssessment plan(EligibilityVerdict verdict, RuleSet rules, ClientInfo client) {
    BigDecimal spendDown = verdict.excessResources();
    Urgency urgency = Urgency.determine(client.age(), client.healthStatus(), client.crisis());

    var assessment =
        new EligibilityAssessment(
            verdict,
            verdict.isEligible(),
            spendDown,
            urgency,
            planStrategies(verdict),
            divestmentOptions(spendDown, rules),
            nextSteps(spendDown, rules),
            warnings(verdict));
    log.debug(
        "Eligibility plan built: jurisdiction={}, eligible={}, urgency={}, strategies={}",
        rules.jurisdiction(),
        assessment.eligible(),
        urgency,
        assessment.planStrategies().size());
    return assessment;
  }

  private List<String> planStrategies(EligibilityVerdict verdict) {
    List<String> strategies = new ArrayList<>();
    BigDecimal spendDown = verdict.excessResources();
    if (spendDown.signum() > 0) {
      strategies.add(
          "Convert countable assets to non-countable assets, e.g. home improvements or a"
              + " vehicle purchase");
      strategies.add("Pre-pay funeral expenses to reduce countable assets");
      if (spendDown.compareTo(GIFTING_CEILING) < 0) {
        strategies.add("Consider gifting strategies (beware of Medicaid look-back rules)");
      }
    }
    if (!verdict.isIncomeEligible()) {
      strategies.add("Consider establishing a Miller Trust to manage excess income");
    }
    if (verdict.maritalStatus() == MaritalStatus.MARRIED) {
      strategies.add("Explore spousal impoverishment protections available in your state");
    }
    return List.copyOf(strategies);
  }

  private static List<DivestmentOption> divestmentOptions(BigDecimal spendDown, RuleSet rules) {
    if (spendDown.signum() <= 0) {
      return List.of();
    }
    BigDecimal gift = spendDown.divide(BigDecimal.valueOf(2), 2, RoundingMode.HALF_UP);
    BigDecimal retained = spendDown.subtract(gift);
    BigDecimal penaltyMonths = gift.divide(rules.penaltyDivisor(), 2, RoundingMode.HALF_UP);

    var modern =
        new DivestmentOption(
            "Modern Half-a-Loaf",
            gift,
            retained,
            penaltyMonths,
            List.of(
                "Gift $" + gift.toPlainString() + " of the excess assets",
                "Use the remaining $"
                    + retained.toPlainString()
                    + " for a Medicaid-compliant annuity or promissory note",
                "Expect a penalty period of about " + penaltyMonths.toPlainString() + " months",
                "Use the annuity or note income to pay for care during the penalty period"));
    var reverse =
        new DivestmentOption(
            "Reverse Half-a-Loaf",
            null,
            null,
            null,
            List.of(
                "Gift the entire excess of $" + spendDown.toPlainString(),
                "Calculate the initial penalty period",
                "Have the recipient return part of the gift to shorten the penalty period",
                "Apply for Medicaid with the reduced penalty period"));
    return List.of(modern, reverse);
  }

  private static List<String> nextSteps(BigDecimal spendDown, RuleSet rules) {
    return List.of(
        "Complete detailed asset and income verification",
        spendDown.signum() > 0
            ? "Implement spend-down strategies if applicable"
            : "Prepare for Medicaid application",
        "Consult an elder law attorney for "
            + rules.jurisdiction().displayName()
            + "-specific guidance",
        "Gather necessary documentation for Medicaid application",
        "File Medicaid application and prepare for verification process",
        "Plan for post-eligibility follow-up and estate planning review");
  }

  private List<EligibilityWarning> warnings(EligibilityVerdict verdict) {
    List<EligibilityWarning> warnings = new ArrayList<>();
    if (verdict.countableAssets().compareTo(planningProperties.highAssetWarningThreshold()) > 0) {
      warnings.add(
          new EligibilityWarning(
              EligibilityWarning.HIGH_ASSETS,
              "Unusually high countable assets. Verify values and consider additional tax"
                  + " planning."));
    }
    if (verdict.totalMonthlyIncome().compareTo(planningProperties.highIncomeWarningThreshold())
        > 0) {
      warnings.add(
          new EligibilityWarning(
              EligibilityWarning.HIGH_INCOME,
              "Unusually high monthly income. Verify values and consider income management"
                  + " strategies."));
    }
    return List.copyOf(warnings);
  }
}
