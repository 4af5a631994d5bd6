package io.b2mash.medicaid.eligibility;

import java.math.BigDecimal;
import java.util.List;

/**
 * Eligibility verdict with the planning guidance built around it.
 *
 * @param verdict resource and income verdict
 * @param eligible both resource and income eligible
 * @param spendDownAmount countable assets that must be spent down to meet the resource limit
 * @param urgency how soon the household should act
 * @param planStrategies general spend-down and income strategies
 * @param divestmentOptions gifting approaches for the excess resources
 * @param nextSteps ordered next steps toward an application
 * @param warnings advisories about unusual figures
 */
public record EligibilityAssessment(
    EligibilityVerdict verdict,
    boolean eligible,
    BigDecimal spendDownAmount,
    Urgency urgency,
    List<String> planStrategies,
    List<DivestmentOption> divestmentOptions,
    List<String> nextSteps,
    List<EligibilityWarning> warnings) {}
