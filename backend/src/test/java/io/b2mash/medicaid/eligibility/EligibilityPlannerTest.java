package io.b2mash.medicaid.eligibility;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.medicaid.classification.AssetClassification;
import io.b2mash.medicaid.config.PlanningProperties;
import io.b2mash.medicaid.household.ClientInfo;
import io.b2mash.medicaid.testutil.TestRules;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class EligibilityPlannerTest {

  private final EligibilityAssessor assessor = new EligibilityAssessor();
  private final EligibilityPlanner planner = new EligibilityPlanner(PlanningProperties.defaults());

  @Test
  void plan_offersSpendDownAndHalfALoafForExcessResources() {
    // 42,000 countable against a 2,000 limit leaves 40,000 to spend down
    var verdict = verdict("42000", "1500", MaritalStatus.SINGLE);

    var assessment =
        planner.plan(verdict, TestRules.florida(), client("single", 78, "fair", false));

    assertThat(assessment.eligible()).isFalse();
    assertThat(assessment.spendDownAmount()).isEqualByComparingTo("40000");
    assertThat(assessment.urgency()).isEqualTo(Urgency.MEDIUM);
    assertThat(assessment.planStrategies())
        .anyMatch(s -> s.startsWith("Convert countable assets"))
        .anyMatch(s -> s.startsWith("Consider gifting strategies"));
    assertThat(assessment.divestmentOptions()).hasSize(2);

    var modern = assessment.divestmentOptions().get(0);
    assertThat(modern.name()).isEqualTo("Modern Half-a-Loaf");
    assertThat(modern.giftAmount()).isEqualByComparingTo("20000");
    assertThat(modern.retainedAmount()).isEqualByComparingTo("20000");
    assertThat(modern.estimatedPenaltyMonths()).isEqualByComparingTo("2.02");
    assertThat(assessment.divestmentOptions().get(1).name()).isEqualTo("Reverse Half-a-Loaf");
  }

  @Test
  void plan_skipsGiftingAdviceForLargeSpendDown() {
    var verdict = verdict("102000", "1500", MaritalStatus.SINGLE);

    var assessment =
        planner.plan(verdict, TestRules.florida(), client("single", 70, "good", false));

    assertThat(assessment.planStrategies()).noneMatch(s -> s.contains("gifting"));
  }

  @Test
  void plan_suggestsMillerTrustAndSpousalProtections() {
    var verdict = verdict("1000", "6000", MaritalStatus.MARRIED);

    var assessment =
        planner.plan(verdict, TestRules.florida(), client("married", 82, "good", false));

    assertThat(assessment.urgency()).isEqualTo(Urgency.HIGH);
    assertThat(assessment.divestmentOptions()).isEmpty();
    assertThat(assessment.planStrategies())
        .containsExactly(
            "Consider establishing a Miller Trust to manage excess income",
            "Explore spousal impoverishment protections available in your state");
  }

  @Test
  void plan_namesJurisdictionInNextSteps() {
    var verdict = verdict("1000", "1000", MaritalStatus.SINGLE);

    var assessment =
        planner.plan(verdict, TestRules.florida(), client("single", 60, "good", false));

    assertThat(assessment.eligible()).isTrue();
    assertThat(assessment.nextSteps())
        .hasSize(6)
        .contains("Prepare for Medicaid application")
        .anyMatch(s -> s.contains("Florida-specific guidance"));
    assertThat(assessment.warnings()).isEmpty();
  }

  @Test
  void plan_warnsAboutUnusualFigures() {
    var verdict = verdict("2500000", "15000", MaritalStatus.SINGLE);

    var assessment =
        planner.plan(verdict, TestRules.florida(), client("single", 60, "good", false));

    assertThat(assessment.warnings())
        .extracting(EligibilityWarning::type)
        .containsExactly(EligibilityWarning.HIGH_ASSETS, EligibilityWarning.HIGH_INCOME);
  }

  private EligibilityVerdict verdict(String countable, String income, MaritalStatus status) {
    return assessor.assess(
        new AssetClassification(new BigDecimal(countable), BigDecimal.ZERO),
        new BigDecimal(income),
        TestRules.florida(),
        status);
  }

  private static ClientInfo client(String maritalStatus, int age, String health, boolean crisis) {
    return new ClientInfo("Test Client", age, maritalStatus, health, crisis, null, null);
  }
}
