package io.b2mash.medicaid.eligibility;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.medicaid.classification.AssetClassification;
import io.b2mash.medicaid.exception.InvalidHouseholdInputException;
import io.b2mash.medicaid.testutil.TestRules;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class EligibilityAssessorTest {

  private final EligibilityAssessor assessor = new EligibilityAssessor();

  @Test
  void assess_treatsLimitsAsInclusive() {
    var verdict =
        assessor.assess(
            assets("2000", "150000"),
            new BigDecimal("2901"),
            TestRules.florida(),
            MaritalStatus.SINGLE);

    assertThat(verdict.isResourceEligible()).isTrue();
    assertThat(verdict.isIncomeEligible()).isTrue();
    assertThat(verdict.isEligible()).isTrue();
    assertThat(verdict.excessResources()).isEqualByComparingTo("0");
    assertThat(verdict.nonCountableAssets()).isEqualByComparingTo("150000");
  }

  @Test
  void assess_reportsExcessAboveSingleLimits() {
    var verdict =
        assessor.assess(
            assets("2000.01", "0"),
            new BigDecimal("3100"),
            TestRules.florida(),
            MaritalStatus.SINGLE);

    assertThat(verdict.isResourceEligible()).isFalse();
    assertThat(verdict.excessResources()).isEqualByComparingTo("0.01");
    assertThat(verdict.isIncomeEligible()).isFalse();
    assertThat(verdict.excessIncome()).isEqualByComparingTo("199");
    assertThat(verdict.isEligible()).isFalse();
  }

  @Test
  void assess_usesMarriedLimitsForMarriedApplicant() {
    var verdict =
        assessor.assess(
            assets("2800", "0"),
            new BigDecimal("4000"),
            TestRules.florida(),
            MaritalStatus.MARRIED);

    assertThat(verdict.resourceLimit()).isEqualByComparingTo("3000");
    assertThat(verdict.incomeLimit()).isEqualByComparingTo("5802");
    assertThat(verdict.isEligible()).isTrue();
    assertThat(verdict.maritalStatus()).isEqualTo(MaritalStatus.MARRIED);
  }

  @Test
  void maritalStatus_parsesCaseInsensitively() {
    assertThat(MaritalStatus.from(" Married ")).isEqualTo(MaritalStatus.MARRIED);
    assertThat(MaritalStatus.from("SINGLE")).isEqualTo(MaritalStatus.SINGLE);
  }

  @Test
  void maritalStatus_rejectsUnsupportedValues() {
    assertThatThrownBy(() -> MaritalStatus.from("divorced"))
        .isInstanceOf(InvalidHouseholdInputException.class)
        .hasMessageContaining("divorced");
    assertThatThrownBy(() -> MaritalStatus.from(null))
        .isInstanceOf(InvalidHouseholdInputException.class);
  }

  private static AssetClassification assets(String countable, String nonCountable) {
    return new AssetClassification(new BigDecimal(countable), new BigDecimal(nonCountable));
  }
}
