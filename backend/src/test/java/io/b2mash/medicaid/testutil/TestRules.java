package io.b2mash.medicaid.testutil;

import io.b2mash.medicaid.rules.Jurisdiction;
import io.b2mash.medicaid.rules.RuleSet;
import java.math.BigDecimal;
import java.util.Set;

/** Rule set fixtures shared by unit tests. */
public final class TestRules {

  public static final Jurisdiction FLORIDA = new Jurisdiction("florida");

  private TestRules() {}

  /** Florida-like rules with a 60-month lookback, 18,000 exclusion and 9,901 divisor. */
  public static RuleSet florida() {
    return ruleSet(60, new BigDecimal("18000"), new BigDecimal("9901"));
  }

  public static RuleSet ruleSet(int lookbackMonths, BigDecimal giftExclusion, BigDecimal divisor) {
    return new RuleSet(
        FLORIDA,
        2025,
        new BigDecimal("2000"),
        new BigDecimal("3000"),
        new BigDecimal("2901"),
        new BigDecimal("5802"),
        lookbackMonths,
        giftExclusion,
        divisor,
        Set.of("caregiver compensation", "transfer to spouse", "disabled child"));
  }
}
