package io.b2mash.medicaid.config;

import java.math.BigDecimal;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for eligibility and divestment planning.
 *
 * @param rulesYear rules year to plan against; the calendar year of the planning date when unset
 * @param nonCountableAssetCategories normalized asset keys excluded from countable resources
 * @param highAssetWarningThreshold countable assets above which a verification warning is raised
 * @param highIncomeWarningThreshold monthly income above which a verification warning is raised
 */
@ConfigurationProperties(prefix = "medicaid.planning")
public record PlanningProperties(
    Integer rulesYear,
    List<String> nonCountableAssetCategories,
    BigDecimal highAssetWarningThreshold,
    BigDecimal highIncomeWarningThreshold) {

  public static final List<String> DEFAULT_NON_COUNTABLE_ASSET_CATEGORIES =
      List.of(
          "home",
          "primary_residence",
          "burial_funds",
          "burial_plots",
          "pre_paid_funeral",
          "funeral_plan",
          "life_insurance_exempt",
          "automobile_primary",
          "personal_effects");

  public PlanningProperties {
    if (nonCountableAssetCategories == null || nonCountableAssetCategories.isEmpty()) {
      nonCountableAssetCategories = DEFAULT_NON_COUNTABLE_ASSET_CATEGORIES;
    } else {
      nonCountableAssetCategories = List.copyOf(nonCountableAssetCategories);
    }
    if (highAssetWarningThreshold == null) {
      highAssetWarningThreshold = new BigDecimal("1000000");
    }
    if (highIncomeWarningThreshold == null) {
      highIncomeWarningThreshold = new BigDecimal("10000");
    }
  }

  /** Properties with every default applied. */
  public static PlanningProperties defaults() {
    return new PlanningProperties(null, null, null, null);
  }
}
