package io.b2mash.medicaid.eligibility;

/** Advisory raised when reported figures look unusual and should be verified. */
public record EligibilityWarning(String type, String message) {

  public static final String HIGH_ASSETS = "high_assets";
  public static final String HIGH_INCOME = "high_income";
}
