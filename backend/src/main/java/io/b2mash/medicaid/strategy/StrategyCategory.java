package io.b2mash.medicaid.strategy;

public enum StrategyCategory {
  ASSET_RETURN("asset-return"),
  PENALTY_PLANNING("penalty-planning"),
  DOCUMENTATION("documentation"),
  CAREGIVER_EXEMPTION("caregiver-exemption"),
  HARDSHIP_WAIVER("hardship-waiver"),
  NO_PENALTY("no-penalty");

  private final String tag;

  StrategyCategory(String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }
}
