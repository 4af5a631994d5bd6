package io.b2mash.medicaid.planning;

public enum PlanningStatus {
  SUCCESS("success"),
  ERROR("error");

  private final String value;

  PlanningStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
