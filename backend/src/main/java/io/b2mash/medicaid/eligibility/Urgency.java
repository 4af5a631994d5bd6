package io.b2mash.medicaid.eligibility;

/** How soon the household should act on Medicaid planning. */
public enum Urgency {
  HIGH("Immediate crisis planning required"),
  MEDIUM("Begin pre-planning soon"),
  LOW("Good candidate for long-term pre-planning");

  private final String description;

  Urgency(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Determines urgency from the applicant's situation.
   *
   * @param age applicant age, or null if unknown
   * @param healthStatus good, fair, declining or critical; null if unknown
   * @param crisis whether the family is already in a care crisis
   * @return HIGH for a crisis, critical health or age 80+; MEDIUM for age 70+ or declining health;
   *     LOW otherwise
   */
  public static Urgency determine(Integer age, String healthStatus, boolean crisis) {
    String health = healthStatus != null ? healthStatus.trim().toLowerCase() : "";
    if (crisis || health.equals("critical") || (age != null && age >= 80)) {
      return HIGH;
    }
    if ((age != null && age >= 70) || health.equals("declining")) {
      return MEDIUM;
    }
    return LOW;
  }
}
