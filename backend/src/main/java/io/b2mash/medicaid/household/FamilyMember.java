package io.b2mash.medicaid.household;

import jakarta.validation.constraints.NotBlank;

/**
 * A relative of the applicant.
 *
 * @param name the relative's name
 * @param relationship relationship to the applicant, e.g. "daughter"
 * @param providesCare whether this person acts as the applicant's caregiver
 */
public record FamilyMember(
    @NotBlank(message = "Family member name is required") String name,
    String relationship,
    boolean providesCare) {

  /** True when the person is marked as a caregiver or the relationship names one. */
  public boolean isCaregiver() {
    return providesCare
        || (relationship != null && relationship.toLowerCase().contains("caregiver"));
  }
}
