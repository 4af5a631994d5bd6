package io.b2mash.medicaid.household;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Demographics and household context of the applicant.
 *
 * @param name applicant name, used in summaries only
 * @param age applicant age in years
 * @param maritalStatus "single" or "married", case-insensitive
 * @param healthStatus one of good, fair, declining, critical; optional
 * @param crisis whether the family is already in a care crisis
 * @param familyMembers relatives involved in the applicant's care
 * @param diagnoses medical diagnoses as free text
 */
public record ClientInfo(
    @Size(max = 200) String name,
    @PositiveOrZero(message = "Age must be a positive number") @Max(150) Integer age,
    @NotBlank(message = "Marital status is required")
        @Pattern(
            regexp = "(?i)\\s*(single|married)\\s*",
            message = "Marital status must be one of: single, married")
        String maritalStatus,
    @Pattern(
            regexp = "(?i)\\s*(good|fair|declining|critical)\\s*",
            message = "Health status must be one of: good, fair, declining, critical")
        String healthStatus,
    boolean crisis,
    List<@Valid FamilyMember> familyMembers,
    List<String> diagnoses) {

  public ClientInfo {
    familyMembers = familyMembers != null ? List.copyOf(familyMembers) : List.of();
    diagnoses = diagnoses != null ? List.copyOf(diagnoses) : List.of();
  }

  /** Household context handed to the strategy engine. */
  public HouseholdContext householdContext() {
    return new HouseholdContext(familyMembers, diagnoses, healthStatus);
  }
}
