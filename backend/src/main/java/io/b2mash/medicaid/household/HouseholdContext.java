package io.b2mash.medicaid.household;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Household facts the strategy engine looks at beyond the numbers: who provides care and how
 * severe the applicant's medical situation is.
 */
public record HouseholdContext(
    List<FamilyMember> familyMembers, List<String> diagnoses, String healthStatus) {

  private static final Pattern SEVERE_DIAGNOSIS =
      Pattern.compile(
          "\\b(terminal|hospice|end[- ]stage|stage (iv|4)|metastatic|severe|advanced dementia"
              + "|late[- ]stage|als|amyotrophic)\\b",
          Pattern.CASE_INSENSITIVE);

  public HouseholdContext {
    familyMembers = familyMembers != null ? List.copyOf(familyMembers) : List.of();
    diagnoses = diagnoses != null ? List.copyOf(diagnoses) : List.of();
  }

  public static HouseholdContext empty() {
    return new HouseholdContext(List.of(), List.of(), null);
  }

  public List<FamilyMember> caregivers() {
    return familyMembers.stream()
        .filter(m -> m.name() != null && !m.name().isBlank())
        .filter(FamilyMember::isCaregiver)
        .toList();
  }

  /** Diagnoses that describe a terminal or severe condition. */
  public List<String> severeDiagnoses() {
    return diagnoses.stream()
        .filter(d -> d != null && SEVERE_DIAGNOSIS.matcher(d).find())
        .toList();
  }

  public boolean hasSevereMedicalCondition() {
    return !severeDiagnoses().isEmpty()
        || (healthStatus != null && healthStatus.trim().equalsIgnoreCase("critical"));
  }
}
