package io.b2mash.medicaid.strategy;

import io.b2mash.medicaid.eligibility.EligibilityVerdict;
import io.b2mash.medicaid.household.FamilyMember;
import io.b2mash.medicaid.household.HouseholdContext;
import io.b2mash.medicaid.lookback.DocumentationIssue;
import io.b2mash.medicaid.lookback.DocumentationIssue.IssueType;
import io.b2mash.medicaid.lookback.TransferAnalysis;
import io.b2mash.medicaid.lookback.TransferRecord;
import io.b2mash.medicaid.penalty.PenaltyResult;
import io.b2mash.medicaid.support.Money;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a transfer analysis, penalty and household context into a prioritized list of mitigation
 * strategies. Rules are evaluated independently, so one request can produce several strategies;
 * the only exception is the no-penalty case, which yields a single strategy. Output is ordered by
 * descending priority, keeping rule order for equal priorities, and is deduplicated by id.
 */
@Service
public class MitigationStrategyEngine {

  private static final Logger log = LoggerFactory.getLogger(MitigationStrategyEngine.class);

  static final BigDecimal PLAN_THROUGH_MAX_MONTHS = BigDecimal.valueOf(6);

  static final String NO_MITIGATION_ID = "no-mitigation-needed";
  static final String ASSET_RETURN_ID = "asset-return";
  static final String PLAN_THROUGH_ID = "plan-through-penalty";
  static final String DOCUMENTATION_ID = "improve-documentation";
  static final String CAREGIVER_RECLASSIFICATION_ID = "caregiver-exemption-reclassification";
  static final String FAMILY_CAREGIVER_ID_PREFIX = "family-caregiver-";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
  private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");
  static final String HARDSHIP_WAIVER_ID = "hardship-waiver";

  public List<Strategy> developStrategies(
      TransferAnalysis analysis,
      PenaltyResult penalty,
      EligibilityVerdict eligibility,
      HouseholdContext household) {
    if (!penalty.hasPenalty()) {
      return List.of(noMitigationNeeded(analysis));
    }

    HouseholdContext context = household != null ? household : HouseholdContext.empty();
    Map<String, Strategy> strategies = new LinkedHashMap<>();

    if (penalty.penaltyMonths().compareTo(PLAN_THROUGH_MAX_MONTHS) > 0) {
      add(strategies, assetReturn(penalty, eligibility));
    } else {
      add(strategies, planThroughPenalty(penalty));
    }

    if (analysis.hasDocumentationIssues()) {
      add(strategies, improveDocumentation(analysis));
    }

    List<TransferRecord> familyCareTransfers =
        analysis.transfersInWindow().stream().filter(TransferRecord::showsFamilyCare).toList();
    if (!familyCareTransfers.isEmpty()) {
      add(strategies, caregiverReclassification(familyCareTransfers));
    }

    addFamilyCaregivers(strategies, context.caregivers());

    if (context.hasSevereMedicalCondition()) {
      add(strategies, hardshipWaiver(penalty, context));
    }

    List<Strategy> ordered = new ArrayList<>(strategies.values());
    ordered.sort(Comparator.comparing(Strategy::priority).reversed());
    log.debug(
        "Developed {} strategies: ids={}",
        ordered.size(),
        ordered.stream().map(Strategy::id).toList());
    return List.copyOf(ordered);
  }

  private static void add(Map<String, Strategy> strategies, Strategy strategy) {
    strategies.putIfAbsent(strategy.id(), strategy);
  }

  /**
   * One strategy per distinct caregiver name, compared case and whitespace insensitively. Ids come
   * from the name's letters and digits in any script; a name with none, or whose id is already
   * taken by a differently written name, gets the caregiver's ordinal appended instead.
   */
  private static void addFamilyCaregivers(
      Map<String, Strategy> strategies, List<FamilyMember> caregivers) {
    Set<String> seenNames = new HashSet<>();
    int ordinal = 0;
    for (FamilyMember caregiver : caregivers) {
      String normalized = WHITESPACE.matcher(caregiver.name().trim()).replaceAll(" ");
      if (!seenNames.add(normalized.toLowerCase(Locale.ROOT))) {
        continue;
      }
      ordinal++;
      String slug = slug(caregiver.name());
      String id =
          slug.isEmpty() ? FAMILY_CAREGIVER_ID_PREFIX + ordinal : FAMILY_CAREGIVER_ID_PREFIX + slug;
      if (strategies.containsKey(id)) {
        id = id + "-" + ordinal;
      }
      add(strategies, familyCaregiver(caregiver, id));
    }
  }

  private static Strategy noMitigationNeeded(TransferAnalysis analysis) {
    return new Strategy(
        NO_MITIGATION_ID,
        StrategyCategory.NO_PENALTY,
        "No transfer penalty applies. No divestment mitigation is needed.",
        List.of(
            "The application can proceed without a penalty period",
            "No funds need to be recovered from recipients"),
        List.of(
            "The caseworker may still ask about transfers, so records must stay available",
            "New transfers before the application could still create a penalty"),
        StrategyRating.HIGH,
        StrategyRating.LOW,
        StrategyRating.LOW,
        "No penalty period",
        List.of(
            "Keep records for every transfer since " + analysis.lookbackStart(),
            "Avoid new uncompensated transfers before the application is approved",
            "Proceed with the Medicaid application"));
  }

  private static Strategy assetReturn(PenaltyResult penalty, EligibilityVerdict eligibility) {
    BigDecimal fullReturn = penalty.estimatedCost();
    BigDecimal returnToSixMonths =
        fullReturn.subtract(penalty.penaltyDivisor().multiply(PLAN_THROUGH_MAX_MONTHS));
    return new Strategy(
        ASSET_RETURN_ID,
        StrategyCategory.ASSET_RETURN,
        "Ask recipients to return transferred funds to shrink or eliminate the "
            + Money.months(penalty.penaltyMonths())
            + "-month penalty period.",
        List.of(
            "A full return of " + Money.format(fullReturn) + " eliminates the penalty",
            "Partial returns shorten the penalty month for month",
            "Recognized by Medicaid agencies as a cure for improper transfers"),
        List.of(
            "Recipients may no longer have the funds or may be unwilling to return them",
            "Returned funds count toward the "
                + Money.format(eligibility.resourceLimit())
                + " resource limit and must be spent down",
            "Some agencies only accept returns made before the application is filed"),
        StrategyRating.HIGH,
        StrategyRating.HIGH,
        StrategyRating.HIGH,
        "Up to " + penalty.penaltyDays() + " days of ineligibility avoided",
        List.of(
            "Return " + Money.format(fullReturn) + " to eliminate the penalty entirely",
            "Return " + Money.format(returnToSixMonths) + " to reduce the penalty to 6 months",
            "Document each return with bank records and a signed statement from the recipient",
            "Recalculate the penalty once returns are complete"));
  }

  private static Strategy planThroughPenalty(PenaltyResult penalty) {
    return new Strategy(
        PLAN_THROUGH_ID,
        StrategyCategory.PENALTY_PLANNING,
        "Private-pay for care through the "
            + Money.months(penalty.penaltyMonths())
            + "-month penalty period ending "
            + penalty.penaltyEndDate()
            + ".",
        List.of(
            "Transfers already made stay with their recipients",
            "The penalty is short enough to bridge with private funds"),
        List.of(
            "Requires about " + Money.format(penalty.estimatedCost()) + " to pay for care",
            "The penalty only starts once the applicant is otherwise eligible"),
        StrategyRating.MEDIUM,
        StrategyRating.MEDIUM,
        StrategyRating.MEDIUM,
        "Private-pay cost of about " + Money.format(penalty.estimatedCost()),
        List.of(
            "Budget "
                + Money.format(penalty.estimatedCost())
                + " for care until "
                + penalty.penaltyEndDate(),
            "File the Medicaid application so the penalty period starts running",
            "Consider a Medicaid-compliant annuity or promissory note to fund the penalty"
                + " period"));
  }

  private static Strategy improveDocumentation(TransferAnalysis analysis) {
    long missingDocs = countIssues(analysis, IssueType.MISSING_DOCUMENTATION);
    long invalidDates = countIssues(analysis, IssueType.INVALID_DATE);
    long invalidAmounts = countIssues(analysis, IssueType.INVALID_AMOUNT);

    List<String> actions = new ArrayList<>();
    if (missingDocs > 0) {
      actions.add(
          "Gather receipts, bank statements or agreements for "
              + missingDocs
              + " undocumented transfer(s)");
    }
    if (invalidDates > 0) {
      actions.add("Confirm the dates of " + invalidDates + " transfer(s) with unreadable dates");
    }
    if (invalidAmounts > 0) {
      actions.add("Confirm the amounts of " + invalidAmounts + " transfer(s)");
    }
    actions.add("Re-run the lookback analysis once the records are corrected");

    return new Strategy(
        DOCUMENTATION_ID,
        StrategyCategory.DOCUMENTATION,
        "Resolve "
            + analysis.documentationIssues().size()
            + " documentation issue(s) in the transfer history.",
        List.of(
            "Documented transfers can be shown to be fair-value or exempt",
            "Prevents the agency from treating unexplained transfers as gifts"),
        List.of(
            "Older records can be hard or impossible to obtain",
            "Corrected dates may move transfers into the lookback window"),
        StrategyRating.MEDIUM,
        StrategyRating.HIGH,
        StrategyRating.MEDIUM,
        "Lowers documentation risk from " + analysis.documentationRisk(),
        actions);
  }

  private static long countIssues(TransferAnalysis analysis, IssueType type) {
    return analysis.documentationIssues().stream()
        .map(DocumentationIssue::type)
        .filter(type::equals)
        .count();
  }

  private static Strategy caregiverReclassification(List<TransferRecord> transfers) {
    BigDecimal total =
        transfers.stream().map(TransferRecord::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    List<String> recipients =
        transfers.stream().map(TransferRecord::recipient).distinct().toList();
    return new Strategy(
        CAREGIVER_RECLASSIFICATION_ID,
        StrategyCategory.CAREGIVER_EXEMPTION,
        "Reclassify "
            + transfers.size()
            + " transfer(s) totaling "
            + Money.format(total)
            + " to "
            + String.join(", ", recipients)
            + " as compensation for family caregiving.",
        List.of(
            "Payment for care actually provided is a fair-value transfer",
            "Removes the reclassified amounts from any penalty calculation"),
        List.of(
            "Agencies presume family care is free unless a written agreement existed",
            "Caregiver compensation is taxable income to the recipient"),
        StrategyRating.HIGH,
        StrategyRating.MEDIUM,
        StrategyRating.MEDIUM,
        Money.format(total) + " treated as fair-value compensation",
        List.of(
            "Prepare or locate the written personal care agreement",
            "Compile care logs showing hours per week and years of care",
            "Obtain a physician statement that the care was medically necessary",
            "Confirm the payment rate matches local home-care rates"));
  }

  private static Strategy familyCaregiver(FamilyMember caregiver, String id) {
    String relationship =
        caregiver.relationship() != null && !caregiver.relationship().isBlank()
            ? " (" + caregiver.relationship().trim() + ")"
            : "";
    return new Strategy(
        id,
        StrategyCategory.CAREGIVER_EXEMPTION,
        "Formalize "
            + caregiver.name()
            + relationship
            + " as a paid family caregiver under a personal care agreement.",
        List.of(
            "Future payments to " + caregiver.name() + " are fair-value, not gifts",
            "Keeps care within the family"),
        List.of(
            "Payments made before a written agreement are usually treated as gifts",
            "Payments are taxable income to " + caregiver.name()),
        StrategyRating.MEDIUM,
        StrategyRating.MEDIUM,
        StrategyRating.MEDIUM,
        "Converts ongoing family support into exempt compensation",
        List.of(
            "Draft a personal care agreement with " + caregiver.name(),
            "Set a rate consistent with local home-care costs",
            "Keep weekly care logs and pay by traceable transfers"));
  }

  private static Strategy hardshipWaiver(PenaltyResult penalty, HouseholdContext household) {
    List<String> conditions = household.severeDiagnoses();
    String basis =
        conditions.isEmpty()
            ? "the applicant's critical health status"
            : String.join(", ", conditions);
    return new Strategy(
        HARDSHIP_WAIVER_ID,
        StrategyCategory.HARDSHIP_WAIVER,
        "Request an undue hardship waiver of the penalty period based on " + basis + ".",
        List.of(
            "Can waive the entire " + penalty.penaltyDays() + "-day penalty",
            "Does not require recipients to return funds"),
        List.of(
            "Waivers are discretionary and rarely granted",
            "Requires proof that the applicant would be deprived of care, food or shelter"),
        StrategyRating.MEDIUM,
        StrategyRating.HIGH,
        StrategyRating.HIGH,
        "Up to " + Money.format(penalty.estimatedCost()) + " of penalty exposure waived",
        List.of(
            "Obtain physician documentation of the diagnosis and prognosis",
            "Document that the transferred funds cannot be recovered",
            "File the hardship request together with the Medicaid application"));
  }

  private static String slug(String name) {
    String slug = NON_ALPHANUMERIC.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
    return EDGE_DASHES.matcher(slug).replaceAll("");
  }
}
