package io.b2mash.medicaid.planning;

import io.b2mash.medicaid.classification.AssetClassification;
import io.b2mash.medicaid.classification.AssetClassificationService;
import io.b2mash.medicaid.config.PlanningProperties;
import io.b2mash.medicaid.eligibility.EligibilityAssessment;
import io.b2mash.medicaid.eligibility.EligibilityAssessor;
import io.b2mash.medicaid.eligibility.EligibilityPlanner;
import io.b2mash.medicaid.eligibility.EligibilityVerdict;
import io.b2mash.medicaid.eligibility.MaritalStatus;
import io.b2mash.medicaid.exception.InvalidHouseholdInputException;
import io.b2mash.medicaid.exception.RulesNotFoundException;
import io.b2mash.medicaid.household.ClientInfo;
import io.b2mash.medicaid.lookback.LookbackTransferAnalyzer;
import io.b2mash.medicaid.lookback.TransferRecord;
import io.b2mash.medicaid.penalty.PenaltyCalculator;
import io.b2mash.medicaid.planning.PlanningResult.ErrorCode;
import io.b2mash.medicaid.rules.JurisdictionResolver;
import io.b2mash.medicaid.rules.RuleSet;
import io.b2mash.medicaid.rules.RulesProvider;
import io.b2mash.medicaid.strategy.MitigationStrategyEngine;
import io.b2mash.medicaid.validation.HouseholdInputValidator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the planning engine. Validates household input, resolves the jurisdiction once,
 * fetches the applicable rule set and runs classification, lookback analysis, penalty calculation,
 * eligibility assessment and strategy development for one request.
 *
 * <p>{@link #planDivestment} never throws: every failure is returned as an error envelope. The
 * eligibility operations fail fast with {@link InvalidHouseholdInputException} or {@link
 * RulesNotFoundException}.
 */
@Service
public class PlanningCoordinator {

  private static final Logger log = LoggerFactory.getLogger(PlanningCoordinator.class);

  private final HouseholdInputValidator inputValidator;
  private final JurisdictionResolver jurisdictionResolver;
  private final RulesProvider rulesProvider;
  private final AssetClassificationService classificationService;
  private final LookbackTransferAnalyzer transferAnalyzer;
  private final PenaltyCalculator penaltyCalculator;
  private final EligibilityAssessor eligibilityAssessor;
  private final EligibilityPlanner eligibilityPlanner;
  private final MitigationStrategyEngine strategyEngine;
  private final PlanningSummaryWriter summaryWriter;
  private final PlanningProperties planningProperties;
  private final Clock clock;

  public PlanningCoordinator(
      HouseholdInputValidator inputValidator,
      JurisdictionResolver jurisdictionResolver,
      RulesProvider rulesProvider,
      AssetClassificationService classificationService,
      LookbackTransferAnalyzer transferAnalyzer,
      PenaltyCalculator penaltyCalculator,
      EligibilityAssessor eligibilityAssessor,
      EligibilityPlanner eligibilityPlanner,
      MitigationStrategyEngine strategyEngine,
      PlanningSummaryWriter summaryWriter,
      PlanningProperties planningProperties,
      Clock clock) {
    this.inputValidator = inputValidator;
    this.jurisdictionResolver = jurisdictionResolver;
    this.rulesProvider = rulesProvider;
    this.classificationService = classificationService;
    this.transferAnalyzer = transferAnalyzer;
    this.penaltyCalculator = penaltyCalculator;
    this.eligibilityAssessor = eligibilityAssessor;
    this.eligibilityPlanner = eligibilityPlanner;
    this.strategyEngine = strategyEngine;
    this.summaryWriter = summaryWriter;
    this.planningProperties = planningProperties;
    this.clock = clock;
  }

  /**
   * Plans around prior asset transfers for one household.
   *
   * @param clientInfo applicant demographics and household context
   * @param assets declared assets keyed by asset type
   * @param income monthly income keyed by source
   * @param transfers transfer history, possibly empty
   * @param jurisdiction state name or postal abbreviation
   * @return a success envelope with every component result, or an error envelope
   */
  public PlanningResult planDivestment(
      ClientInfo clientInfo,
      Map<String, BigDecimal> assets,
      Map<String, BigDecimal> income,
      List<TransferRecord> transfers,
      String jurisdiction) {
    try {
      LocalDate now = LocalDate.now(clock);
      Household household = prepare(clientInfo, assets, income, jurisdiction, now);
      RuleSet rules = household.rules();
      List<TransferRecord> history = transfers != null ? transfers : List.of();
      log.info(
          "Starting divestment planning: jurisdiction={}, year={}, transfers={}",
          rules.jurisdiction(),
          rules.year(),
          history.size());

      var analysis = transferAnalyzer.analyze(history, rules, now);
      var penalty = penaltyCalculator.calculatePenalty(analysis, rules, now);
      var strategies =
          strategyEngine.developStrategies(
              analysis, penalty, household.verdict(), clientInfo.householdContext());
      String summary =
          summaryWriter.write(
              clientInfo, rules, analysis, penalty, household.verdict(), strategies);

      log.info(
          "Divestment planning completed: jurisdiction={}, penaltyDays={}, strategies={},"
              + " documentationRisk={}",
          rules.jurisdiction(),
          penalty.penaltyDays(),
          strategies.size(),
          analysis.documentationRisk());
      return PlanningResult.success(
          rules.jurisdiction().key(),
          now,
          analysis,
          penalty,
          household.verdict(),
          strategies,
          summary);
    } catch (InvalidHouseholdInputException e) {
      log.warn("Divestment planning rejected input: {}", e.getBody().getDetail());
      return PlanningResult.error(e.getBody().getDetail(), ErrorCode.VALIDATION_FAILED);
    } catch (RulesNotFoundException e) {
      log.warn("Divestment planning failed: {}", e.getBody().getDetail());
      return PlanningResult.error(e.getBody().getDetail(), ErrorCode.RULES_NOT_FOUND);
    } catch (RuntimeException e) {
      log.error("Unexpected error in divestment planning", e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return PlanningResult.error("Divestment planning error: " + message, ErrorCode.UNEXPECTED);
    }
  }

  /**
   * Assesses resource and income eligibility.
   *
   * @throws InvalidHouseholdInputException if the household input is invalid
   * @throws RulesNotFoundException if no rules exist for the jurisdiction and rules year
   */
  public EligibilityVerdict assessEligibility(
      ClientInfo clientInfo,
      Map<String, BigDecimal> assets,
      Map<String, BigDecimal> income,
      String jurisdiction) {
    return prepare(clientInfo, assets, income, jurisdiction, LocalDate.now(clock)).verdict();
  }

  /**
   * Assesses eligibility and attaches spend-down strategies, gifting options, urgency, next steps
   * and verification warnings.
   *
   * @throws InvalidHouseholdInputException if the household input is invalid
   * @throws RulesNotFoundException if no rules exist for the jurisdiction and rules year
   */
  public EligibilityAssessment assessEligibilityWithPlan(
      ClientInfo clientInfo,
      Map<String, BigDecimal> assets,
      Map<String, BigDecimal> income,
      String jurisdiction) {
    Household household =
        prepare(clientInfo, assets, income, jurisdiction, LocalDate.now(clock));
    var assessment = eligibilityPlanner.plan(household.verdict(), household.rules(), clientInfo);
    log.info(
        "Eligibility assessment completed: jurisdiction={}, eligible={}, urgency={}",
        household.rules().jurisdiction(),
        assessment.eligible(),
        assessment.urgency());
    return assessment;
  }

  private Household prepare(
      ClientInfo clientInfo,
      Map<String, BigDecimal> assets,
      Map<String, BigDecimal> income,
      String jurisdiction,
      LocalDate now) {
    inputValidator.validate(clientInfo, assets);
    var resolved = jurisdictionResolver.resolve(jurisdiction);
    var maritalStatus = MaritalStatus.from(clientInfo.maritalStatus());
    // a pinned rules year is exact; otherwise the newest rules in force for the planning year
    RuleSet rules =
        planningProperties.rulesYear() != null
            ? rulesProvider.getRules(resolved, planningProperties.rulesYear())
            : rulesProvider.getLatestRules(resolved, now.getYear());

    AssetClassification classified = classificationService.classifyAssets(assets);
    BigDecimal totalIncome = classificationService.totalIncome(income);
    var verdict = eligibilityAssessor.assess(classified, totalIncome, rules, maritalStatus);
    return new Household(rules, verdict);
  }

  private record Household(RuleSet rules, EligibilityVerdict verdict) {}
}
