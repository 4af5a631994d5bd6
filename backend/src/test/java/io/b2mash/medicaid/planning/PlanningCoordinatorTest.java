package io.b2mash.medicaid.planning;

import static io.b2mash.medicaid.testutil.TestTransfers.gift;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.medicaid.classification.AssetClassificationService;
import io.b2mash.medicaid.config.PlanningProperties;
import io.b2mash.medicaid.eligibility.EligibilityAssessor;
import io.b2mash.medicaid.eligibility.EligibilityPlanner;
import io.b2mash.medicaid.eligibility.Urgency;
import io.b2mash.medicaid.exception.InvalidHouseholdInputException;
import io.b2mash.medicaid.exception.RulesNotFoundException;
import io.b2mash.medicaid.household.ClientInfo;
import io.b2mash.medicaid.lookback.LookbackTransferAnalyzer;
import io.b2mash.medicaid.penalty.PenaltyCalculator;
import io.b2mash.medicaid.planning.PlanningResult.ErrorCode;
import io.b2mash.medicaid.rules.ClasspathRulesProvider;
import io.b2mash.medicaid.rules.Jurisdiction;
import io.b2mash.medicaid.rules.JurisdictionResolver;
import io.b2mash.medicaid.rules.RuleSet;
import io.b2mash.medicaid.rules.RulesKey;
import io.b2mash.medicaid.rules.RulesProvider;
import io.b2mash.medicaid.strategy.MitigationStrategyEngine;
import io.b2mash.medicaid.strategy.Strategy;
import io.b2mash.medicaid.testutil.TestRules;
import io.b2mash.medicaid.validation.HouseholdInputValidator;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import tools.jackson.databind.json.JsonMapper;

class PlanningCoordinatorTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
  private static final ClientInfo CLIENT =
      new ClientInfo("Jane Doe", 84, "single", "declining", false, null, null);
  private static final Map<String, BigDecimal> ASSETS =
      Map.of("savings", new BigDecimal("1500"), "home", new BigDecimal("240000"));
  private static final Map<String, BigDecimal> INCOME =
      Map.of("social_security", new BigDecimal("1900"));

  private static ValidatorFactory validatorFactory;

  private final List<RulesKey> requestedRules = new ArrayList<>();

  @BeforeAll
  static void setUpValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  @Test
  void planDivestment_returnsEveryComponentOnSuccess() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());

    var result =
        coordinator.planDivestment(
            CLIENT, ASSETS, INCOME, List.of(gift("2024-03-01", "48000", "son")), "FL");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.status().getValue()).isEqualTo("success");
    assertThat(result.jurisdiction()).isEqualTo("florida");
    assertThat(result.planningDate()).isEqualTo(LocalDate.of(2025, 6, 15));
    assertThat(result.transferAnalysis().nonExemptTotal()).isEqualByComparingTo("30000");
    assertThat(result.penaltyCalculation().penaltyDays()).isEqualTo(90);
    assertThat(result.eligibility().isEligible()).isTrue();
    assertThat(result.strategies()).extracting(Strategy::id).contains("plan-through-penalty");
    assertThat(result.summary())
        .startsWith("Divestment plan for Jane Doe (Florida, 2025 rules)")
        .contains("90 days");
    assertThat(result.error()).isNull();
    assertThat(requestedRules).containsExactly(new RulesKey(TestRules.FLORIDA, 2025));
  }

  @Test
  void planDivestment_treatsMissingTransferListAsEmpty() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());

    var result = coordinator.planDivestment(CLIENT, ASSETS, INCOME, null, "florida");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.penaltyCalculation().hasPenalty()).isFalse();
    assertThat(result.strategies())
        .extracting(Strategy::id)
        .containsExactly("no-mitigation-needed");
    assertThat(result.summary()).contains("Penalty: none.");
  }

  @Test
  void planDivestment_usesConfiguredRulesYear() {
    var coordinator =
        coordinator(floridaOnly(), new PlanningProperties(2024, null, null, null));

    var result = coordinator.planDivestment(CLIENT, ASSETS, INCOME, List.of(), "Florida");

    assertThat(result.isSuccess()).isTrue();
    assertThat(requestedRules).containsExactly(new RulesKey(TestRules.FLORIDA, 2024));
  }

  @Test
  void planDivestment_returnsErrorForUnknownJurisdiction() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());

    var result = coordinator.planDivestment(CLIENT, ASSETS, INCOME, List.of(), "Atlantis");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.status().getValue()).isEqualTo("error");
    assertThat(result.errorCode()).isEqualTo(ErrorCode.RULES_NOT_FOUND);
    assertThat(result.error()).isEqualTo("No Medicaid rules found for atlantis in 2025");
    assertThat(result.transferAnalysis()).isNull();
    assertThat(result.strategies()).isEmpty();
  }

  @Test
  void planDivestment_returnsErrorForInvalidInput() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());
    var divorced = new ClientInfo("Jane", 80, "divorced", null, false, null, null);

    var result = coordinator.planDivestment(divorced, ASSETS, INCOME, List.of(), "FL");

    assertThat(result.errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
    assertThat(result.error()).contains("maritalStatus");
    assertThat(requestedRules).isEmpty();
  }

  @Test
  void planDivestment_returnsErrorForMissingJurisdiction() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());

    var result = coordinator.planDivestment(CLIENT, ASSETS, INCOME, List.of(), " ");

    assertThat(result.errorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
    assertThat(result.error()).isEqualTo("Jurisdiction is required");
  }

  @Test
  void planDivestment_neverThrowsOnUnexpectedFailure() {
    RulesProvider broken =
        new RecordingRulesProvider() {
          @Override
          public RuleSet getLatestRules(Jurisdiction jurisdiction, int year) {
            throw new IllegalStateException("rules store unavailable");
          }
        };
    var coordinator = coordinator(broken, PlanningProperties.defaults());

    var result = coordinator.planDivestment(CLIENT, ASSETS, INCOME, List.of(), "FL");

    assertThat(result.errorCode()).isEqualTo(ErrorCode.UNEXPECTED);
    assertThat(result.error()).isEqualTo("Divestment planning error: rules store unavailable");
  }

  @Test
  void assessEligibility_reportsExcessResources() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());

    var verdict =
        coordinator.assessEligibility(
            CLIENT, Map.of("savings", new BigDecimal("42000")), INCOME, "FL");

    assertThat(verdict.isResourceEligible()).isFalse();
    assertThat(verdict.excessResources()).isEqualByComparingTo("40000");
  }

  @Test
  void assessEligibility_failsFastForUnknownJurisdiction() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());

    assertThatThrownBy(() -> coordinator.assessEligibility(CLIENT, ASSETS, INCOME, "Atlantis"))
        .isInstanceOf(RulesNotFoundException.class);
    assertThatThrownBy(() -> coordinator.assessEligibility(null, ASSETS, INCOME, "FL"))
        .isInstanceOf(InvalidHouseholdInputException.class);
  }

  @Test
  void assessEligibilityWithPlan_attachesGuidance() {
    var coordinator = coordinator(floridaOnly(), PlanningProperties.defaults());

    var assessment =
        coordinator.assessEligibilityWithPlan(
            CLIENT, Map.of("savings", new BigDecimal("42000")), INCOME, "FL");

    assertThat(assessment.urgency()).isEqualTo(Urgency.HIGH);
    assertThat(assessment.spendDownAmount()).isEqualByComparingTo("40000");
    assertThat(assessment.divestmentOptions()).hasSize(2);
  }

  @Test
  void planDivestment_fallsBackToLatestPublishedRulesAfterYearRollover() {
    var january2027 = Clock.fixed(Instant.parse("2027-01-04T09:00:00Z"), ZoneOffset.UTC);
    var coordinator = coordinator(bundledRules(), PlanningProperties.defaults(), january2027);

    var florida =
        coordinator.planDivestment(
            CLIENT, ASSETS, INCOME, List.of(gift("2026-05-01", "49000", "son")), "FL");
    var pennsylvania =
        coordinator.planDivestment(CLIENT, ASSETS, INCOME, List.of(), "Pennsylvania");

    assertThat(florida.isSuccess()).isTrue();
    assertThat(florida.planningDate()).isEqualTo(LocalDate.of(2027, 1, 4));
    assertThat(florida.summary()).contains("(Florida, 2026 rules)");
    // 30,000 over the 19,000 exclusion at the 2026 divisor of 10,744
    assertThat(florida.penaltyCalculation().penaltyDays()).isEqualTo(83);
    assertThat(pennsylvania.isSuccess()).isTrue();
    assertThat(pennsylvania.summary()).contains("(Pennsylvania, 2025 rules)");
  }

  @Test
  void planDivestment_reportsRequestedYearWhenNoEarlierRulesExist() {
    var year2020 = Clock.fixed(Instant.parse("2020-03-01T00:00:00Z"), ZoneOffset.UTC);
    var coordinator = coordinator(bundledRules(), PlanningProperties.defaults(), year2020);

    var result = coordinator.planDivestment(CLIENT, ASSETS, INCOME, List.of(), "FL");

    assertThat(result.errorCode()).isEqualTo(ErrorCode.RULES_NOT_FOUND);
    assertThat(result.error()).isEqualTo("No Medicaid rules found for florida in 2020");
  }

  private RulesProvider floridaOnly() {
    return new RecordingRulesProvider();
  }

  private static RulesProvider bundledRules() {
    return new ClasspathRulesProvider(
        new PathMatchingResourcePatternResolver(),
        JsonMapper.builder().build(),
        new JurisdictionResolver(),
        "classpath:medicaid-rules/*.json");
  }

  /** Serves the Florida fixture for any year and records every lookup. */
  private class RecordingRulesProvider implements RulesProvider {

    @Override
    public RuleSet getRules(Jurisdiction jurisdiction, int year) {
      requestedRules.add(new RulesKey(jurisdiction, year));
      if (!jurisdiction.equals(TestRules.FLORIDA)) {
        throw new RulesNotFoundException(jurisdiction, year);
      }
      return TestRules.florida();
    }

    @Override
    public RuleSet getLatestRules(Jurisdiction jurisdiction, int year) {
      return getRules(jurisdiction, year);
    }
  }

  private static PlanningCoordinator coordinator(
      RulesProvider rulesProvider, PlanningProperties properties) {
    return coordinator(rulesProvider, properties, CLOCK);
  }

  private static PlanningCoordinator coordinator(
      RulesProvider rulesProvider, PlanningProperties properties, Clock clock) {
    return new PlanningCoordinator(
        new HouseholdInputValidator(validatorFactory.getValidator()),
        new JurisdictionResolver(),
        rulesProvider,
        new AssetClassificationService(properties),
        new LookbackTransferAnalyzer(),
        new PenaltyCalculator(),
        new EligibilityAssessor(),
        new EligibilityPlanner(properties),
        new MitigationStrategyEngine(),
        new PlanningSummaryWriter(),
        properties,
        clock);
  }
}
