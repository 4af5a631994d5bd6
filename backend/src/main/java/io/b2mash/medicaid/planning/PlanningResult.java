package io.b2mash.medicaid.planning;

import io.b2mash.medicaid.eligibility.EligibilityVerdict;
import io.b2mash.medicaid.lookback.TransferAnalysis;
import io.b2mash.medicaid.penalty.PenaltyResult;
import io.b2mash.medicaid.strategy.Strategy;
import java.time.LocalDate;
import java.util.List;

/**
 * Envelope returned by divestment planning. On success every component result is present and
 * {@code error} is null; on failure only {@code status}, {@code error} and {@code errorCode} are
 * set.
 *
 * @param status success or error
 * @param jurisdiction canonical jurisdiction key planned against
 * @param planningDate date the lookback window and penalty are measured from
 * @param transferAnalysis lookback analysis
 * @param penaltyCalculation penalty period
 * @param eligibility resource and income verdict
 * @param strategies mitigation strategies by descending priority
 * @param summary human-readable summary
 * @param error failure message
 * @param errorCode machine-readable failure kind
 */
public record PlanningResult(
    PlanningStatus status,
    String jurisdiction,
    LocalDate planningDate,
    TransferAnalysis transferAnalysis,
    PenaltyResult penaltyCalculation,
    EligibilityVerdict eligibility,
    List<Strategy> strategies,
    String summary,
    String error,
    ErrorCode errorCode) {

  public enum ErrorCode {
    VALIDATION_FAILED,
    RULES_NOT_FOUND,
    UNEXPECTED
  }

  public static PlanningResult success(
      String jurisdiction,
      LocalDate planningDate,
      TransferAnalysis transferAnalysis,
      PenaltyResult penaltyCalculation,
      EligibilityVerdict eligibility,
      List<Strategy> strategies,
      String summary) {
    return new PlanningResult(
        PlanningStatus.SUCCESS,
        jurisdiction,
        planningDate,
        transferAnalysis,
        penaltyCalculation,
        eligibility,
        List.copyOf(strategies),
        summary,
        null,
        null);
  }

  public static PlanningResult error(String message, ErrorCode errorCode) {
    return new PlanningResult(
        PlanningStatus.ERROR, null, null, null, null, null, List.of(), null, message, errorCode);
  }

  public boolean isSuccess() {
    return status == PlanningStatus.SUCCESS;
  }
}
