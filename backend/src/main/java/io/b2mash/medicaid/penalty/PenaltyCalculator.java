package io.b2mash.medicaid.penalty;

import io.b2mash.medicaid.exception.InvalidHouseholdInputException;
import io.b2mash.medicaid.lookback.TransferAnalysis;
import io.b2mash.medicaid.rules.RuleSet;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stateless service converting a non-exempt transfer total into a penalty period. Days are
 * computed as {@code floor(months * 30)}, which does not track calendar months exactly; eligibility
 * outcomes depend on that convention, so it is kept as is.
 */
@Service
public class PenaltyCalculator {

  private static final Logger log = LoggerFactory.getLogger(PenaltyCalculator.class);

  static final MathContext MONTHS_PRECISION = MathContext.DECIMAL64;
  static final BigDecimal DAYS_PER_PENALTY_MONTH = BigDecimal.valueOf(30);
  static final BigDecimal MAX_PENALTY_DAYS = BigDecimal.valueOf(Integer.MAX_VALUE);

  /**
   * Calculates the penalty period for an analyzed transfer history.
   *
   * @param analysis lookback analysis supplying the non-exempt total
   * @param rules rule set supplying the penalty divisor, positive by construction
   * @param now planning date the penalty period starts on
   * @return the penalty period, zero when nothing counts toward a penalty
   * @throws InvalidHouseholdInputException if the period does not fit in a day count
   */
  public PenaltyResult calculatePenalty(TransferAnalysis analysis, RuleSet rules, LocalDate now) {
    BigDecimal nonExemptTotal = analysis.nonExemptTotal();
    BigDecimal divisor = rules.penaltyDivisor();

    if (nonExemptTotal.signum() <= 0) {
      return new PenaltyResult(BigDecimal.ZERO, 0, false, now, BigDecimal.ZERO, divisor);
    }

    BigDecimal penaltyMonths = nonExemptTotal.divide(divisor, MONTHS_PRECISION);
    // exact floor of (total / divisor) * 30, not of the rounded months value
    BigDecimal days =
        nonExemptTotal.multiply(DAYS_PER_PENALTY_MONTH).divide(divisor, 0, RoundingMode.FLOOR);
    if (days.compareTo(MAX_PENALTY_DAYS) > 0) {
      throw new InvalidHouseholdInputException(
          "Penalty period of " + days.toPlainString() + " days exceeds the supported range");
    }
    int penaltyDays = days.intValue();
    LocalDate penaltyEndDate = now.plusDays(penaltyDays);

    log.debug(
        "Penalty calculated: nonExemptTotal={}, divisor={}, months={}, days={}, endDate={}",
        nonExemptTotal,
        divisor,
        penaltyMonths,
        penaltyDays,
        penaltyEndDate);
    return new PenaltyResult(
        penaltyMonths,
        penaltyDays,
        penaltyMonths.signum() > 0,
        penaltyEndDate,
        nonExemptTotal,
        divisor);
  }
}
