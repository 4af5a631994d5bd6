package io.b2mash.medicaid.penalty;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Disqualification period derived from the non-exempt transfer total.
 *
 * @param penaltyMonths non-exempt total divided by the penalty divisor, unrounded
 * @param penaltyDays floor of {@code penaltyMonths * 30}
 * @param hasPenalty true when {@code penaltyMonths > 0}
 * @param penaltyEndDate planning date plus {@code penaltyDays}
 * @param estimatedCost first-order financial impact, equal to the non-exempt total
 * @param penaltyDivisor divisor of the rule set the period was computed with
 */
public record PenaltyResult(
    BigDecimal penaltyMonths,
    int penaltyDays,
    boolean hasPenalty,
    LocalDate penaltyEndDate,
    BigDecimal estimatedCost,
    BigDecimal penaltyDivisor) {}
