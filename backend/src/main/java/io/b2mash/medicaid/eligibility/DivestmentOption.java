package io.b2mash.medicaid.eligibility;

import java.math.BigDecimal;
import java.util.List;

/**
 * A gifting approach for spending down excess resources.
 *
 * @param name approach name, e.g. "Modern Half-a-Loaf"
 * @param giftAmount amount to gift, or null when the approach decides it later
 * @param retainedAmount amount kept to fund care during the penalty, or null
 * @param estimatedPenaltyMonths penalty the gift would create, or null
 * @param steps ordered implementation steps
 */
public record DivestmentOption(
    String name,
    BigDecimal giftAmount,
    BigDecimal retainedAmount,
    BigDecimal estimatedPenaltyMonths,
    List<String> steps) {}
