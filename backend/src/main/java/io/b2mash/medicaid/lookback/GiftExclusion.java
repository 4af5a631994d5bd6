package io.b2mash.medicaid.lookback;

import java.math.BigDecimal;

/**
 * Annual gift exclusion applied to one recipient for one calendar year.
 *
 * @param recipient recipient as first entered
 * @param year calendar year of the gifts
 * @param total sum of in-window, non-exempt gifts to the recipient in that year
 * @param excluded portion covered by the annual exclusion
 * @param excess portion that counts toward the penalty
 */
public record GiftExclusion(
    String recipient, int year, BigDecimal total, BigDecimal excluded, BigDecimal excess) {}
