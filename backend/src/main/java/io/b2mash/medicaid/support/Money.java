package io.b2mash.medicaid.support;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

/** Formatting helpers for amounts shown in strategy and summary text. */
public final class Money {

  private Money() {}

  /** Formats an amount as US dollars, e.g. {@code $12,345.67}. */
  public static String format(BigDecimal amount) {
    // NumberFormat is not thread-safe; create one per call
    return NumberFormat.getCurrencyInstance(Locale.US).format(amount);
  }

  /** Formats a month count with two decimals, e.g. {@code 3.03}. */
  public static String months(BigDecimal months) {
    return months.setScale(2, RoundingMode.HALF_UP).toPlainString();
  }
}
