package io.b2mash.medicaid.lookback;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/** Parses transfer dates entered as ISO dates, ISO date-times or US {@code M/d/yyyy}. */
final class TransferDates {

  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("[uuuu-MM-dd][M/d/uuuu]").withResolverStyle(ResolverStyle.STRICT);

  private TransferDates() {}

  static Optional<LocalDate> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();
    if (value.length() > 10 && value.charAt(10) == 'T') {
      value = value.substring(0, 10);
    }
    try {
      return Optional.of(LocalDate.parse(value, FORMAT));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
