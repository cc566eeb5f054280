package com.foo.ledger.service.pipeline.parse;

import java.time.YearMonth;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads abbreviated Spanish month headers such as {@code "jun.22"} or {@code "Sept.24"}. Two-digit
 * years are taken as 20xx.
 */
public final class MonthHeaderParser {

  private static final Pattern MONTH_HEADER =
      Pattern.compile(
          "^(ene|feb|mar|abr|may|jun|jul|ago|sep|sept|oct|nov|dic)\\.(\\d{2})$",
          Pattern.CASE_INSENSITIVE);

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("ene", 1),
          Map.entry("feb", 2),
          Map.entry("mar", 3),
          Map.entry("abr", 4),
          Map.entry("may", 5),
          Map.entry("jun", 6),
          Map.entry("jul", 7),
          Map.entry("ago", 8),
          Map.entry("sep", 9),
          Map.entry("sept", 9),
          Map.entry("oct", 10),
          Map.entry("nov", 11),
          Map.entry("dic", 12));

  private MonthHeaderParser() {}

  public static Optional<YearMonth> parse(String header) {
    if (header == null) {
      return Optional.empty();
    }
    Matcher m = MONTH_HEADER.matcher(header.trim());
    if (!m.matches()) {
      return Optional.empty();
    }
    int month = MONTHS.get(m.group(1).toLowerCase(Locale.ROOT));
    int year = 2000 + Integer.parseInt(m.group(2));
    return Optional.of(YearMonth.of(year, month));
  }
}
