package com.foo.ledger.service.pipeline.parse;

import com.foo.ledger.grid.CellValue;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Typed reads of raw cells. Every method returns {@code null} for a value it cannot interpret
 * instead of throwing, so one malformed cell never stops a sheet.
 */
final class CellCoercion {

  private CellCoercion() {}

  /** Amount rounded to cents. Text such as {@code "1,250.50"} is accepted. */
  static BigDecimal toDecimal(CellValue cell) {
    try {
      if (cell.isNumber()) {
        return BigDecimal.valueOf(cell.asNumber()).setScale(2, RoundingMode.HALF_UP);
      }
      if (cell.isText()) {
        String cleaned = cell.asText().replaceAll("[,\\s]", "");
        return cleaned.isEmpty() ? null : new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP);
      }
    } catch (NumberFormatException e) {
      return null;
    }
    return null;
  }

  /** Whole number, truncating any fraction. */
  static Integer toInteger(CellValue cell) {
    try {
      if (cell.isNumber()) {
        double value = cell.asNumber();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
          return null;
        }
        return (int) value;
      }
      if (cell.isText()) {
        String cleaned = cell.asText().replaceAll("[,\\s]", "");
        return cleaned.isEmpty() ? null : new BigDecimal(cleaned).intValue();
      }
    } catch (NumberFormatException e) {
      return null;
    }
    return null;
  }

  /** Trimmed text, {@code null} when blank. Integral numbers render without a fraction. */
  static String toText(CellValue cell) {
    return switch (cell.kind()) {
      case TEXT -> blankToNull(cell.asText().trim());
      case NUMBER -> renderNumber(cell.asNumber());
      case DATE -> cell.asDateTime().toLocalDate().toString();
      case EMPTY -> null;
    };
  }

  /** Date cells, or ISO {@code yyyy-MM-dd} text. */
  static LocalDate toDate(CellValue cell) {
    if (cell.isDate()) {
      return cell.asDateTime().toLocalDate();
    }
    if (cell.isText()) {
      try {
        return LocalDate.parse(cell.asText().trim());
      } catch (DateTimeParseException e) {
        return null;
      }
    }
    return null;
  }

  /**
   * Unit identifier as text. Numeric keys use their integer form so that {@code 305.0} and
   * {@code "305"} are the same unit.
   */
  static String toUnitKey(CellValue cell) {
    if (cell.isNumber()) {
      double value = cell.asNumber();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return null;
      }
      return Long.toString((long) value);
    }
    return toText(cell);
  }

  private static String blankToNull(String value) {
    return value.isEmpty() ? null : value;
  }

  private static String renderNumber(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return null;
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
