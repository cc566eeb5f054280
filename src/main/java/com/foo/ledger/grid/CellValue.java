package com.foo.ledger.grid;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A raw spreadsheet value tagged with its runtime kind.
 *
 * <p>The payload is a {@link Double} for {@link CellKind#NUMBER}, a {@link String} for
 * {@link CellKind#TEXT}, a {@link LocalDateTime} for {@link CellKind#DATE} and {@code null} for
 * {@link CellKind#EMPTY}.
 */
public record CellValue(CellKind kind, Object value) {

  private static final CellValue EMPTY = new CellValue(CellKind.EMPTY, null);

  public static CellValue empty() {
    return EMPTY;
  }

  public static CellValue number(double value) {
    return new CellValue(CellKind.NUMBER, value);
  }

  public static CellValue text(String value) {
    return value == null ? EMPTY : new CellValue(CellKind.TEXT, value);
  }

  public static CellValue date(LocalDateTime value) {
    return value == null ? EMPTY : new CellValue(CellKind.DATE, value);
  }

  public static CellValue date(LocalDate value) {
    return value == null ? EMPTY : date(value.atStartOfDay());
  }

  public boolean isEmpty() {
    return kind == CellKind.EMPTY;
  }

  public boolean isNumber() {
    return kind == CellKind.NUMBER;
  }

  public boolean isText() {
    return kind == CellKind.TEXT;
  }

  public boolean isDate() {
    return kind == CellKind.DATE;
  }

  public double asNumber() {
    if (!isNumber()) {
      throw new IllegalStateException("Cell is not numeric: " + kind);
    }
    return (Double) value;
  }

  public String asText() {
    if (!isText()) {
      throw new IllegalStateException("Cell is not text: " + kind);
    }
    return (String) value;
  }

  public LocalDateTime asDateTime() {
    if (!isDate()) {
      throw new IllegalStateException("Cell is not a date: " + kind);
    }
    return (LocalDateTime) value;
  }
}
