package com.foo.ledger.service.pipeline.parse;

import com.foo.ledger.model.LedgerField;
import java.time.YearMonth;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Resolved columns of one header row, as 0-based column indexes. Month columns iterate in
 * chronological order.
 */
public record HeaderMap(
    Map<LedgerField, Integer> namedColumns, NavigableMap<YearMonth, Integer> monthColumns) {

  public HeaderMap {
    namedColumns =
        namedColumns.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(namedColumns));
    monthColumns = Collections.unmodifiableNavigableMap(new TreeMap<>(monthColumns));
  }

  public OptionalInt column(LedgerField field) {
    Integer col = namedColumns.get(field);
    return col == null ? OptionalInt.empty() : OptionalInt.of(col);
  }

  public boolean has(LedgerField field) {
    return namedColumns.containsKey(field);
  }

  /** Same named columns, with the month columns of another header row. */
  public HeaderMap withMonthColumnsOf(HeaderMap other) {
    return new HeaderMap(namedColumns, other.monthColumns);
  }

  public String describeMonths() {
    if (monthColumns.isEmpty()) {
      return "none";
    }
    return "%d (%s -> %s)"
        .formatted(monthColumns.size(), monthColumns.firstKey(), monthColumns.lastKey());
  }
}
