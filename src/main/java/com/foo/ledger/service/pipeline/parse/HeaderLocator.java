package com.foo.ledger.service.pipeline.parse;

import com.foo.ledger.config.HeaderPattern;
import com.foo.ledger.grid.CellGrid;
import com.foo.ledger.grid.CellValue;
import com.foo.ledger.model.LedgerField;
import com.foo.ledger.util.ColumnRange;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds logical fields and month columns in a header row by name rather than by position.
 *
 * <p>Each header cell is tried in this order:
 *
 * <ol>
 *   <li>a date cell is a month column;
 *   <li>with free-text months enabled, text such as {@code "sept.24"} is a month column;
 *   <li>an exact match against any unclaimed field's candidates;
 *   <li>otherwise a substring match, using only candidates of five or more characters, so a short
 *       candidate like {@code "tipo"} cannot take the {@code "tipo de plan"} column.
 * </ol>
 *
 * The first unclaimed field in pattern order wins, and a claimed field is never reassigned.
 * Blank and unrecognized headers are ignored.
 */
@Slf4j
@Component
public class HeaderLocator {

  /** @param headerRow 0-based row index */
  public HeaderMap locate(
      CellGrid grid,
      int headerRow,
      ColumnRange columns,
      List<HeaderPattern> patterns,
      boolean parseFreeTextMonths) {
    Map<LedgerField, Integer> named = new EnumMap<>(LedgerField.class);
    TreeMap<YearMonth, Integer> months = new TreeMap<>();

    for (int col = columns.first(); col <= columns.last(); col++) {
      CellValue raw = grid.cell(headerRow, col);
      if (raw.isEmpty()) {
        continue;
      }
      if (raw.isDate()) {
        months.put(YearMonth.from(raw.asDateTime()), col);
        continue;
      }

      String header = normalizeHeader(raw);
      if (header.isEmpty()) {
        continue;
      }

      if (parseFreeTextMonths) {
        Optional<YearMonth> month = MonthHeaderParser.parse(header);
        if (month.isPresent()) {
          months.put(month.get(), col);
          continue;
        }
      }

      Optional<LedgerField> field = claim(header, patterns, named);
      if (field.isPresent()) {
        named.put(field.get(), col);
      } else {
        log.trace("Ignoring header '{}' in column {} of {}", header, col, grid.getName());
      }
    }

    return new HeaderMap(named, months);
  }

  private Optional<LedgerField> claim(
      String header, List<HeaderPattern> patterns, Map<LedgerField, Integer> claimed) {
    for (HeaderPattern pattern : patterns) {
      if (!claimed.containsKey(pattern.field()) && pattern.matchesExactly(header)) {
        return Optional.of(pattern.field());
      }
    }
    for (HeaderPattern pattern : patterns) {
      if (!claimed.containsKey(pattern.field()) && pattern.matchesPartially(header)) {
        return Optional.of(pattern.field());
      }
    }
    return Optional.empty();
  }

  /** Trimmed, lower-cased, with runs of whitespace and line breaks folded to one space. */
  static String normalizeHeader(CellValue raw) {
    String text = raw.isText() ? raw.asText() : CellCoercion.toText(raw);
    if (text == null) {
      return "";
    }
    return text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
  }
}
