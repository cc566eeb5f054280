package com.foo.ledger.service.pipeline.parse;

import static org.assertj.core.api.Assertions.assertThat;

import com.foo.ledger.config.HeaderPattern;
import com.foo.ledger.grid.CellValue;
import com.foo.ledger.grid.TestGrid;
import com.foo.ledger.model.LedgerField;
import com.foo.ledger.util.ColumnRange;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeaderLocatorTest {

  private static final List<HeaderPattern> PATTERNS =
      List.of(
          HeaderPattern.of(LedgerField.UNIT_KEY, "apto", "apto."),
          HeaderPattern.of(LedgerField.UNIT_TYPE, "tipo", "modelo"),
          HeaderPattern.of(LedgerField.CLIENT, "cliente"),
          HeaderPattern.of(LedgerField.STATUS, "estatus", "tipo de plan"));

  private final HeaderLocator locator = new HeaderLocator();

  @Test
  void locate_namedColumns_byHeaderText() {
    TestGrid grid = new TestGrid("S").row(1, "A", "Apto.", "Tipo", "Cliente", "Estatus");

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(0, 3), PATTERNS, false);

    assertThat(headers.column(LedgerField.UNIT_KEY)).hasValue(0);
    assertThat(headers.column(LedgerField.UNIT_TYPE)).hasValue(1);
    assertThat(headers.column(LedgerField.CLIENT)).hasValue(2);
    assertThat(headers.column(LedgerField.STATUS)).hasValue(3);
  }

  @Test
  void locate_headerNormalization_caseLineBreaksAndSpaces() {
    TestGrid grid = new TestGrid("S").row(1, "A", "  APTO ", "Tipo\nde   plan");

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(0, 1), PATTERNS, false);

    assertThat(headers.column(LedgerField.UNIT_KEY)).hasValue(0);
    assertThat(headers.column(LedgerField.STATUS)).hasValue(1);
  }

  @Test
  void locate_columnOrder_doesNotMatter() {
    TestGrid forward = new TestGrid("S").row(1, "A", "Apto", "Cliente", "Estatus");
    TestGrid reversed = new TestGrid("S").row(1, "A", "Estatus", "Cliente", "Apto");

    HeaderMap a = locator.locate(forward, 0, new ColumnRange(0, 2), PATTERNS, false);
    HeaderMap b = locator.locate(reversed, 0, new ColumnRange(0, 2), PATTERNS, false);

    assertThat(a.namedColumns().keySet()).isEqualTo(b.namedColumns().keySet());
    assertThat(b.column(LedgerField.UNIT_KEY)).hasValue(2);
    assertThat(b.column(LedgerField.STATUS)).hasValue(0);
  }

  @Test
  void locate_shortCandidate_neverTakesLongerHeaderBySubstring() {
    TestGrid grid = new TestGrid("S").row(1, "A", "Tipo de plan de pagos", "Tipo");

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(0, 1), PATTERNS, false);

    assertThat(headers.column(LedgerField.STATUS)).hasValue(0);
    assertThat(headers.column(LedgerField.UNIT_TYPE)).hasValue(1);
  }

  @Test
  void locate_substringMatch_forLongCandidates() {
    TestGrid grid = new TestGrid("S").row(1, "A", "Apto", "Nombre del cliente");

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(0, 1), PATTERNS, false);

    assertThat(headers.column(LedgerField.CLIENT)).hasValue(1);
  }

  @Test
  void locate_claimedField_isNotReassigned() {
    TestGrid grid = new TestGrid("S").row(1, "A", "Cliente", "Cliente");

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(0, 1), PATTERNS, false);

    assertThat(headers.column(LedgerField.CLIENT)).hasValue(0);
  }

  @Test
  void locate_blankAndUnknownHeaders_ignored() {
    TestGrid grid =
        new TestGrid("S").row(1, "A", "Apto", "   ", null, "Comentarios internos", "Cliente");

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(0, 4), PATTERNS, false);

    assertThat(headers.namedColumns()).containsOnlyKeys(LedgerField.UNIT_KEY, LedgerField.CLIENT);
    assertThat(headers.column(LedgerField.CLIENT)).hasValue(4);
    assertThat(headers.monthColumns()).isEmpty();
  }

  @Test
  void locate_dateCells_areMonthColumnsInChronologicalOrder() {
    TestGrid grid =
        new TestGrid("S")
            .row(1, "A", "Apto", LocalDate.of(2024, 3, 1), LocalDate.of(2024, 1, 15));

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(0, 2), PATTERNS, false);

    assertThat(headers.monthColumns().keySet())
        .containsExactly(YearMonth.of(2024, 1), YearMonth.of(2024, 3));
    assertThat(headers.monthColumns().get(YearMonth.of(2024, 1))).isEqualTo(2);
    assertThat(headers.describeMonths()).isEqualTo("2 (2024-01 -> 2024-03)");
  }

  @Test
  void locate_freeTextMonths_onlyWhenEnabled() {
    TestGrid grid = new TestGrid("S").row(1, "A", "Apto", "sept.24", "Ene.25");

    HeaderMap disabled = locator.locate(grid, 0, new ColumnRange(0, 2), PATTERNS, false);
    HeaderMap enabled = locator.locate(grid, 0, new ColumnRange(0, 2), PATTERNS, true);

    assertThat(disabled.monthColumns()).isEmpty();
    assertThat(enabled.monthColumns())
        .containsEntry(YearMonth.of(2024, 9), 1)
        .containsEntry(YearMonth.of(2025, 1), 2);
  }

  @Test
  void locate_onlyScansConfiguredColumnRange() {
    TestGrid grid = new TestGrid("S").row(1, "A", "Cliente", "Apto", "Estatus");

    HeaderMap headers = locator.locate(grid, 0, new ColumnRange(1, 2), PATTERNS, false);

    assertThat(headers.has(LedgerField.CLIENT)).isFalse();
    assertThat(headers.column(LedgerField.UNIT_KEY)).hasValue(1);
  }

  @Test
  void normalizeHeader_numericHeader_rendersAsInteger() {
    assertThat(HeaderLocator.normalizeHeader(CellValue.number(2024.0))).isEqualTo("2024");
    assertThat(HeaderLocator.normalizeHeader(CellValue.empty())).isEmpty();
  }
}
