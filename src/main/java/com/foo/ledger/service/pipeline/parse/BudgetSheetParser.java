package com.foo.ledger.service.pipeline.parse;

import com.foo.ledger.config.BudgetLayout;
import com.foo.ledger.grid.CellGrid;
import com.foo.ledger.model.LedgerField;
import com.foo.ledger.model.ParsedExpectedInstallment;
import com.foo.ledger.util.ColumnRange;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads the budget sheet: one expected installment per unit and non-zero month cell. */
@Slf4j
@Component
@RequiredArgsConstructor
public class BudgetSheetParser {

  static final String BLOCK_NAME = "budget";

  private final HeaderLocator headerLocator;

  public List<ParsedExpectedInstallment> parse(CellGrid grid, BudgetLayout layout) {
    HeaderMap headers =
        headerLocator.locate(
            grid,
            layout.headerRow() - 1,
            ColumnRange.of(layout.firstColumn(), layout.lastColumn()),
            layout.headerPatterns(),
            layout.parseFreeTextMonths());

    log.info(
        "[{}] Headers found: {} | Monthly columns: {}",
        BLOCK_NAME,
        headers.namedColumns().keySet(),
        headers.describeMonths());

    int keyCol =
        headers
            .column(LedgerField.UNIT_KEY)
            .orElseThrow(
                () ->
                    new ColumnResolutionException(
                        grid.getName(), BLOCK_NAME, LedgerField.UNIT_KEY, layout.headerRow()));

    List<ParsedExpectedInstallment> installments = new ArrayList<>();
    for (int rowNumber = layout.firstDataRow(); rowNumber <= layout.lastDataRow(); rowNumber++) {
      int row = rowNumber - 1;
      String unitKey = CellCoercion.toUnitKey(grid.cell(row, keyCol));
      if (unitKey == null) {
        continue;
      }
      for (Map.Entry<YearMonth, Integer> month : headers.monthColumns().entrySet()) {
        BigDecimal amount = CellCoercion.toDecimal(grid.cell(row, month.getValue()));
        if (amount != null && amount.signum() != 0) {
          installments.add(
              new ParsedExpectedInstallment(unitKey, month.getKey().atEndOfMonth(), amount));
        }
      }
    }

    log.info("[{}] Parsed {} expected installments", BLOCK_NAME, installments.size());
    return installments;
  }
}
