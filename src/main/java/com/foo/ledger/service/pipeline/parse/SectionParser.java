package com.foo.ledger.service.pipeline.parse;

import com.foo.ledger.config.SectionLayout;
import com.foo.ledger.grid.CellGrid;
import com.foo.ledger.grid.CellValue;
import com.foo.ledger.model.LedgerField;
import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.model.PaymentObservation;
import com.foo.ledger.model.RecordKey;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the data rows of one actuals section into {@link ParsedUnitRecord}s.
 *
 * <p>Rows without a unit key are skipped. Month columns are read in chronological order; a blank
 * or zero amount is not a payment. Historical sections must be given a {@link HeaderMap} carrying
 * the main section's month columns.
 */
@Slf4j
@Component
public class SectionParser {

  /**
   * @throws ColumnResolutionException when the header map has no unit key column
   */
  public List<ParsedUnitRecord> parse(CellGrid grid, SectionLayout layout, HeaderMap headers) {
    int keyCol =
        headers
            .column(LedgerField.UNIT_KEY)
            .orElseThrow(
                () ->
                    new ColumnResolutionException(
                        grid.getName(),
                        layout.section().label(),
                        LedgerField.UNIT_KEY,
                        layout.headerRow()));

    List<ParsedUnitRecord> records = new ArrayList<>();
    for (int rowNumber = layout.firstDataRow(); rowNumber <= layout.lastDataRow(); rowNumber++) {
      int row = rowNumber - 1;
      String unitKey = CellCoercion.toUnitKey(grid.cell(row, keyCol));
      if (unitKey == null) {
        continue;
      }

      RowReader reader = new RowReader(grid, row, headers);
      ParsedUnitRecord.ParsedUnitRecordBuilder builder =
          ParsedUnitRecord.builder()
              .key(new RecordKey(layout.section(), rowNumber))
              .unitKey(unitKey)
              .unitType(reader.text(LedgerField.UNIT_TYPE))
              .notes(reader.text(LedgerField.NOTES))
              .salesRepRaw(reader.text(LedgerField.SALES_REP))
              .clientName(reader.text(LedgerField.CLIENT))
              .reservationDate(reader.date(LedgerField.RESERVATION_DATE))
              .rawStatus(reader.text(LedgerField.STATUS))
              .priceWithTax(reader.decimal(LedgerField.PRICE_WITH_TAX))
              .downPayment(reader.decimal(LedgerField.DOWN_PAYMENT))
              .totalDownPayments(reader.decimal(LedgerField.TOTAL_DOWN_PAYMENTS))
              .financedBalance(reader.decimal(LedgerField.FINANCED_BALANCE))
              .installmentsAgreed(reader.integer(LedgerField.INSTALLMENTS_AGREED))
              .agreedReservationAmount(reader.decimal(LedgerField.AGREED_RESERVATION_AMOUNT))
              .agreedInstallmentAmount(reader.decimal(LedgerField.AGREED_INSTALLMENT_AMOUNT))
              .installmentsPaid(reader.integer(LedgerField.INSTALLMENTS_PAID))
              .specialCase(reader.text(LedgerField.SPECIAL_CASE))
              .observations(reader.text(LedgerField.OBSERVATIONS))
              .iva(reader.decimal(LedgerField.IVA))
              .stampTax(reader.decimal(LedgerField.STAMP_TAX));

      for (Map.Entry<YearMonth, Integer> month : headers.monthColumns().entrySet()) {
        BigDecimal amount = CellCoercion.toDecimal(grid.cell(row, month.getValue()));
        if (amount != null && amount.signum() != 0) {
          builder.observedPayment(
              new PaymentObservation(month.getKey().atEndOfMonth(), amount));
        }
      }

      records.add(builder.build());
    }

    log.info(
        "[{}] Parsed {} records, {} with payments",
        layout.section().label(),
        records.size(),
        records.stream().filter(ParsedUnitRecord::hasPayments).count());
    return records;
  }

  /** Typed access to the named columns of one row; unmapped fields read as {@code null}. */
  private static final class RowReader {

    private final CellGrid grid;
    private final int row;
    private final HeaderMap headers;

    RowReader(CellGrid grid, int row, HeaderMap headers) {
      this.grid = grid;
      this.row = row;
      this.headers = headers;
    }

    private CellValue cell(LedgerField field) {
      OptionalInt col = headers.column(field);
      return col.isPresent() ? grid.cell(row, col.getAsInt()) : CellValue.empty();
    }

    String text(LedgerField field) {
      return CellCoercion.toText(cell(field));
    }

    BigDecimal decimal(LedgerField field) {
      return CellCoercion.toDecimal(cell(field));
    }

    Integer integer(LedgerField field) {
      return CellCoercion.toInteger(cell(field));
    }

    LocalDate date(LedgerField field) {
      return CellCoercion.toDate(cell(field));
    }
  }
}
