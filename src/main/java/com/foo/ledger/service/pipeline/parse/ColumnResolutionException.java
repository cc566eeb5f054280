package com.foo.ledger.service.pipeline.parse;

import com.foo.ledger.model.LedgerField;
import lombok.Getter;

@Getter
public class ColumnResolutionException extends RuntimeException {

  private final String sheetName;
  private final String blockName;
  private final LedgerField field;
  private final int headerRow;

  /**
   * @param blockName section label, or the budget sheet marker
   * @param headerRow 1-based
   */
  public ColumnResolutionException(
      String sheetName, String blockName, LedgerField field, int headerRow) {
    super(
        "Sheet '%s' [%s]: no column for required field %s in header row %d"
            .formatted(sheetName, blockName, field, headerRow));
    this.sheetName = sheetName;
    this.blockName = blockName;
    this.field = field;
    this.headerRow = headerRow;
  }
}
