package com.foo.ledger.grid;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

/**
 * {@link CellGrid} backed by an Apache POI sheet.
 *
 * <p>Formula cells are read through their cached result, so the workbook is seen the way Excel
 * last calculated it. Boolean cells are exposed as text and error cells as empty.
 */
public class PoiCellGrid implements CellGrid {

  private final Sheet sheet;

  public PoiCellGrid(Sheet sheet) {
    this.sheet = sheet;
  }

  @Override
  public String getName() {
    return sheet.getSheetName();
  }

  @Override
  public CellValue cell(int row, int col) {
    Row poiRow = sheet.getRow(row);
    if (poiRow == null) {
      return CellValue.empty();
    }
    Cell cell = poiRow.getCell(col);
    if (cell == null) {
      return CellValue.empty();
    }

    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }

    return switch (type) {
      case NUMERIC -> DateUtil.isCellDateFormatted(cell)
          ? CellValue.date(cell.getLocalDateTimeCellValue())
          : CellValue.number(cell.getNumericCellValue());
      case STRING -> CellValue.text(cell.getStringCellValue());
      case BOOLEAN -> CellValue.text(String.valueOf(cell.getBooleanCellValue()));
      default -> CellValue.empty();
    };
  }
}
