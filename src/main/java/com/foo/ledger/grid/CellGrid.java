package com.foo.ledger.grid;

/** Read-only access to the cells of one sheet. Row and column indexes are 0-based. */
public interface CellGrid {

  String getName();

  /** Returns the value at the given position, {@link CellValue#empty()} when nothing is there. */
  CellValue cell(int row, int col);
}
