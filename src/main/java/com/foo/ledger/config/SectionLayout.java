package com.foo.ledger.config;

import com.foo.ledger.model.LifecycleSection;

/**
 * Row bounds of one block of the actuals sheet, as 1-based Excel row numbers.
 *
 * <p>Historical blocks may point {@code headerRow} at the main header row when they have no
 * header of their own. Their month columns always come from the main block.
 */
public record SectionLayout(
    LifecycleSection section, int headerRow, int firstDataRow, int lastDataRow) {

  public SectionLayout {
    if (headerRow < 1 || firstDataRow < 1 || lastDataRow < firstDataRow) {
      throw new IllegalArgumentException(
          "Invalid rows for section %s: header=%d data=%d..%d"
              .formatted(section, headerRow, firstDataRow, lastDataRow));
    }
  }
}
