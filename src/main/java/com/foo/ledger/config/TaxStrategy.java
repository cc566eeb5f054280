package com.foo.ledger.config;

import com.foo.ledger.model.ParsedUnitRecord;
import java.math.BigDecimal;

/** Derives the pre-tax price of a unit from a tax-inclusive ledger row. */
public interface TaxStrategy {

  /** Never returns {@code null}; a missing price gives zero. */
  BigDecimal priceWithoutTax(ParsedUnitRecord record);
}
