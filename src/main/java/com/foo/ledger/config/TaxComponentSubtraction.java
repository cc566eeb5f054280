package com.foo.ledger.config;

import com.foo.ledger.model.ParsedUnitRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** Subtracts the IVA and stamp-tax columns the sheet carries for each unit. */
public class TaxComponentSubtraction implements TaxStrategy {

  @Override
  public BigDecimal priceWithoutTax(ParsedUnitRecord record) {
    BigDecimal price = orZero(record.getPriceWithTax());
    BigDecimal tax = orZero(record.getIva()).add(orZero(record.getStampTax()));
    return price.subtract(tax).setScale(2, RoundingMode.HALF_UP);
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }

  @Override
  public String toString() {
    return "price - (iva + timbres)";
  }
}
