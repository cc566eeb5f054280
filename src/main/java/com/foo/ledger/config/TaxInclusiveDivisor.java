package com.foo.ledger.config;

import com.foo.ledger.model.ParsedUnitRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Divides the tax-inclusive price by a fixed factor, for sheets that carry no tax columns.
 * A divisor of 1.093 stands for 8.4% IVA plus 0.9% stamp tax on the net price.
 */
public class TaxInclusiveDivisor implements TaxStrategy {

  private final BigDecimal divisor;

  public TaxInclusiveDivisor(BigDecimal divisor) {
    if (divisor.signum() <= 0) {
      throw new IllegalArgumentException("Tax divisor must be positive: " + divisor);
    }
    this.divisor = divisor;
  }

  @Override
  public BigDecimal priceWithoutTax(ParsedUnitRecord record) {
    BigDecimal price = record.getPriceWithTax();
    if (price == null || price.signum() == 0) {
      return BigDecimal.ZERO.setScale(2);
    }
    return price.divide(divisor, 2, RoundingMode.HALF_UP);
  }

  @Override
  public String toString() {
    return "price / " + divisor.toPlainString();
  }
}
