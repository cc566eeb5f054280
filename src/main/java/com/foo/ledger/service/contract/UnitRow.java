package com.foo.ledger.service.contract;

import com.foo.ledger.normalize.UnitStatus;
import java.math.BigDecimal;
import lombok.Builder;

/** Current state of one physical unit, keyed by project and unit number. */
@Builder
public record UnitRow(
    long projectId,
    String unitNumber,
    String unitType,
    BigDecimal priceWithTax,
    BigDecimal priceWithoutTax,
    BigDecimal downPaymentAmount,
    UnitStatus status) {}
