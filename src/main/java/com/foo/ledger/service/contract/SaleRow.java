package com.foo.ledger.service.contract;

import com.foo.ledger.normalize.SaleStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;

@Builder
public record SaleRow(
    long projectId,
    long unitId,
    long clientId,
    String salesRepId,
    LocalDate saleDate,
    BigDecimal priceWithTax,
    BigDecimal priceWithoutTax,
    BigDecimal downPaymentAmount,
    BigDecimal financedAmount,
    SaleStatus status,
    boolean referralApplies,
    boolean specialCase,
    String specialCaseType,
    String observations,
    String notes) {}
