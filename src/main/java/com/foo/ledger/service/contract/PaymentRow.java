package com.foo.ledger.service.contract;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Identified by sale, date, amount and type; a row equal on all four is the same payment. */
public record PaymentRow(
    long saleId, LocalDate paymentDate, BigDecimal amount, PaymentType paymentType, String notes) {}
