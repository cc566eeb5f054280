package com.foo.ledger.service.contract;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ExpectedPaymentRow(
    long projectId,
    String unitNumber,
    LocalDate dueDate,
    BigDecimal amount,
    int installmentNumber,
    String scheduleType) {}
