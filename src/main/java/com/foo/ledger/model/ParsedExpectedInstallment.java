package com.foo.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/** One budgeted amount for one unit and one month of the budget sheet. */
public record ParsedExpectedInstallment(String unitKey, LocalDate dueDate, BigDecimal amount) {}
