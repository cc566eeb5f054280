package com.foo.ledger.config;

import java.util.List;

/**
 * Layout of a budget (expected installment) sheet. Rows are 1-based, columns are Excel letters.
 *
 * @param parseFreeTextMonths also read text headers such as {@code "sept.24"} as month columns
 */
public record BudgetLayout(
    String sheetName,
    int headerRow,
    int firstDataRow,
    int lastDataRow,
    String firstColumn,
    String lastColumn,
    List<HeaderPattern> headerPatterns,
    boolean parseFreeTextMonths) {}
