package com.foo.ledger.model;

/** Logical columns a ledger sheet may carry. Only {@link #UNIT_KEY} is mandatory. */
public enum LedgerField {
  UNIT_KEY,
  UNIT_TYPE,
  NOTES,
  SALES_REP,
  CLIENT,
  RESERVATION_DATE,
  STATUS,
  PRICE_WITH_TAX,
  DOWN_PAYMENT,
  TOTAL_DOWN_PAYMENTS,
  FINANCED_BALANCE,
  INSTALLMENTS_AGREED,
  AGREED_RESERVATION_AMOUNT,
  AGREED_INSTALLMENT_AMOUNT,
  INSTALLMENTS_PAID,
  SPECIAL_CASE,
  OBSERVATIONS,
  IVA,
  STAMP_TAX
}
