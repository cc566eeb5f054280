package com.foo.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;

/** One non-zero amount read from a month column. */
public record PaymentObservation(LocalDate date, BigDecimal amount) {

  public static final Comparator<PaymentObservation> BY_DATE =
      Comparator.comparing(PaymentObservation::date);
}
