package com.foo.ledger.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One populated row of an actuals section: one lifecycle episode of one unit.
 *
 * <p>{@code unitKey} is never blank; rows without a key are not turned into records.
 */
@Value
@Builder(toBuilder = true)
public class ParsedUnitRecord {

  @NonNull RecordKey key;
  @NonNull String unitKey;

  String unitType;
  String salesRepRaw;
  String clientName;
  LocalDate reservationDate;
  String rawStatus;

  BigDecimal priceWithTax;
  BigDecimal downPayment;
  BigDecimal totalDownPayments;
  BigDecimal financedBalance;
  BigDecimal agreedReservationAmount;
  BigDecimal agreedInstallmentAmount;
  BigDecimal iva;
  BigDecimal stampTax;

  Integer installmentsAgreed;
  Integer installmentsPaid;

  String specialCase;
  String observations;
  String notes;

  @Singular List<PaymentObservation> observedPayments;

  public LifecycleSection getSection() {
    return key.section();
  }

  public int getRowNumber() {
    return key.rowNumber();
  }

  public boolean hasPayments() {
    return !observedPayments.isEmpty();
  }

  /** Payments in chronological order, whatever order the columns were read in. */
  public List<PaymentObservation> getPaymentsByDate() {
    List<PaymentObservation> sorted = new ArrayList<>(observedPayments);
    sorted.sort(PaymentObservation.BY_DATE);
    return sorted;
  }

  public Optional<LocalDate> getEarliestPaymentDate() {
    return observedPayments.stream().map(PaymentObservation::date).min(LocalDate::compareTo);
  }
}
