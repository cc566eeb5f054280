package com.foo.ledger.service.pipeline.load;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.foo.ledger.config.LedgerImportProperties;
import com.foo.ledger.config.SampleLedgerConfig;
import com.foo.ledger.model.LedgerDataset;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.model.ParsedExpectedInstallment;
import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.model.PaymentObservation;
import com.foo.ledger.model.RecordKey;
import com.foo.ledger.normalize.SaleStatus;
import com.foo.ledger.normalize.UnitStatus;
import com.foo.ledger.service.contract.ExpectedPaymentRow;
import com.foo.ledger.service.contract.PaymentRow;
import com.foo.ledger.service.contract.PaymentType;
import com.foo.ledger.service.contract.ProjectDefinition;
import com.foo.ledger.service.contract.SaleRow;
import com.foo.ledger.service.contract.TableStore;
import com.foo.ledger.service.contract.UnitRow;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LifecycleLoaderTest {

  private static final LocalDate JAN = LocalDate.of(2024, 1, 31);
  private static final LocalDate FEB = LocalDate.of(2024, 2, 29);
  private static final LocalDate MAR = LocalDate.of(2024, 3, 31);

  private InMemoryTableStore store;
  private LifecycleLoader loader;
  private ProjectDefinition project;

  @BeforeEach
  void setUp() {
    store = new InMemoryTableStore();
    LedgerImportProperties properties = new LedgerImportProperties();
    properties.setBatchSize(2);
    loader = new LifecycleLoader(store, properties);
    project = new ProjectDefinition("sample", "Sample Tower", new SampleLedgerConfig());
  }

  private static ParsedUnitRecord.ParsedUnitRecordBuilder record(
      LifecycleSection section, int row, String unitKey) {
    return ParsedUnitRecord.builder()
        .key(new RecordKey(section, row))
        .unitKey(unitKey)
        .rawStatus(section == LifecycleSection.MAIN ? null : "Desistimiento");
  }

  private static PaymentObservation paid(LocalDate date, String amount) {
    return new PaymentObservation(date, new BigDecimal(amount));
  }

  private static BigDecimal money(String value) {
    return new BigDecimal(value);
  }

  /**
   * Unit 101 sold to Jane after John cancelled and got a refund; 102 available; 205 reserved
   * with no reservation date; 206 reserved with neither date nor payments; 900 and 300 only
   * appear in history.
   */
  private static LedgerDataset sampleDataset() {
    List<ParsedUnitRecord> records =
        List.of(
            record(LifecycleSection.MAIN, 3, "101")
                .clientName("Jane Doe")
                .salesRepRaw("Ana G.")
                .rawStatus("4.plan de pagos")
                .reservationDate(LocalDate.of(2024, 1, 10))
                .priceWithTax(money("109300"))
                .downPayment(money("10930"))
                .notes("corner unit")
                .observedPayment(paid(JAN, "5000"))
                .build(),
            record(LifecycleSection.MAIN, 4, "102").rawStatus("1.disponible").build(),
            record(LifecycleSection.MAIN, 5, "205")
                .clientName("Ann  Lee")
                .rawStatus("2.reserva")
                .observedPayment(paid(MAR, "1000"))
                .observedPayment(paid(FEB, "2000"))
                .build(),
            record(LifecycleSection.MAIN, 6, "206").clientName("Bob Ray").rawStatus("2.reserva")
                .build(),
            record(LifecycleSection.CANCELLED, 13, "101")
                .clientName("John Roe")
                .salesRepRaw("**")
                .reservationDate(LocalDate.of(2023, 5, 1))
                .observedPayment(paid(LocalDate.of(2023, 5, 31), "3000"))
                .build(),
            record(LifecycleSection.CANCELLED, 14, "900")
                .clientName("Old Client")
                .reservationDate(LocalDate.of(2023, 3, 1))
                .build(),
            record(LifecycleSection.REFUND, 17, "101")
                .clientName("John Roe")
                .observedPayment(paid(MAR, "2000"))
                .build(),
            record(LifecycleSection.REFUND, 18, "300")
                .clientName("Max Poe")
                .observedPayment(paid(MAR, "1500"))
                .build());
    List<ParsedExpectedInstallment> budget =
        List.of(
            new ParsedExpectedInstallment("205", MAR, money("100")),
            new ParsedExpectedInstallment("205", JAN, money("100")),
            new ParsedExpectedInstallment("101", JAN, money("250")));
    return new LedgerDataset(records, budget);
  }

  @Test
  void load_writesEveryTable() {
    LoadResult result = loader.load(project, sampleDataset());

    assertThat(result.projectId()).isEqualTo(store.projects.get("sample"));
    assertThat(result.unitsUpserted()).isEqualTo(4);
    assertThat(result.unitsSynthesized()).isEqualTo(2);
    assertThat(result.clientsUpserted()).isEqualTo(6);
    assertThat(result.salesRepsUpserted()).isEqualTo(2);
    assertThat(result.activeSales()).isEqualTo(2);
    assertThat(result.cancelledSalesInserted()).isEqualTo(3);
    assertThat(result.cancelledSalesReused()).isEqualTo(1);
    assertThat(result.paymentsInserted()).isEqualTo(6);
    assertThat(result.expectedPaymentsWritten()).isEqualTo(3);

    assertThat(store.units).hasSize(6);
    assertThat(store.clients).containsOnlyKeys(
        "Jane Doe", "Ann Lee", "Bob Ray", "John Roe", "Old Client", "Max Poe");
    assertThat(store.sales).hasSize(5);
    assertThat(store.payments).hasSize(6);
    assertThat(store.expectedPayments).hasSize(3);
  }

  @Test
  void load_twice_leavesStoreUnchanged() {
    LedgerDataset dataset = sampleDataset();
    LoadResult first = loader.load(project, dataset);
    Map<String, Long> before = store.countRows(first.projectId());

    LoadResult second = loader.load(project, dataset);

    assertThat(store.countRows(second.projectId())).isEqualTo(before);
    assertThat(second.projectId()).isEqualTo(first.projectId());
    assertThat(second.paymentsInserted()).isZero();
    assertThat(second.paymentsAlreadyPresent()).isEqualTo(6);
    assertThat(second.cancelledSalesInserted()).isZero();
    assertThat(second.cancelledSalesReused()).isEqualTo(4);
  }

  @Test
  void load_resoldUnit_keepsEachOwnersPaymentsApart() {
    loader.load(project, sampleDataset());

    List<SaleRow> sales = store.salesOfUnit("101");
    assertThat(sales).extracting(SaleRow::status)
        .containsExactlyInAnyOrder(SaleStatus.ACTIVE, SaleStatus.CANCELLED);

    SaleRow active = sales.stream().filter(s -> s.status() == SaleStatus.ACTIVE).findFirst()
        .orElseThrow();
    SaleRow cancelled = sales.stream().filter(s -> s.status() == SaleStatus.CANCELLED)
        .findFirst().orElseThrow();
    assertThat(active.clientId()).isEqualTo(store.clients.get("Jane Doe"));
    assertThat(cancelled.clientId()).isEqualTo(store.clients.get("John Roe"));

    assertThat(store.paymentsOf(store.saleIdOf(active)))
        .extracting(PaymentRow::paymentType, PaymentRow::amount)
        .containsExactly(tuple(
            PaymentType.RESERVATION, money("5000.00")));
    assertThat(store.paymentsOf(store.saleIdOf(cancelled)))
        .extracting(PaymentRow::paymentType, PaymentRow::amount)
        .containsExactlyInAnyOrder(
            tuple(PaymentType.RESERVATION, money("3000.00")),
            tuple(PaymentType.REIMBURSEMENT, money("-2000.00")));
  }

  @Test
  void load_activeSale_derivesPricesAndFinancedAmount() {
    loader.load(project, sampleDataset());

    SaleRow sale = store.salesOfUnit("101").stream()
        .filter(s -> s.status() == SaleStatus.ACTIVE).findFirst().orElseThrow();
    assertThat(sale.saleDate()).isEqualTo(LocalDate.of(2024, 1, 10));
    assertThat(sale.priceWithTax()).isEqualByComparingTo("109300");
    assertThat(sale.priceWithoutTax()).isEqualByComparingTo("100000.00");
    assertThat(sale.downPaymentAmount()).isEqualByComparingTo("10930");
    assertThat(sale.financedAmount()).isEqualByComparingTo("98370.00");
    assertThat(sale.salesRepId()).isEqualTo("Ana Gómez");
    assertThat(sale.notes()).isEqualTo("corner unit");

    UnitRow unit = store.units.get(sale.unitId());
    assertThat(unit.status()).isEqualTo(UnitStatus.SOLD);
    assertThat(unit.priceWithoutTax()).isEqualByComparingTo("100000.00");
  }

  @Test
  void load_missingReservationDate_usesEarliestPaymentOrSkips() {
    LoadResult result = loader.load(project, sampleDataset());

    SaleRow sale = store.salesOfUnit("205").get(0);
    assertThat(sale.saleDate()).isEqualTo(FEB);
    assertThat(sale.notes()).isEqualTo(LifecycleLoader.DERIVED_SALE_DATE_NOTE);
    assertThat(store.paymentsOf(store.saleIdOf(sale)))
        .extracting(PaymentRow::paymentDate, PaymentRow::paymentType)
        .containsExactly(
            tuple(FEB, PaymentType.RESERVATION),
            tuple(MAR, PaymentType.DOWN_PAYMENT));

    assertThat(store.salesOfUnit("206")).isEmpty();
    assertThat(result.salesSkippedNoSaleDate()).isEqualTo(1);
    assertThat(result.saleDatesDerived()).isEqualTo(3);
    assertThat(result.salesSkipped()).isEqualTo(1);
  }

  @Test
  void load_historyOnlyUnits_areCreatedAvailable() {
    loader.load(project, sampleDataset());

    assertThat(store.salesOfUnit("900")).singleElement()
        .extracting(SaleRow::status).isEqualTo(SaleStatus.CANCELLED);
    SaleRow refundOnly = store.salesOfUnit("300").get(0);
    assertThat(refundOnly.status()).isEqualTo(SaleStatus.CANCELLED);
    assertThat(refundOnly.notes()).isEqualTo(
        "Source: devolucion; " + LifecycleLoader.DERIVED_SALE_DATE_NOTE);
    assertThat(store.paymentsOf(store.saleIdOf(refundOnly)))
        .singleElement()
        .satisfies(p -> {
          assertThat(p.paymentType()).isEqualTo(PaymentType.REIMBURSEMENT);
          assertThat(p.amount()).isEqualByComparingTo("-1500");
          assertThat(p.notes()).isEqualTo(LifecycleLoader.PAYMENT_NOTE_PREFIX + "devolucion");
        });

    assertThat(store.units.values())
        .filteredOn(u -> u.unitNumber().equals("900") || u.unitNumber().equals("300"))
        .extracting(UnitRow::status)
        .containsOnly(UnitStatus.AVAILABLE);
  }

  @Test
  void load_salesRepsIncludeUnknownWithDisplayName() {
    loader.load(project, sampleDataset());

    assertThat(store.salesReps).containsOnlyKeys("Ana Gómez", "unknown");
    assertThat(store.salesReps.get("unknown").name()).isEqualTo("Unknown");
    assertThat(store.salesOfUnit("900").get(0).salesRepId()).isEqualTo("unknown");
  }

  @Test
  void load_recordWithoutClient_isSkippedWithItsPayments() {
    LedgerDataset dataset =
        new LedgerDataset(
            List.of(
                record(LifecycleSection.MAIN, 3, "101")
                    .rawStatus("2.reserva")
                    .reservationDate(JAN)
                    .observedPayment(paid(JAN, "500"))
                    .build()),
            List.of());

    LoadResult result = loader.load(project, dataset);

    assertThat(result.salesSkippedMissingClient()).isEqualTo(1);
    assertThat(result.orphanedPayments()).isEqualTo(1);
    assertThat(result.recordsWithOrphanedPayments()).isEqualTo(1);
    assertThat(store.sales).isEmpty();
    assertThat(store.payments).isEmpty();
    assertThat(store.units).hasSize(1);
  }

  @Test
  void load_writesInConfiguredBatchSize() {
    loader.load(project, sampleDataset());

    assertThat(store.batchSizes).isNotEmpty().allSatisfy(size -> assertThat(size).isBetween(1, 2));
  }

  @Test
  void load_projectWithoutSalesRepTable_writesNoReps() {
    SampleLedgerConfig config =
        new SampleLedgerConfig() {
          @Override
          public boolean isSalesRepTableEnabled() {
            return false;
          }
        };
    LoadResult result =
        loader.load(new ProjectDefinition("plain", "Plain", config), sampleDataset());

    assertThat(result.salesRepsUpserted()).isZero();
    assertThat(store.salesReps).isEmpty();
    assertThat(store.sales.values()).extracting(SaleRow::salesRepId).contains("unknown");
  }

  @Test
  void expectedPaymentRows_numberedPerUnitByDueDate() {
    List<ExpectedPaymentRow> rows =
        LifecycleLoader.expectedPaymentRows(7L, "budget", sampleDataset().expectedInstallments());

    assertThat(rows)
        .extracting(ExpectedPaymentRow::unitNumber, ExpectedPaymentRow::dueDate,
            ExpectedPaymentRow::installmentNumber)
        .containsExactly(
            tuple("205", JAN, 1),
            tuple("205", MAR, 2),
            tuple("101", JAN, 1));
    assertThat(rows).allSatisfy(r -> {
      assertThat(r.projectId()).isEqualTo(7L);
      assertThat(r.scheduleType()).isEqualTo("budget");
      assertThat(r.amount().scale()).isEqualTo(2);
    });
  }

  @Test
  void financedAmount_prefersExplicitBalance() {
    ParsedUnitRecord withBalance =
        record(LifecycleSection.MAIN, 3, "101").financedBalance(money("1234.5")).build();
    ParsedUnitRecord zeroBalance =
        record(LifecycleSection.MAIN, 3, "101").financedBalance(BigDecimal.ZERO).build();
    ParsedUnitRecord noPrice = record(LifecycleSection.MAIN, 3, "101").build();

    assertThat(LifecycleLoader.financedAmount(withBalance, money("9000"), money("1000")))
        .isEqualTo(money("1234.50"));
    assertThat(LifecycleLoader.financedAmount(zeroBalance, money("9000.00"), money("1000.00")))
        .isEqualByComparingTo("8000");
    assertThat(LifecycleLoader.financedAmount(noPrice, money("0.00"), money("0.00")))
        .isEqualTo(money("0.00"));
  }

  @Test
  void verify_readFailure_returnsEmptyCounts() {
    TableStore failing = mock(TableStore.class);
    when(failing.countRows(anyLong())).thenThrow(new IllegalStateException("connection reset"));

    LifecycleLoader verifying = new LifecycleLoader(failing, new LedgerImportProperties());

    assertThat(verifying.verify(1L)).isEmpty();
  }
}
