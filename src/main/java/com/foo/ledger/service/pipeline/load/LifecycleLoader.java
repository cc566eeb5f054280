package com.foo.ledger.service.pipeline.load;

import com.foo.ledger.config.LedgerImportConfig;
import com.foo.ledger.config.LedgerImportProperties;
import com.foo.ledger.model.LedgerDataset;
import com.foo.ledger.model.ParsedExpectedInstallment;
import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.model.PaymentObservation;
import com.foo.ledger.model.RecordKey;
import com.foo.ledger.normalize.FieldNormalizer;
import com.foo.ledger.normalize.SaleStatus;
import com.foo.ledger.normalize.UnitStatus;
import com.foo.ledger.service.contract.ExpectedPaymentRow;
import com.foo.ledger.service.contract.PaymentRow;
import com.foo.ledger.service.contract.PaymentType;
import com.foo.ledger.service.contract.ProjectDefinition;
import com.foo.ledger.service.contract.ProjectRow;
import com.foo.ledger.service.contract.SaleRow;
import com.foo.ledger.service.contract.SalesRepRow;
import com.foo.ledger.service.contract.TableStore;
import com.foo.ledger.service.contract.UnitRow;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a validated dataset to the {@link TableStore} in dependency order: project, units,
 * clients, sales reps, sales, payments, expected payments.
 *
 * <p>Units come from the main section only. Every sellable record becomes its own sale, and its
 * payments attach to that sale alone, so a unit that was cancelled and resold keeps each
 * client's history apart. Active sales are upserted per unit; cancelled sales are looked up by
 * (unit, client) before inserting. Loading the same dataset again changes nothing.
 *
 * <p>A record whose unit, client or sale date cannot be resolved loses its sale and payments
 * with a warning; the rest of the batch continues.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LifecycleLoader {

  static final String PAYMENT_NOTE_PREFIX = "ETL import from ";
  static final String DERIVED_SALE_DATE_NOTE = "sale_date derived from earliest payment";

  private final TableStore store;
  private final LedgerImportProperties properties;

  @Transactional
  public LoadResult load(ProjectDefinition project, LedgerDataset dataset) {
    LoadContext ctx = new LoadContext(project);

    upsertProject(ctx);
    upsertUnits(ctx, dataset);
    upsertClients(ctx, dataset);
    if (ctx.config.isSalesRepTableEnabled()) {
      upsertSalesReps(ctx, dataset);
    }
    writeSales(ctx, dataset);
    writePayments(ctx, dataset);
    upsertExpectedPayments(ctx, dataset.expectedInstallments());

    return ctx.result.build();
  }

  /** Per-table row counts for the project. Diagnostic only: failures are logged, not thrown. */
  public Map<String, Long> verify(long projectId) {
    try {
      Map<String, Long> counts = store.countRows(projectId);
      counts.forEach((table, count) -> log.info("  {}: {} rows", table, count));
      return counts;
    } catch (RuntimeException e) {
      log.warn("Verification read-back failed: {}", e.getMessage());
      return Map.of();
    }
  }

  private void upsertProject(LoadContext ctx) {
    log.info("Upserting project '{}'...", ctx.project.getProjectName());
    ctx.projectId =
        store.upsertProject(
            new ProjectRow(ctx.project.getProjectName(), ctx.project.getDisplayName()));
    ctx.result.projectId(ctx.projectId);
    log.info("Project ID: {}", ctx.projectId);
  }

  private void upsertUnits(LoadContext ctx, LedgerDataset dataset) {
    List<ParsedUnitRecord> main = dataset.mainRecords();
    log.info("Upserting {} units (main section only)...", main.size());

    List<UnitRow> rows =
        main.stream()
            .map(r -> unitRow(ctx, r, ctx.normalizer.normalizeUnitStatus(r.getRawStatus())))
            .collect(Collectors.toList());
    for (List<UnitRow> batch : batches(rows)) {
      ctx.unitIds.putAll(store.upsertUnits(batch));
    }
    ctx.result.unitsUpserted(rows.size());

    // Historical-only keys still need a unit for their cancelled sales.
    Set<String> mainKeys =
        main.stream().map(ParsedUnitRecord::getUnitKey).collect(Collectors.toSet());
    Map<String, UnitRow> synthesized = new LinkedHashMap<>();
    for (ParsedUnitRecord record : dataset.historicalRecords()) {
      if (!mainKeys.contains(record.getUnitKey())) {
        synthesized.putIfAbsent(
            record.getUnitKey(), unitRow(ctx, record, UnitStatus.AVAILABLE));
      }
    }
    if (!synthesized.isEmpty()) {
      log.info(
          "Creating {} units known only from cancelled/refund sections...", synthesized.size());
      for (List<UnitRow> batch : batches(new ArrayList<>(synthesized.values()))) {
        ctx.unitIds.putAll(store.insertMissingUnits(batch));
      }
    }
    ctx.result.unitsSynthesized(synthesized.size());
    log.info("Upserted {} units, got {} IDs", rows.size(), ctx.unitIds.size());
  }

  private UnitRow unitRow(LoadContext ctx, ParsedUnitRecord record, UnitStatus status) {
    return UnitRow.builder()
        .projectId(ctx.projectId)
        .unitNumber(record.getUnitKey())
        .unitType(record.getUnitType())
        .priceWithTax(money(record.getPriceWithTax()))
        .priceWithoutTax(money(ctx.config.getTaxStrategy().priceWithoutTax(record)))
        .downPaymentAmount(money(record.getDownPayment()))
        .status(status)
        .build();
  }

  /** Every client from every section, including clients who have since cancelled. */
  private void upsertClients(LoadContext ctx, LedgerDataset dataset) {
    Set<String> names = new LinkedHashSet<>();
    for (ParsedUnitRecord record : dataset.records()) {
      String name = ctx.normalizer.normalizeClientName(record.getClientName());
      if (name != null) {
        names.add(name);
      }
    }
    log.info("Upserting {} clients...", names.size());
    for (List<String> batch : batches(new ArrayList<>(names))) {
      ctx.clientIds.putAll(store.upsertClients(batch));
    }
    ctx.result.clientsUpserted(names.size());
    log.info("Upserted {} clients, got {} IDs", names.size(), ctx.clientIds.size());
  }

  private void upsertSalesReps(LoadContext ctx, LedgerDataset dataset) {
    Map<String, String> displayNames = ctx.config.getSalesRepDisplayNames();
    Map<String, SalesRepRow> reps = new LinkedHashMap<>();
    for (ParsedUnitRecord record : dataset.records()) {
      String id = salesRepId(ctx, record);
      reps.putIfAbsent(id, new SalesRepRow(id, displayNames.getOrDefault(id, id)));
    }
    log.info("Upserting {} sales reps...", reps.size());
    for (List<SalesRepRow> batch : batches(new ArrayList<>(reps.values()))) {
      store.upsertSalesReps(batch);
    }
    ctx.result.salesRepsUpserted(reps.size());
  }

  private void writeSales(LoadContext ctx, LedgerDataset dataset) {
    List<PreparedSale> active = new ArrayList<>();
    List<PreparedSale> cancelled = new ArrayList<>();
    int eligible = 0;

    for (ParsedUnitRecord record : dataset.records()) {
      SaleStatus status = saleStatus(ctx, record);
      if (status == null) {
        continue;
      }
      eligible++;
      Optional<PreparedSale> prepared = prepareSale(ctx, record, status);
      if (prepared.isEmpty()) {
        continue;
      }
      if (status == SaleStatus.ACTIVE) {
        active.add(prepared.get());
      } else {
        cancelled.add(prepared.get());
      }
    }
    log.info("Processing {} sales (active + cancelled history)...", eligible);

    for (List<PreparedSale> batch : batches(active)) {
      Map<Long, Long> saleIdsByUnit =
          store.upsertActiveSales(
              batch.stream().map(PreparedSale::row).collect(Collectors.toList()));
      for (PreparedSale sale : batch) {
        Long saleId = saleIdsByUnit.get(sale.row().unitId());
        if (saleId != null) {
          ctx.saleIds.put(sale.record().getKey(), saleId);
        }
      }
    }
    ctx.result.activeSales(active.size());
    log.info("Active sales upserted: {}", active.size());

    int inserted = 0;
    for (PreparedSale sale : cancelled) {
      SaleRow row = sale.row();
      Optional<Long> existing = store.findCancelledSale(row.unitId(), row.clientId());
      long saleId;
      if (existing.isPresent()) {
        saleId = existing.get();
      } else {
        saleId = store.insertSale(row);
        inserted++;
      }
      ctx.saleIds.put(sale.record().getKey(), saleId);
    }
    ctx.result.cancelledSalesInserted(inserted).cancelledSalesReused(cancelled.size() - inserted);
    log.info(
        "Cancelled sales: {} inserted, {} already existed", inserted, cancelled.size() - inserted);
    log.info(
        "Total sales mapped: {} (active: {}, cancelled: {})",
        ctx.saleIds.size(),
        active.size(),
        cancelled.size());

    ctx.result
        .salesSkippedMissingUnit(ctx.skippedMissingUnit)
        .salesSkippedMissingClient(ctx.skippedMissingClient)
        .salesSkippedNoSaleDate(ctx.skippedNoSaleDate)
        .saleDatesDerived(ctx.saleDatesDerived);
    if (ctx.skippedNoSaleDate > 0) {
      log.warn(
          "{} sellable records had no reservation date and no payments and were not loaded",
          ctx.skippedNoSaleDate);
    }
  }

  /**
   * Sale status of a record, or {@code null} when it stands for no sale. Sections that always
   * mean a cancellation override the status text.
   */
  private SaleStatus saleStatus(LoadContext ctx, ParsedUnitRecord record) {
    if (record.getSection().impliesCancelledSale()) {
      return SaleStatus.CANCELLED;
    }
    return ctx.normalizer.normalizeSaleStatus(record.getRawStatus());
  }

  private Optional<PreparedSale> prepareSale(
      LoadContext ctx, ParsedUnitRecord record, SaleStatus status) {
    Long unitId = ctx.unitIds.get(record.getUnitKey());
    if (unitId == null) {
      log.warn(
          "Skipping sale for unit {} ({}): unit id not found",
          record.getUnitKey(),
          record.getKey());
      ctx.skippedMissingUnit++;
      return Optional.empty();
    }

    String clientName = ctx.normalizer.normalizeClientName(record.getClientName());
    Long clientId = clientName == null ? null : ctx.clientIds.get(clientName);
    if (clientId == null) {
      log.warn(
          "Unit {} ({}): no client id for '{}', skipping sale",
          record.getUnitKey(),
          record.getKey(),
          record.getClientName());
      ctx.skippedMissingClient++;
      return Optional.empty();
    }

    List<String> notes = new ArrayList<>();
    if (record.getNotes() != null) {
      notes.add(record.getNotes());
    }
    if (record.getSection().isHistorical()) {
      notes.add("Source: " + record.getSection().label());
    }

    LocalDate saleDate = record.getReservationDate();
    if (saleDate == null) {
      Optional<LocalDate> earliest = record.getEarliestPaymentDate();
      if (earliest.isEmpty()) {
        log.warn(
            "Unit {} ({}): no reservation date and no payments, cannot derive sale date, skipping",
            record.getUnitKey(),
            record.getKey());
        ctx.skippedNoSaleDate++;
        return Optional.empty();
      }
      saleDate = earliest.get();
      notes.add(DERIVED_SALE_DATE_NOTE);
      ctx.saleDatesDerived++;
      log.debug(
          "Unit {}: no reservation date, using earliest payment {}",
          record.getUnitKey(),
          saleDate);
    }

    BigDecimal price = money(record.getPriceWithTax());
    BigDecimal downPayment = money(record.getDownPayment());

    SaleRow row =
        SaleRow.builder()
            .projectId(ctx.projectId)
            .unitId(unitId)
            .clientId(clientId)
            .salesRepId(salesRepId(ctx, record))
            .saleDate(saleDate)
            .priceWithTax(price)
            .priceWithoutTax(money(ctx.config.getTaxStrategy().priceWithoutTax(record)))
            .downPaymentAmount(downPayment)
            .financedAmount(financedAmount(record, price, downPayment))
            .status(status)
            .referralApplies(false)
            .specialCase(record.getSpecialCase() != null)
            .specialCaseType(record.getSpecialCase())
            .observations(record.getObservations())
            .notes(notes.isEmpty() ? null : String.join("; ", notes))
            .build();
    return Optional.of(new PreparedSale(record, row));
  }

  /** Explicit balance when present, otherwise price less down payment, otherwise zero. */
  static BigDecimal financedAmount(
      ParsedUnitRecord record, BigDecimal price, BigDecimal downPayment) {
    BigDecimal balance = record.getFinancedBalance();
    if (balance != null && balance.signum() != 0) {
      return money(balance);
    }
    if (price.signum() != 0) {
      return price.subtract(downPayment);
    }
    return money(null);
  }

  private String salesRepId(LoadContext ctx, ParsedUnitRecord record) {
    String rep = ctx.normalizer.normalizeRepName(record.getSalesRepRaw());
    return rep != null ? rep : ctx.config.getUnknownSalesRepId();
  }

  private void writePayments(LoadContext ctx, LedgerDataset dataset) {
    List<PaymentRow> rows = new ArrayList<>();
    int orphanedRecords = 0;
    int orphanedPayments = 0;

    for (ParsedUnitRecord record : dataset.records()) {
      if (!record.hasPayments()) {
        continue;
      }
      Long saleId = ctx.saleIds.get(record.getKey());
      if (saleId == null) {
        orphanedRecords++;
        orphanedPayments += record.getObservedPayments().size();
        log.debug(
            "Unit {} ({}): {} payments orphaned, no sale id",
            record.getUnitKey(),
            record.getKey(),
            record.getObservedPayments().size());
        continue;
      }
      rows.addAll(paymentRows(saleId, record));
    }

    log.info(
        "Inserting {} actual payments ({} records skipped, no sale)...",
        rows.size(),
        orphanedRecords);
    int inserted = 0;
    for (List<PaymentRow> batch : batches(rows)) {
      inserted += store.insertMissingPayments(batch);
    }
    ctx.result
        .paymentsInserted(inserted)
        .paymentsAlreadyPresent(rows.size() - inserted)
        .recordsWithOrphanedPayments(orphanedRecords)
        .orphanedPayments(orphanedPayments);
    if (orphanedPayments > 0) {
      log.warn(
          "{} payments from {} records dropped: their sale was not loaded",
          orphanedPayments,
          orphanedRecords);
    }
    log.info("Inserted {} actual payments, {} already present", inserted, rows.size() - inserted);
  }

  /**
   * Chronological payments of one record. The first is the reservation and the rest are down
   * payments; in a refund section every payment is a negative reimbursement.
   */
  static List<PaymentRow> paymentRows(long saleId, ParsedUnitRecord record) {
    String note = PAYMENT_NOTE_PREFIX + record.getSection().label();
    boolean refund = record.getSection().isRefund();
    List<PaymentObservation> payments = record.getPaymentsByDate();

    List<PaymentRow> rows = new ArrayList<>(payments.size());
    for (int i = 0; i < payments.size(); i++) {
      PaymentObservation payment = payments.get(i);
      PaymentType type;
      BigDecimal amount = money(payment.amount());
      if (refund) {
        type = PaymentType.REIMBURSEMENT;
        amount = amount.abs().negate();
      } else {
        type = i == 0 ? PaymentType.RESERVATION : PaymentType.DOWN_PAYMENT;
      }
      rows.add(new PaymentRow(saleId, payment.date(), amount, type, note));
    }
    return rows;
  }

  private void upsertExpectedPayments(LoadContext ctx, List<ParsedExpectedInstallment> expected) {
    log.info("Upserting {} expected payments...", expected.size());
    List<ExpectedPaymentRow> rows =
        expectedPaymentRows(ctx.projectId, ctx.config.getScheduleType(), expected);
    int written = 0;
    for (List<ExpectedPaymentRow> batch : batches(rows)) {
      written += store.upsertExpectedPayments(batch);
    }
    ctx.result.expectedPaymentsWritten(written);
    log.info("Upserted {} expected payments", written);
  }

  /** Installments numbered from 1 per unit in due-date order. */
  static List<ExpectedPaymentRow> expectedPaymentRows(
      long projectId, String scheduleType, List<ParsedExpectedInstallment> expected) {
    Map<String, List<ParsedExpectedInstallment>> byUnit =
        expected.stream()
            .collect(
                Collectors.groupingBy(
                    ParsedExpectedInstallment::unitKey, LinkedHashMap::new, Collectors.toList()));

    List<ExpectedPaymentRow> rows = new ArrayList<>(expected.size());
    byUnit.forEach(
        (unitKey, installments) -> {
          List<ParsedExpectedInstallment> sorted = new ArrayList<>(installments);
          sorted.sort(Comparator.comparing(ParsedExpectedInstallment::dueDate));
          for (int i = 0; i < sorted.size(); i++) {
            ParsedExpectedInstallment installment = sorted.get(i);
            rows.add(
                new ExpectedPaymentRow(
                    projectId,
                    unitKey,
                    installment.dueDate(),
                    money(installment.amount()),
                    i + 1,
                    scheduleType));
          }
        });
    return rows;
  }

  private <T> List<List<T>> batches(List<T> items) {
    int size = properties.getBatchSize();
    List<List<T>> batches = new ArrayList<>();
    for (int i = 0; i < items.size(); i += size) {
      batches.add(items.subList(i, Math.min(i + size, items.size())));
    }
    return batches;
  }

  static BigDecimal money(BigDecimal value) {
    return (value != null ? value : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
  }

  /** State of one load run. Sale ids are tracked per parsed record, not per unit. */
  private static final class LoadContext {

    final ProjectDefinition project;
    final LedgerImportConfig config;
    final FieldNormalizer normalizer;
    final LoadResult.LoadResultBuilder result = LoadResult.builder();

    long projectId;
    final Map<String, Long> unitIds = new HashMap<>();
    final Map<String, Long> clientIds = new HashMap<>();
    final Map<RecordKey, Long> saleIds = new LinkedHashMap<>();

    int skippedMissingUnit;
    int skippedMissingClient;
    int skippedNoSaleDate;
    int saleDatesDerived;

    LoadContext(ProjectDefinition project) {
      this.project = project;
      this.config = project.getConfig();
      this.normalizer = project.getNormalizer();
    }
  }
}
