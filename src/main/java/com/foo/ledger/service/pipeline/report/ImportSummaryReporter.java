package com.foo.ledger.service.pipeline.report;

import com.foo.ledger.model.LedgerDataset;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.model.ParsedExpectedInstallment;
import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.model.PaymentObservation;
import com.foo.ledger.normalize.FieldNormalizer;
import com.foo.ledger.normalize.SaleStatus;
import com.foo.ledger.normalize.UnitStatus;
import com.foo.ledger.service.contract.ProjectDefinition;
import com.foo.ledger.service.pipeline.load.LoadResult;
import com.foo.ledger.validation.Severity;
import com.foo.ledger.validation.ValidationFinding;
import com.foo.ledger.validation.ValidationReport;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Console output of an import: validation findings, the dry-run summary and load counts. */
@Slf4j
@Component
public class ImportSummaryReporter {

  public void logValidation(ValidationReport report) {
    for (ValidationFinding finding : report.getFindings()) {
      switch (finding.severity()) {
        case ERROR -> log.error("  ERROR: {}", finding.message());
        case WARNING -> log.warn("  WARNING: {}", finding.message());
        case INFO -> log.info("  INFO: {}", finding.message());
      }
    }
    log.info(
        "Validation: {} errors, {} warnings",
        report.count(Severity.ERROR),
        report.count(Severity.WARNING));
  }

  public DryRunSummary summarize(LedgerDataset dataset, FieldNormalizer normalizer) {
    List<ParsedUnitRecord> main = dataset.mainRecords();

    Map<UnitStatus, Long> unitsByStatus = new EnumMap<>(UnitStatus.class);
    for (ParsedUnitRecord record : main) {
      unitsByStatus.merge(normalizer.normalizeUnitStatus(record.getRawStatus()), 1L, Long::sum);
    }

    Set<String> clients =
        dataset.records().stream()
            .map(r -> normalizer.normalizeClientName(r.getClientName()))
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());

    int activeSales = 0;
    int activePayments = 0;
    int cancelledPayments = 0;
    int reimbursements = 0;
    Map<LifecycleSection, Long> cancelledBySection = new EnumMap<>(LifecycleSection.class);
    for (ParsedUnitRecord record : dataset.records()) {
      SaleStatus status = saleStatus(record, normalizer);
      if (status == SaleStatus.ACTIVE) {
        activeSales++;
        activePayments += record.getObservedPayments().size();
      } else if (status == SaleStatus.CANCELLED) {
        cancelledBySection.merge(record.getSection(), 1L, Long::sum);
        if (record.getSection().isRefund()) {
          reimbursements += record.getObservedPayments().size();
        } else {
          cancelledPayments += record.getObservedPayments().size();
        }
      }
    }

    Set<String> historicalKeys =
        dataset.historicalRecords().stream()
            .map(ParsedUnitRecord::getUnitKey)
            .collect(Collectors.toSet());
    int resold =
        (int)
            main.stream()
                .filter(
                    r -> normalizer.normalizeUnitStatus(r.getRawStatus()) != UnitStatus.AVAILABLE)
                .map(ParsedUnitRecord::getUnitKey)
                .filter(historicalKeys::contains)
                .distinct()
                .count();

    return DryRunSummary.builder()
        .unitsByStatus(unitsByStatus)
        .uniqueClients(clients.size())
        .activeSales(activeSales)
        .cancelledSalesBySection(cancelledBySection)
        .activePayments(activePayments)
        .cancelledPayments(cancelledPayments)
        .reimbursementPayments(reimbursements)
        .expectedInstallments(dataset.expectedInstallments().size())
        .budgetUnits(
            (int)
                dataset.expectedInstallments().stream()
                    .map(ParsedExpectedInstallment::unitKey)
                    .distinct()
                    .count())
        .resoldUnits(resold)
        .build();
  }

  public DryRunSummary logDryRun(ProjectDefinition project, LedgerDataset dataset) {
    FieldNormalizer normalizer = project.getNormalizer();
    DryRunSummary summary = summarize(dataset, normalizer);

    log.info("=== DRY RUN SUMMARY: {} ===", project.getDisplayName());
    log.info("Units: {}", dataset.mainRecords().size());
    summary.unitsByStatus().forEach((status, count) -> log.info("  {}: {}", status.code(), count));
    log.info("Unique clients: {}", summary.uniqueClients());
    log.info(
        "Sales: {} ({} active, {} cancelled)",
        summary.activeSales() + summary.cancelledSales(),
        summary.activeSales(),
        summary.cancelledSales());
    summary
        .cancelledSalesBySection()
        .forEach((section, count) -> log.info("  cancelled from {}: {}", section.label(), count));
    log.info(
        "Payments: {} ({} active, {} cancelled, {} reimbursements)",
        summary.activePayments() + summary.cancelledPayments() + summary.reimbursementPayments(),
        summary.activePayments(),
        summary.cancelledPayments(),
        summary.reimbursementPayments());
    if (project.getConfig().getBudgetLayout() != null) {
      log.info(
          "Expected payments (budget): {} across {} units",
          summary.expectedInstallments(),
          summary.budgetUnits());
    }
    log.info("Units with lifecycle history (resold): {}", summary.resoldUnits());

    logSampleLifecycle(dataset, normalizer);
    logSampleBudget(dataset);
    logSampleRefund(dataset);

    log.info("Run with --execute to write to the database.");
    return summary;
  }

  public void logLoad(LoadResult result, Map<String, Long> counts) {
    log.info("=== LOAD COMPLETE (project id {}) ===", result.projectId());
    log.info(
        "Units: {} upserted, {} created from history",
        result.unitsUpserted(),
        result.unitsSynthesized());
    log.info("Clients: {}", result.clientsUpserted());
    log.info(
        "Sales: {} active, {} cancelled inserted, {} cancelled already present, {} skipped",
        result.activeSales(),
        result.cancelledSalesInserted(),
        result.cancelledSalesReused(),
        result.salesSkipped());
    log.info(
        "Payments: {} inserted, {} already present, {} orphaned",
        result.paymentsInserted(),
        result.paymentsAlreadyPresent(),
        result.orphanedPayments());
    log.info("Expected payments: {}", result.expectedPaymentsWritten());
    if (!counts.isEmpty()) {
      log.info("Verification: {}", counts);
    }
  }

  private void logSampleLifecycle(LedgerDataset dataset, FieldNormalizer normalizer) {
    Set<String> historicalKeys =
        dataset.historicalRecords().stream()
            .map(ParsedUnitRecord::getUnitKey)
            .collect(Collectors.toSet());
    dataset.mainRecords().stream()
        .filter(r -> historicalKeys.contains(r.getUnitKey()))
        .findFirst()
        .ifPresent(
            sample -> {
              log.info("Sample lifecycle unit {}:", sample.getUnitKey());
              dataset.records().stream()
                  .filter(r -> r.getUnitKey().equals(sample.getUnitKey()))
                  .forEach(
                      r ->
                          log.info(
                              "  [{}] client={} status={} payments={}",
                              r.getSection().label(),
                              normalizer.normalizeClientName(r.getClientName()),
                              r.getRawStatus(),
                              r.getObservedPayments().size()));
            });
  }

  private void logSampleBudget(LedgerDataset dataset) {
    if (dataset.expectedInstallments().isEmpty()) {
      return;
    }
    String unitKey = dataset.expectedInstallments().get(0).unitKey();
    Map<LocalDate, BigDecimal> schedule =
        dataset.expectedInstallments().stream()
            .filter(e -> e.unitKey().equals(unitKey))
            .collect(
                Collectors.toMap(
                    ParsedExpectedInstallment::dueDate,
                    ParsedExpectedInstallment::amount,
                    (a, b) -> b,
                    TreeMap::new));
    log.info("Sample budget schedule for unit {}: {}", unitKey, schedule);
  }

  private void logSampleRefund(LedgerDataset dataset) {
    dataset.bySection(LifecycleSection.REFUND).stream()
        .filter(ParsedUnitRecord::hasPayments)
        .findFirst()
        .ifPresent(
            r ->
                log.info(
                    "Sample refund unit {} ({}): {}",
                    r.getUnitKey(),
                    r.getClientName(),
                    r.getPaymentsByDate().stream()
                        .map(PaymentObservation::amount)
                        .collect(Collectors.toList())));
  }

  private static SaleStatus saleStatus(ParsedUnitRecord record, FieldNormalizer normalizer) {
    if (record.getSection().impliesCancelledSale()) {
      return SaleStatus.CANCELLED;
    }
    return normalizer.normalizeSaleStatus(record.getRawStatus());
  }
}
