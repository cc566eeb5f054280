package com.foo.ledger.validation;

import com.foo.ledger.model.LedgerDataset;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.model.ParsedExpectedInstallment;
import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.normalize.FieldNormalizer;
import com.foo.ledger.normalize.UnitStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Checks one parsed workbook as a whole before anything is written.
 *
 * <p>Duplicate main-section units and unrecognized main-section statuses are errors. Everything
 * else is advisory.
 */
@Component
public class CrossSectionValidator {

  static final int SAMPLE_SIZE = 10;

  /**
   * @param checkBudget whether the project has a budget sheet to compare against
   */
  public ValidationReport validate(
      LedgerDataset dataset, FieldNormalizer normalizer, boolean checkBudget) {
    ValidationReport report = new ValidationReport();
    List<ParsedUnitRecord> main = dataset.mainRecords();
    List<ParsedUnitRecord> historical = dataset.historicalRecords();

    Set<String> mainKeys = keys(main);
    Set<String> historicalKeys = keys(historical);

    checkDuplicateMainKeys(main, report);
    checkUnknownStatuses(main, normalizer, report);
    checkResoldUnits(main, historicalKeys, normalizer, report);

    Set<String> historicalOnly = new TreeSet<>(historicalKeys);
    historicalOnly.removeAll(mainKeys);
    if (!historicalOnly.isEmpty()) {
      report.add(
          ValidationFinding.warning(
              "Cancelled/refund units not in main unit list (%d): %s; will create unit from history"
                  .formatted(historicalOnly.size(), sample(historicalOnly))));
    }

    if (checkBudget) {
      checkBudgetCoverage(dataset.expectedInstallments(), mainKeys, historicalKeys, report);
    }

    List<String> missingClient =
        main.stream()
            .filter(r -> normalizer.normalizeSaleStatus(r.getRawStatus()) != null)
            .filter(r -> normalizer.normalizeClientName(r.getClientName()) == null)
            .map(ParsedUnitRecord::getUnitKey)
            .collect(Collectors.toList());
    if (!missingClient.isEmpty()) {
      report.add(
          ValidationFinding.warning(
              "Sold/reserved units missing client (%d): %s"
                  .formatted(missingClient.size(), sample(missingClient))));
    }

    checkUnmatchedRefunds(dataset, normalizer, report);
    return report;
  }

  private void checkDuplicateMainKeys(List<ParsedUnitRecord> main, ValidationReport report) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (ParsedUnitRecord record : main) {
      counts.merge(record.getUnitKey(), 1, Integer::sum);
    }
    Set<String> duplicates =
        counts.entrySet().stream()
            .filter(e -> e.getValue() > 1)
            .map(Map.Entry::getKey)
            .collect(Collectors.toCollection(TreeSet::new));
    if (!duplicates.isEmpty()) {
      report.add(ValidationFinding.error("Duplicate unit key in main section: " + duplicates));
    }
  }

  private void checkUnknownStatuses(
      List<ParsedUnitRecord> main, FieldNormalizer normalizer, ValidationReport report) {
    for (ParsedUnitRecord record : main) {
      String raw = record.getRawStatus();
      if (raw != null && !raw.isBlank() && !normalizer.isKnownStatus(raw)) {
        report.add(
            ValidationFinding.error(
                "Unit %s (row %d): unknown status '%s'"
                    .formatted(record.getUnitKey(), record.getRowNumber(), raw)));
      }
    }
  }

  private void checkResoldUnits(
      List<ParsedUnitRecord> main,
      Set<String> historicalKeys,
      FieldNormalizer normalizer,
      ValidationReport report) {
    Set<String> resold =
        main.stream()
            .filter(r -> normalizer.normalizeUnitStatus(r.getRawStatus()) != UnitStatus.AVAILABLE)
            .map(ParsedUnitRecord::getUnitKey)
            .filter(historicalKeys::contains)
            .collect(Collectors.toCollection(TreeSet::new));
    if (!resold.isEmpty()) {
      report.add(
          ValidationFinding.info(
              "%d units have lifecycle history (cancelled then resold): %s"
                  .formatted(resold.size(), sample(resold))));
    }
  }

  private void checkBudgetCoverage(
      List<ParsedExpectedInstallment> expected,
      Set<String> mainKeys,
      Set<String> historicalKeys,
      ValidationReport report) {
    Set<String> budgetKeys =
        expected.stream()
            .map(ParsedExpectedInstallment::unitKey)
            .collect(Collectors.toCollection(TreeSet::new));
    Set<String> actualKeys = new TreeSet<>(mainKeys);
    actualKeys.addAll(historicalKeys);

    Set<String> budgetOnly = new TreeSet<>(budgetKeys);
    budgetOnly.removeAll(actualKeys);
    Set<String> actualsOnly = new TreeSet<>(actualKeys);
    actualsOnly.removeAll(budgetKeys);

    if (!budgetOnly.isEmpty()) {
      report.add(
          ValidationFinding.warning(
              "Units in budget but not in actuals (%d): %s"
                  .formatted(budgetOnly.size(), sample(budgetOnly))));
    }
    if (!actualsOnly.isEmpty()) {
      report.add(
          ValidationFinding.warning(
              "Units in actuals but not in budget (%d): %s"
                  .formatted(actualsOnly.size(), sample(actualsOnly))));
    }
  }

  /** A refund with no cancellation for the same unit and client gets its own cancelled sale. */
  private void checkUnmatchedRefunds(
      LedgerDataset dataset, FieldNormalizer normalizer, ValidationReport report) {
    List<ParsedUnitRecord> refunds = dataset.bySection(LifecycleSection.REFUND);
    if (refunds.isEmpty()) {
      return;
    }
    Set<String> cancellations =
        dataset.historicalRecords().stream()
            .filter(r -> r.getSection() != LifecycleSection.REFUND)
            .map(r -> pairKey(r, normalizer))
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    Set<String> unmatched =
        refunds.stream()
            .map(r -> pairKey(r, normalizer))
            .filter(Objects::nonNull)
            .filter(pair -> !cancellations.contains(pair))
            .collect(Collectors.toCollection(TreeSet::new));
    if (!unmatched.isEmpty()) {
      report.add(
          ValidationFinding.warning(
              ("Refund records with no matching cancellation (%d): %s;"
                      + " will create cancelled sale from refund data")
                  .formatted(unmatched.size(), unmatched)));
    }
  }

  private static String pairKey(ParsedUnitRecord record, FieldNormalizer normalizer) {
    String client = normalizer.normalizeClientName(record.getClientName());
    return client == null ? null : "(%s, %s)".formatted(record.getUnitKey(), client);
  }

  private static Set<String> keys(List<ParsedUnitRecord> records) {
    return records.stream()
        .map(ParsedUnitRecord::getUnitKey)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static List<String> sample(Iterable<String> keys) {
    List<String> sample = new ArrayList<>();
    for (String key : keys) {
      if (sample.size() == SAMPLE_SIZE) {
        break;
      }
      sample.add(key);
    }
    return sample;
  }
}
