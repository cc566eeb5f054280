package com.foo.ledger.model;

import java.util.List;
import java.util.stream.Collectors;

/** Everything parsed from one workbook for one project, in sheet order. */
public record LedgerDataset(
    List<ParsedUnitRecord> records, List<ParsedExpectedInstallment> expectedInstallments) {

  public LedgerDataset {
    records = List.copyOf(records);
    expectedInstallments = List.copyOf(expectedInstallments);
  }

  public List<ParsedUnitRecord> mainRecords() {
    return bySection(LifecycleSection.MAIN);
  }

  public List<ParsedUnitRecord> historicalRecords() {
    return records.stream()
        .filter(r -> r.getSection().isHistorical())
        .collect(Collectors.toList());
  }

  public List<ParsedUnitRecord> bySection(LifecycleSection section) {
    return records.stream().filter(r -> r.getSection() == section).collect(Collectors.toList());
  }
}
