package com.foo.ledger.service.pipeline.report;

import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.normalize.UnitStatus;
import java.util.Map;
import lombok.Builder;

/** What a load of the parsed workbook would write, computed without touching the store. */
@Builder
public record DryRunSummary(
    Map<UnitStatus, Long> unitsByStatus,
    int uniqueClients,
    int activeSales,
    Map<LifecycleSection, Long> cancelledSalesBySection,
    int activePayments,
    int cancelledPayments,
    int reimbursementPayments,
    int expectedInstallments,
    int budgetUnits,
    int resoldUnits) {

  public long cancelledSales() {
    return cancelledSalesBySection.values().stream().mapToLong(Long::longValue).sum();
  }
}
