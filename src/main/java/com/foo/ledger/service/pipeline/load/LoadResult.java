package com.foo.ledger.service.pipeline.load;

import lombok.Builder;

/** Counts of one load. Skips are per record and never fail the run. */
@Builder
public record LoadResult(
    long projectId,
    int unitsUpserted,
    int unitsSynthesized,
    int clientsUpserted,
    int salesRepsUpserted,
    int activeSales,
    int cancelledSalesInserted,
    int cancelledSalesReused,
    int salesSkippedNoSaleDate,
    int salesSkippedMissingUnit,
    int salesSkippedMissingClient,
    int saleDatesDerived,
    int paymentsInserted,
    int paymentsAlreadyPresent,
    int recordsWithOrphanedPayments,
    int orphanedPayments,
    int expectedPaymentsWritten) {

  public int salesSkipped() {
    return salesSkippedNoSaleDate + salesSkippedMissingUnit + salesSkippedMissingClient;
  }
}
