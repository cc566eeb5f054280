package com.foo.ledger.service.contract;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Destination of a ledger load. Every write is keyed by a natural key so that loading the same
 * workbook twice leaves the store unchanged.
 *
 * <p>Conflict keys: projects by name, units by (project, unit number), clients by full name,
 * sales reps by id, sales by unit among active sales only, expected payments by (project, unit
 * number, due date, schedule type).
 *
 * <p>Implementations assume a single writer per project. {@link #findCancelledSale} followed by
 * {@link #insertSale} is not atomic.
 */
public interface TableStore {

  /** @return the project id */
  long upsertProject(ProjectRow row);

  /** Inserts or updates units. @return unit number to unit id, for every given row */
  Map<String, Long> upsertUnits(List<UnitRow> rows);

  /**
   * Inserts units that do not exist yet and leaves existing ones untouched.
   *
   * @return unit number to unit id, for every given row
   */
  Map<String, Long> insertMissingUnits(List<UnitRow> rows);

  /** @return full name to client id, for every given name */
  Map<String, Long> upsertClients(Collection<String> fullNames);

  void upsertSalesReps(List<SalesRepRow> rows);

  /**
   * Inserts or updates the active sale of each row's unit. Rows must carry status active.
   *
   * @return unit id to sale id
   */
  Map<Long, Long> upsertActiveSales(List<SaleRow> rows);

  /** Existing cancelled sale of this unit to this client, if any. */
  Optional<Long> findCancelledSale(long unitId, long clientId);

  /** @return the new sale id */
  long insertSale(SaleRow row);

  /**
   * Inserts payments not already recorded for their sale with the same date, amount and type.
   *
   * @return the number of rows inserted
   */
  int insertMissingPayments(List<PaymentRow> rows);

  /** @return the number of rows written */
  int upsertExpectedPayments(List<ExpectedPaymentRow> rows);

  /** Row counts per table, scoped to one project. Read only. */
  Map<String, Long> countRows(long projectId);
}
