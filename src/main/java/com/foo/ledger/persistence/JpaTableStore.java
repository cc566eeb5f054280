package com.foo.ledger.persistence;

import com.foo.ledger.normalize.SaleStatus;
import com.foo.ledger.persistence.entity.Client;
import com.foo.ledger.persistence.entity.ExpectedPayment;
import com.foo.ledger.persistence.entity.Payment;
import com.foo.ledger.persistence.entity.Project;
import com.foo.ledger.persistence.entity.Sale;
import com.foo.ledger.persistence.entity.SalesRep;
import com.foo.ledger.persistence.entity.Unit;
import com.foo.ledger.persistence.repository.ClientRepository;
import com.foo.ledger.persistence.repository.ExpectedPaymentRepository;
import com.foo.ledger.persistence.repository.PaymentRepository;
import com.foo.ledger.persistence.repository.ProjectRepository;
import com.foo.ledger.persistence.repository.SaleRepository;
import com.foo.ledger.persistence.repository.SalesRepRepository;
import com.foo.ledger.persistence.repository.UnitRepository;
import com.foo.ledger.service.contract.ExpectedPaymentRow;
import com.foo.ledger.service.contract.PaymentRow;
import com.foo.ledger.service.contract.ProjectRow;
import com.foo.ledger.service.contract.SaleRow;
import com.foo.ledger.service.contract.SalesRepRow;
import com.foo.ledger.service.contract.TableStore;
import com.foo.ledger.service.contract.UnitRow;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TableStore} over Spring Data JPA repositories.
 *
 * <p>Every upsert is find-then-save on the natural key. A unique constraint violation raised by a
 * concurrent insert is retried, after which the row is found and updated instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTableStore implements TableStore {

  private static final int UPSERT_RETRY_LIMIT = 2;

  private final ProjectRepository projectRepository;
  private final UnitRepository unitRepository;
  private final ClientRepository clientRepository;
  private final SalesRepRepository salesRepRepository;
  private final SaleRepository saleRepository;
  private final PaymentRepository paymentRepository;
  private final ExpectedPaymentRepository expectedPaymentRepository;

  @Override
  @Transactional
  public long upsertProject(ProjectRow row) {
    return withRetry(
        "project " + row.name(),
        () -> {
          Project project =
              projectRepository
                  .findByName(row.name())
                  .orElseGet(() -> Project.builder().name(row.name()).build());
          project.setDisplayName(row.displayName());
          return projectRepository.saveAndFlush(project).getId();
        });
  }

  @Override
  @Transactional
  public Map<String, Long> upsertUnits(List<UnitRow> rows) {
    Map<String, Long> ids = new LinkedHashMap<>();
    for (UnitRow row : rows) {
      Long id =
          withRetry(
              "unit " + row.unitNumber(),
              () -> {
                Unit unit =
                    unitRepository
                        .findByProjectIdAndUnitNumber(row.projectId(), row.unitNumber())
                        .orElseGet(
                            () ->
                                Unit.builder()
                                    .projectId(row.projectId())
                                    .unitNumber(row.unitNumber())
                                    .build());
                applyUnit(unit, row);
                return unitRepository.saveAndFlush(unit).getId();
              });
      ids.put(row.unitNumber(), id);
    }
    return ids;
  }

  @Override
  @Transactional
  public Map<String, Long> insertMissingUnits(List<UnitRow> rows) {
    Map<String, Long> ids = new LinkedHashMap<>();
    for (UnitRow row : rows) {
      Long id =
          withRetry(
              "unit " + row.unitNumber(),
              () -> {
                Optional<Unit> existing =
                    unitRepository.findByProjectIdAndUnitNumber(
                        row.projectId(), row.unitNumber());
                if (existing.isPresent()) {
                  return existing.get().getId();
                }
                Unit unit =
                    Unit.builder().projectId(row.projectId()).unitNumber(row.unitNumber()).build();
                applyUnit(unit, row);
                return unitRepository.saveAndFlush(unit).getId();
              });
      ids.put(row.unitNumber(), id);
    }
    return ids;
  }

  @Override
  @Transactional
  public Map<String, Long> upsertClients(Collection<String> fullNames) {
    Map<String, Long> ids = new LinkedHashMap<>();
    for (String fullName : fullNames) {
      Long id =
          withRetry(
              "client " + fullName,
              () ->
                  clientRepository
                      .findByFullName(fullName)
                      .map(Client::getId)
                      .orElseGet(
                          () ->
                              clientRepository
                                  .saveAndFlush(Client.builder().fullName(fullName).build())
                                  .getId()));
      ids.put(fullName, id);
    }
    return ids;
  }

  @Override
  @Transactional
  public void upsertSalesReps(List<SalesRepRow> rows) {
    for (SalesRepRow row : rows) {
      withRetry(
          "sales rep " + row.id(),
          () -> {
            SalesRep rep =
                salesRepRepository
                    .findById(row.id())
                    .orElseGet(() -> SalesRep.builder().id(row.id()).build());
            rep.setName(row.name());
            return salesRepRepository.saveAndFlush(rep).getId();
          });
    }
  }

  @Override
  @Transactional
  public Map<Long, Long> upsertActiveSales(List<SaleRow> rows) {
    Map<Long, Long> ids = new LinkedHashMap<>();
    for (SaleRow row : rows) {
      if (row.status() != SaleStatus.ACTIVE) {
        throw new IllegalArgumentException(
            "Only active sales can be upserted, got %s for unit id %d"
                .formatted(row.status(), row.unitId()));
      }
      Long id =
          withRetry(
              "active sale of unit id " + row.unitId(),
              () -> {
                Sale sale =
                    saleRepository
                        .findFirstByUnitIdAndStatusOrderByIdAsc(
                            row.unitId(), SaleStatus.ACTIVE.code())
                        .orElseGet(Sale::new);
                applySale(sale, row);
                return saleRepository.saveAndFlush(sale).getId();
              });
      ids.put(row.unitId(), id);
    }
    return ids;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Long> findCancelledSale(long unitId, long clientId) {
    return saleRepository
        .findFirstByUnitIdAndClientIdAndStatusOrderByIdAsc(
            unitId, clientId, SaleStatus.CANCELLED.code())
        .map(Sale::getId);
  }

  @Override
  @Transactional
  public long insertSale(SaleRow row) {
    Sale sale = new Sale();
    applySale(sale, row);
    return saleRepository.saveAndFlush(sale).getId();
  }

  @Override
  @Transactional
  public int insertMissingPayments(List<PaymentRow> rows) {
    int inserted = 0;
    for (PaymentRow row : rows) {
      String type = row.paymentType().code();
      if (paymentRepository.existsBySaleIdAndPaymentDateAndAmountAndPaymentType(
          row.saleId(), row.paymentDate(), row.amount(), type)) {
        continue;
      }
      paymentRepository.save(
          Payment.builder()
              .saleId(row.saleId())
              .paymentDate(row.paymentDate())
              .amount(row.amount())
              .paymentType(type)
              .notes(row.notes())
              .build());
      inserted++;
    }
    paymentRepository.flush();
    return inserted;
  }

  @Override
  @Transactional
  public int upsertExpectedPayments(List<ExpectedPaymentRow> rows) {
    for (ExpectedPaymentRow row : rows) {
      withRetry(
          "expected payment %s %s".formatted(row.unitNumber(), row.dueDate()),
          () -> {
            ExpectedPayment payment =
                expectedPaymentRepository
                    .findByProjectIdAndUnitNumberAndDueDateAndScheduleType(
                        row.projectId(), row.unitNumber(), row.dueDate(), row.scheduleType())
                    .orElseGet(
                        () ->
                            ExpectedPayment.builder()
                                .projectId(row.projectId())
                                .unitNumber(row.unitNumber())
                                .dueDate(row.dueDate())
                                .scheduleType(row.scheduleType())
                                .build());
            payment.setAmount(row.amount());
            payment.setInstallmentNumber(row.installmentNumber());
            return expectedPaymentRepository.saveAndFlush(payment).getId();
          });
    }
    return rows.size();
  }

  @Override
  @Transactional(readOnly = true)
  public Map<String, Long> countRows(long projectId) {
    Map<String, Long> counts = new LinkedHashMap<>();
    counts.put("units", unitRepository.countByProjectId(projectId));
    counts.put("clients", clientRepository.countByProjectSales(projectId));
    counts.put("sales_reps", salesRepRepository.countByProjectSales(projectId));
    counts.put("sales", saleRepository.countByProjectId(projectId));
    counts.put(
        "sales (active)",
        saleRepository.countByProjectIdAndStatus(projectId, SaleStatus.ACTIVE.code()));
    counts.put(
        "sales (cancelled)",
        saleRepository.countByProjectIdAndStatus(projectId, SaleStatus.CANCELLED.code()));
    counts.put("payments", paymentRepository.countByProjectId(projectId));
    counts.put("expected_payments", expectedPaymentRepository.countByProjectId(projectId));
    return counts;
  }

  private static void applyUnit(Unit unit, UnitRow row) {
    unit.setUnitType(row.unitType());
    unit.setPriceWithTax(row.priceWithTax());
    unit.setPriceWithoutTax(row.priceWithoutTax());
    unit.setDownPaymentAmount(row.downPaymentAmount());
    unit.setStatus(row.status().code());
  }

  private static void applySale(Sale sale, SaleRow row) {
    sale.setProjectId(row.projectId());
    sale.setUnitId(row.unitId());
    sale.setClientId(row.clientId());
    sale.setSalesRepId(row.salesRepId());
    sale.setSaleDate(row.saleDate());
    sale.setPriceWithTax(row.priceWithTax());
    sale.setPriceWithoutTax(row.priceWithoutTax());
    sale.setDownPaymentAmount(row.downPaymentAmount());
    sale.setFinancedAmount(row.financedAmount());
    sale.setStatus(row.status().code());
    sale.setReferralApplies(row.referralApplies());
    sale.setSpecialCase(row.specialCase());
    sale.setSpecialCaseType(row.specialCaseType());
    sale.setObservations(row.observations());
    sale.setNotes(row.notes());
  }

  private <T> T withRetry(String target, Supplier<T> upsert) {
    int attempt = 0;
    while (attempt <= UPSERT_RETRY_LIMIT) {
      attempt++;
      try {
        return upsert.get();
      } catch (DataIntegrityViolationException e) {
        log.debug("Conflict writing {} (attempt {}): {}", target, attempt, e.getMessage());
        if (attempt > UPSERT_RETRY_LIMIT) {
          break;
        }
      }
    }
    throw new IllegalStateException("Concurrent write conflict, could not store " + target);
  }
}
