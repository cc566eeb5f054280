package com.foo.ledger.persistence.repository;

import com.foo.ledger.persistence.entity.ExpectedPayment;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExpectedPaymentRepository extends JpaRepository<ExpectedPayment, Long> {

  Optional<ExpectedPayment> findByProjectIdAndUnitNumberAndDueDateAndScheduleType(
      Long projectId, String unitNumber, LocalDate dueDate, String scheduleType);

  long countByProjectId(Long projectId);
}
