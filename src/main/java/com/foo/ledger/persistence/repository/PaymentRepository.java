package com.foo.ledger.persistence.repository;

import com.foo.ledger.persistence.entity.Payment;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

  boolean existsBySaleIdAndPaymentDateAndAmountAndPaymentType(
      Long saleId, LocalDate paymentDate, BigDecimal amount, String paymentType);

  @Query(
      "select count(p) from Payment p where p.saleId in"
          + " (select s.id from Sale s where s.projectId = :projectId)")
  long countByProjectId(@Param("projectId") Long projectId);
}
