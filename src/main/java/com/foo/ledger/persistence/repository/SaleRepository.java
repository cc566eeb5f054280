package com.foo.ledger.persistence.repository;

import com.foo.ledger.persistence.entity.Sale;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SaleRepository extends JpaRepository<Sale, Long> {

  Optional<Sale> findFirstByUnitIdAndStatusOrderByIdAsc(Long unitId, String status);

  Optional<Sale> findFirstByUnitIdAndClientIdAndStatusOrderByIdAsc(
      Long unitId, Long clientId, String status);

  long countByProjectId(Long projectId);

  long countByProjectIdAndStatus(Long projectId, String status);
}
