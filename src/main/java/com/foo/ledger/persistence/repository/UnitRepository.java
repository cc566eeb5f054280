package com.foo.ledger.persistence.repository;

import com.foo.ledger.persistence.entity.Unit;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UnitRepository extends JpaRepository<Unit, Long> {

  Optional<Unit> findByProjectIdAndUnitNumber(Long projectId, String unitNumber);

  long countByProjectId(Long projectId);
}
