package com.foo.ledger.persistence.repository;

import com.foo.ledger.persistence.entity.Client;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ClientRepository extends JpaRepository<Client, Long> {

  Optional<Client> findByFullName(String fullName);

  /** Clients are shared across projects; counts those holding a sale in the project. */
  @Query("select count(distinct s.clientId) from Sale s where s.projectId = :projectId")
  long countByProjectSales(@Param("projectId") Long projectId);
}
