package com.foo.ledger.persistence.repository;

import com.foo.ledger.persistence.entity.SalesRep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SalesRepRepository extends JpaRepository<SalesRep, String> {

  @Query(
      "select count(distinct s.salesRepId) from Sale s"
          + " where s.projectId = :projectId and s.salesRepId is not null")
  long countByProjectSales(@Param("projectId") Long projectId);
}
