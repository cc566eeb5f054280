package com.foo.ledger.persistence.repository;

import com.foo.ledger.persistence.entity.Project;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProjectRepository extends JpaRepository<Project, Long> {

  Optional<Project> findByName(String name);
}
