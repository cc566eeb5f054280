package com.foo.ledger.templates.boulevard.config;

import com.foo.ledger.service.contract.ProjectDefinition;
import com.foo.ledger.templates.ProjectNames;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

@Configuration
public class BoulevardProjectConfig {

  @Bean
  @Order(1)
  public ProjectDefinition boulevardProject() {
    return new ProjectDefinition(
        ProjectNames.BOULEVARD, "Boulevard 5", new BoulevardImportConfig());
  }
}
