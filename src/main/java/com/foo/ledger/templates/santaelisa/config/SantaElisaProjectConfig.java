package com.foo.ledger.templates.santaelisa.config;

import com.foo.ledger.service.contract.ProjectDefinition;
import com.foo.ledger.templates.ProjectNames;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

@Configuration
public class SantaElisaProjectConfig {

  @Bean
  @Order(2)
  public ProjectDefinition santaElisaProject() {
    return new ProjectDefinition(
        ProjectNames.SANTA_ELISA, "Santa Elisa", new SantaElisaImportConfig());
  }
}
