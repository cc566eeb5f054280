package com.foo.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "ledger.import")
public class LedgerImportProperties {

  @Min(1)
  @Max(10000)
  private int batchSize = 500;

  @Min(1)
  private int maxFileSizeMb = 50;

  @Valid private Store store = new Store();

  /** Destination store credentials. Only required when writing. */
  @Data
  public static class Store {
    private String url;
    private String username;
    private String password;

    public boolean isConfigured() {
      return hasText(url) && hasText(username) && hasText(password);
    }

    private static boolean hasText(String value) {
      return value != null && !value.isBlank();
    }
  }
}
