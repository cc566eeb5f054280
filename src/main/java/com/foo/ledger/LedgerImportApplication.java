package com.foo.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerImportApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(LedgerImportApplication.class, args)));
  }
}
