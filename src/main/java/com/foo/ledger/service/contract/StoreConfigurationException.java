package com.foo.ledger.service.contract;

/** The destination store cannot be used, typically because credentials are missing. */
public class StoreConfigurationException extends RuntimeException {

  public StoreConfigurationException(String message) {
    super(message);
  }
}
