package com.foo.ledger.validation;

public enum Severity {
  /** Blocks the load. */
  ERROR,
  WARNING,
  /** Expected shapes worth reporting, such as resold units. */
  INFO
}
