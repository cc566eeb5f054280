package com.foo.ledger.validation;

public record ValidationFinding(Severity severity, String message) {

  public static ValidationFinding error(String message) {
    return new ValidationFinding(Severity.ERROR, message);
  }

  public static ValidationFinding warning(String message) {
    return new ValidationFinding(Severity.WARNING, message);
  }

  public static ValidationFinding info(String message) {
    return new ValidationFinding(Severity.INFO, message);
  }

  public boolean isFatal() {
    return severity == Severity.ERROR;
  }
}
