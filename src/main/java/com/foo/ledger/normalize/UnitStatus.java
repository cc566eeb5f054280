package com.foo.ledger.normalize;

public enum UnitStatus {
  AVAILABLE("available"),
  RESERVED("reserved"),
  SOLD("sold"),
  CANCELLED("cancelled");

  private final String code;

  UnitStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static UnitStatus fromCode(String code) {
    for (UnitStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown unit status code: " + code);
  }
}
