package com.foo.ledger.normalize;

public enum SaleStatus {
  ACTIVE("active"),
  CANCELLED("cancelled");

  private final String code;

  SaleStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static SaleStatus fromCode(String code) {
    for (SaleStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown sale status code: " + code);
  }
}
