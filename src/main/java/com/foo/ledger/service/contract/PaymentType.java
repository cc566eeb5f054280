package com.foo.ledger.service.contract;

public enum PaymentType {
  RESERVATION("reservation"),
  DOWN_PAYMENT("down_payment"),
  /** Money returned to a client; always a negative amount. */
  REIMBURSEMENT("reimbursement");

  private final String code;

  PaymentType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static PaymentType fromCode(String code) {
    for (PaymentType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown payment type: " + code);
  }
}
