package com.foo.ledger.model;

/** Physical block of the actuals sheet a record was read from. */
public enum LifecycleSection {

  /** Current ownership block. The only source of unit state. */
  MAIN("main", false, false),

  /** Cancelled ownership episodes ("desistimientos"). */
  CANCELLED("desistimiento", true, false),

  /** Cancellations still under dispute, kept in their own block. */
  DISPUTED_CANCELLED("prob_desistimiento", true, false),

  /** Board-approved refunds to clients who cancelled ("devoluciones"). */
  REFUND("devolucion", true, true);

  private final String label;
  private final boolean impliesCancelledSale;
  private final boolean refund;

  LifecycleSection(String label, boolean impliesCancelledSale, boolean refund) {
    this.label = label;
    this.impliesCancelledSale = impliesCancelledSale;
    this.refund = refund;
  }

  public String label() {
    return label;
  }

  /** Whether every record of this section stands for a cancelled sale, whatever its status text. */
  public boolean impliesCancelledSale() {
    return impliesCancelledSale;
  }

  /** Whether payments in this section are money returned to the client. */
  public boolean isRefund() {
    return refund;
  }

  public boolean isHistorical() {
    return this != MAIN;
  }
}
