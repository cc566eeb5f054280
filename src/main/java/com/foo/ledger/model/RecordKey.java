package com.foo.ledger.model;

/**
 * Surrogate identity of a parsed record: the section it came from plus its 1-based sheet row.
 * Two records may share a unit key but never a record key.
 */
public record RecordKey(LifecycleSection section, int rowNumber) {

  @Override
  public String toString() {
    return section.label() + "#" + rowNumber;
  }
}
