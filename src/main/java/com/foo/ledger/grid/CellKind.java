package com.foo.ledger.grid;

public enum CellKind {
  EMPTY,
  NUMBER,
  TEXT,
  DATE
}
