package com.foo.ledger.templates;

public final class ProjectNames {

  public static final String BOULEVARD = "boulevard";
  public static final String SANTA_ELISA = "santa_elisa";

  private ProjectNames() {}
}
