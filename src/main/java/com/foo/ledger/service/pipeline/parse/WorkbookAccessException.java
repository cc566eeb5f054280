package com.foo.ledger.service.pipeline.parse;

/** The workbook does not have the shape a project expects, such as a missing sheet. */
public class WorkbookAccessException extends RuntimeException {

  public WorkbookAccessException(String message) {
    super(message);
  }
}
