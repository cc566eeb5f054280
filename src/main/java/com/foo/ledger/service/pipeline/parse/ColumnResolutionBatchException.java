package com.foo.ledger.service.pipeline.parse;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

@Getter
public class ColumnResolutionBatchException extends RuntimeException {

  private final List<ColumnResolutionException> exceptions;

  public ColumnResolutionBatchException(List<ColumnResolutionException> exceptions) {
    super("Column resolution failed for %d block(s)".formatted(exceptions.size()));
    this.exceptions = List.copyOf(exceptions);
  }

  public List<String> messages() {
    return exceptions.stream()
        .map(ColumnResolutionException::getMessage)
        .collect(Collectors.toList());
  }
}
