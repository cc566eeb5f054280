package com.foo.ledger.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/** Findings of one workbook. The load may proceed only when {@link #isValid()}. */
@Getter
public class ValidationReport {

  private final List<ValidationFinding> findings = new ArrayList<>();

  public static ValidationReport of(List<ValidationFinding> findings) {
    ValidationReport report = new ValidationReport();
    report.merge(findings);
    return report;
  }

  public void add(ValidationFinding finding) {
    findings.add(finding);
  }

  public void merge(List<ValidationFinding> additional) {
    findings.addAll(additional);
  }

  public boolean isValid() {
    return findings.stream().noneMatch(ValidationFinding::isFatal);
  }

  public List<ValidationFinding> bySeverity(Severity severity) {
    return findings.stream().filter(f -> f.severity() == severity).collect(Collectors.toList());
  }

  public List<String> errorMessages() {
    return bySeverity(Severity.ERROR).stream()
        .map(ValidationFinding::message)
        .collect(Collectors.toList());
  }

  public int count(Severity severity) {
    return (int) findings.stream().filter(f -> f.severity() == severity).count();
  }
}
