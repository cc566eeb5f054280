package com.foo.ledger.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.foo.ledger.config.SampleLedgerConfig;
import com.foo.ledger.model.LedgerDataset;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.model.ParsedExpectedInstallment;
import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.model.RecordKey;
import com.foo.ledger.normalize.FieldNormalizer;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class CrossSectionValidatorTest {

  private final CrossSectionValidator validator = new CrossSectionValidator();
  private final FieldNormalizer normalizer =
      new FieldNormalizer(new SampleLedgerConfig().getNormalizationTables());

  private static ParsedUnitRecord record(
      LifecycleSection section, int row, String unitKey, String client, String status) {
    return ParsedUnitRecord.builder()
        .key(new RecordKey(section, row))
        .unitKey(unitKey)
        .clientName(client)
        .rawStatus(section == LifecycleSection.MAIN ? status : "Desistimiento")
        .build();
  }

  private static ParsedUnitRecord main(int row, String unitKey, String client, String status) {
    return record(LifecycleSection.MAIN, row, unitKey, client, status);
  }

  private static ParsedExpectedInstallment installment(String unitKey) {
    return new ParsedExpectedInstallment(unitKey, LocalDate.of(2024, 1, 31), BigDecimal.TEN);
  }

  private ValidationReport validate(List<ParsedUnitRecord> records, boolean checkBudget) {
    return validator.validate(new LedgerDataset(records, List.of()), normalizer, checkBudget);
  }

  @Test
  void validate_cleanDataset_hasNoFindings() {
    ValidationReport report =
        validate(
            List.of(main(3, "101", "Jane Doe", "4.plan de pagos"), main(4, "102", null, "")),
            false);

    assertThat(report.isValid()).isTrue();
    assertThat(report.getFindings()).isEmpty();
  }

  @Test
  void validate_duplicateMainKey_isError() {
    ValidationReport report =
        validate(
            List.of(
                main(3, "101", "Jane Doe", "2.reserva"),
                main(4, "102", null, "1.disponible"),
                main(5, "101", "John Roe", "2.reserva")),
            false);

    assertThat(report.isValid()).isFalse();
    assertThat(report.errorMessages())
        .containsExactly("Duplicate unit key in main section: [101]");
  }

  @Test
  void validate_sameKeyInMainAndHistory_isNotDuplicate() {
    ValidationReport report =
        validate(
            List.of(
                main(3, "101", "Jane Doe", "4.plan de pagos"),
                record(LifecycleSection.CANCELLED, 13, "101", "John Roe", null)),
            false);

    assertThat(report.isValid()).isTrue();
    assertThat(report.bySeverity(Severity.INFO))
        .extracting(ValidationFinding::message)
        .singleElement()
        .asString()
        .contains("cancelled then resold")
        .contains("101");
  }

  @Test
  void validate_unknownStatus_isErrorWithRow() {
    ValidationReport report =
        validate(List.of(main(7, "101", "Jane Doe", "3.escriturado")), false);

    assertThat(report.isValid()).isFalse();
    assertThat(report.errorMessages())
        .containsExactly("Unit 101 (row 7): unknown status '3.escriturado'");
  }

  @Test
  void validate_blankStatus_isNotError() {
    ValidationReport report = validate(List.of(main(7, "101", null, "  ")), false);

    assertThat(report.isValid()).isTrue();
  }

  @Test
  void validate_historicalOnlyUnits_areWarnings() {
    ValidationReport report =
        validate(
            List.of(
                main(3, "101", "Jane Doe", "2.reserva"),
                record(LifecycleSection.CANCELLED, 13, "900", "John Roe", null)),
            false);

    assertThat(report.isValid()).isTrue();
    assertThat(report.bySeverity(Severity.WARNING))
        .extracting(ValidationFinding::message)
        .anySatisfy(m -> assertThat(m).contains("not in main unit list (1)").contains("900"));
  }

  @Test
  void validate_budgetCoverage_bothDirections() {
    LedgerDataset dataset =
        new LedgerDataset(
            List.of(
                main(3, "101", "Jane Doe", "2.reserva"), main(4, "102", "Ann Lee", "2.reserva")),
            List.of(installment("101"), installment("205")));

    ValidationReport checked = validator.validate(dataset, normalizer, true);
    ValidationReport unchecked = validator.validate(dataset, normalizer, false);

    assertThat(checked.bySeverity(Severity.WARNING))
        .extracting(ValidationFinding::message)
        .containsExactlyInAnyOrder(
            "Units in budget but not in actuals (1): [205]",
            "Units in actuals but not in budget (1): [102]");
    assertThat(unchecked.getFindings()).isEmpty();
  }

  @Test
  void validate_sellableWithoutClient_isWarning() {
    ValidationReport report =
        validate(
            List.of(
                main(3, "101", "   ", "4.plan de pagos"), main(4, "102", null, "1.disponible")),
            false);

    assertThat(report.isValid()).isTrue();
    assertThat(report.bySeverity(Severity.WARNING))
        .extracting(ValidationFinding::message)
        .containsExactly("Sold/reserved units missing client (1): [101]");
  }

  @Test
  void validate_refundWithoutCancellation_isWarning() {
    ValidationReport report =
        validate(
            List.of(
                main(3, "101", "Jane Doe", "2.reserva"),
                record(LifecycleSection.CANCELLED, 13, "101", "John  Roe", null),
                record(LifecycleSection.REFUND, 17, "101", "John Roe", null),
                record(LifecycleSection.REFUND, 18, "101", "Max Poe", null)),
            false);

    assertThat(report.bySeverity(Severity.WARNING))
        .extracting(ValidationFinding::message)
        .singleElement()
        .asString()
        .contains("no matching cancellation (1)")
        .contains("(101, Max Poe)")
        .doesNotContain("John Roe");
  }

  @Test
  void validate_samplesAreCapped() {
    List<ParsedUnitRecord> records =
        IntStream.rangeClosed(1, 15)
            .mapToObj(i -> record(LifecycleSection.CANCELLED, 100 + i, "9" + i, "C" + i, null))
            .collect(Collectors.toList());

    ValidationReport report = validate(records, false);

    String message = report.bySeverity(Severity.WARNING).get(0).message();
    assertThat(message).contains("(15)");
    assertThat(message.split(","))
        .hasSizeLessThanOrEqualTo(CrossSectionValidator.SAMPLE_SIZE + 1);
  }
}
