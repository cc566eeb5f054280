package com.foo.ledger.service.pipeline.parse;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.YearMonth;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class MonthHeaderParserTest {

  @ParameterizedTest
  @CsvSource({
    "ene.24, 2024, 1",
    "jun.22, 2022, 6",
    "Sept.24, 2024, 9",
    "sep.24, 2024, 9",
    "DIC.23, 2023, 12",
    "' ago.25 ', 2025, 8"
  })
  void parse_spanishAbbreviations(String header, int year, int month) {
    assertThat(MonthHeaderParser.parse(header)).hasValue(YearMonth.of(year, month));
  }

  @ParameterizedTest
  @NullSource
  @ValueSource(strings = {"", "apto", "june.24", "ene-24", "ene.2024", "ene.", "13.24"})
  void parse_otherText_isEmpty(String header) {
    assertThat(MonthHeaderParser.parse(header)).isEmpty();
  }
}
