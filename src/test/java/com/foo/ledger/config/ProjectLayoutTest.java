package com.foo.ledger.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.foo.ledger.model.LedgerField;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.templates.boulevard.config.BoulevardImportConfig;
import com.foo.ledger.templates.santaelisa.config.SantaElisaImportConfig;
import com.foo.ledger.util.ColumnRange;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class ProjectLayoutTest {

  static List<LedgerImportConfig> configs() {
    return List.of(new BoulevardImportConfig(), new SantaElisaImportConfig());
  }

  @ParameterizedTest
  @MethodSource("configs")
  void sections_mainFirstAndRowsDoNotOverlap(LedgerImportConfig config) {
    List<SectionLayout> sections = config.getSections();

    assertThat(sections.get(0).section()).isEqualTo(LifecycleSection.MAIN);
    for (int i = 1; i < sections.size(); i++) {
      assertThat(sections.get(i).firstDataRow()).isGreaterThan(sections.get(i - 1).lastDataRow());
    }
  }

  @ParameterizedTest
  @MethodSource("configs")
  void headerPatterns_includeUnitKeyAndValidColumns(LedgerImportConfig config) {
    assertThat(config.getHeaderPatterns())
        .extracting(HeaderPattern::field)
        .contains(LedgerField.UNIT_KEY)
        .doesNotHaveDuplicates();
    assertThat(ColumnRange.of(config.getFirstColumn(), config.getLastColumn()).width())
        .isGreaterThan(config.getHeaderPatterns().size());
    assertThat(config.getBudgetLayout()).isNotNull();
  }

  @Test
  void boulevard_layout() {
    BoulevardImportConfig config = new BoulevardImportConfig();

    assertThat(config.getActualsSheetName()).isEqualTo("BOULEVARD 5");
    assertThat(config.getSections())
        .extracting(SectionLayout::section)
        .containsExactly(
            LifecycleSection.MAIN, LifecycleSection.CANCELLED, LifecycleSection.DISPUTED_CANCELLED);
    assertThat(config.getLastColumn()).isEqualTo("CF");
    assertThat(config.isSalesRepTableEnabled()).isTrue();
    assertThat(config.getTaxStrategy()).isInstanceOf(TaxComponentSubtraction.class);
    assertThat(config.getBudgetLayout().parseFreeTextMonths()).isFalse();
  }

  @Test
  void santaElisa_layout() {
    SantaElisaImportConfig config = new SantaElisaImportConfig();

    assertThat(config.getSections())
        .extracting(SectionLayout::section)
        .containsExactly(
            LifecycleSection.MAIN, LifecycleSection.CANCELLED, LifecycleSection.REFUND);
    assertThat(config.getSections()).extracting(SectionLayout::headerRow).containsOnly(4);
    assertThat(config.isSalesRepTableEnabled()).isFalse();
    assertThat(config.getUnknownSalesRepId()).isEqualTo("Unknown");
    assertThat(config.getTaxStrategy()).isInstanceOf(TaxInclusiveDivisor.class);
    assertThat(config.getBudgetLayout().parseFreeTextMonths()).isTrue();
  }

  @Test
  void sectionLayout_invalidRows_rejected() {
    assertThatThrownBy(() -> new SectionLayout(LifecycleSection.MAIN, 6, 10, 7))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SectionLayout(LifecycleSection.MAIN, 0, 1, 7))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void headerPattern_shortCandidatesNeverMatchPartially() {
    HeaderPattern type = HeaderPattern.of(LedgerField.UNIT_TYPE, "Tipo");
    HeaderPattern client = HeaderPattern.of(LedgerField.CLIENT, "Cliente");

    assertThat(type.matchesExactly("tipo")).isTrue();
    assertThat(type.matchesPartially("tipo de plan")).isFalse();
    assertThat(client.matchesPartially("nombre del cliente")).isTrue();
  }
}
