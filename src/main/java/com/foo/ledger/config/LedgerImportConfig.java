package com.foo.ledger.config;

import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.normalize.NormalizationTables;
import java.util.List;
import java.util.Map;

/** Layout and constant tables of one project's sales ledger workbook. */
public interface LedgerImportConfig {

  /** Name of the sheet holding the actuals sections. */
  String getActualsSheetName();

  /**
   * Section blocks of the actuals sheet. The {@link LifecycleSection#MAIN} block must come
   * first; other blocks reuse its month columns.
   */
  List<SectionLayout> getSections();

  /** First column of the actuals sheet to scan, in letter notation. */
  default String getFirstColumn() {
    return "B";
  }

  String getLastColumn();

  /** Logical fields of the actuals sheet, in claim priority order. */
  List<HeaderPattern> getHeaderPatterns();

  /** Budget sheet layout, or {@code null} when the project has no budget sheet. */
  default BudgetLayout getBudgetLayout() {
    return null;
  }

  NormalizationTables getNormalizationTables();

  TaxStrategy getTaxStrategy();

  /** Whether sales carry a rep reference and the {@code sales_reps} table is written. */
  default boolean isSalesRepTableEnabled() {
    return false;
  }

  /** Rep id used when a sale has no recognizable rep. */
  default String getUnknownSalesRepId() {
    return "unknown";
  }

  /** Display names for rep ids that are not themselves readable names. */
  default Map<String, String> getSalesRepDisplayNames() {
    return Map.of();
  }

  /** Raw status forced onto every record of a historical section. */
  default String getCancelledStatusText() {
    return "Desistimiento";
  }

  /** Schedule type written on expected installments. */
  default String getScheduleType() {
    return "budget";
  }
}
