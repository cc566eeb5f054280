package com.foo.ledger.service.pipeline.parse;

import com.foo.ledger.config.BudgetLayout;
import com.foo.ledger.config.LedgerImportConfig;
import com.foo.ledger.config.SectionLayout;
import com.foo.ledger.grid.CellGrid;
import com.foo.ledger.grid.PoiCellGrid;
import com.foo.ledger.model.LedgerDataset;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.model.ParsedExpectedInstallment;
import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.util.ColumnRange;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

/**
 * Parses every section of a project's actuals sheet plus its budget sheet.
 *
 * <p>Header rows are located once per section. Historical sections take their month columns from
 * the main section, and their status text is replaced by the project's cancellation status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerWorkbookParser {

  private final HeaderLocator headerLocator;
  private final SectionParser sectionParser;
  private final BudgetSheetParser budgetSheetParser;

  /**
   * @throws WorkbookAccessException when a configured sheet is missing
   * @throws ColumnResolutionBatchException when any section lacks a unit key column
   */
  public LedgerDataset parse(Workbook workbook, LedgerImportConfig config) {
    CellGrid actuals = new PoiCellGrid(requireSheet(workbook, config.getActualsSheetName()));
    List<ColumnResolutionException> errors = new ArrayList<>();

    List<ParsedUnitRecord> records = parseActuals(actuals, config, errors);

    List<ParsedExpectedInstallment> expected = List.of();
    BudgetLayout budget = config.getBudgetLayout();
    if (budget != null) {
      CellGrid budgetGrid = new PoiCellGrid(requireSheet(workbook, budget.sheetName()));
      try {
        expected = budgetSheetParser.parse(budgetGrid, budget);
      } catch (ColumnResolutionException e) {
        errors.add(e);
      }
    }

    if (!errors.isEmpty()) {
      throw new ColumnResolutionBatchException(errors);
    }
    return new LedgerDataset(records, expected);
  }

  List<ParsedUnitRecord> parseActuals(
      CellGrid grid, LedgerImportConfig config, List<ColumnResolutionException> errors) {
    List<SectionLayout> sections = config.getSections();
    if (sections.isEmpty() || sections.get(0).section() != LifecycleSection.MAIN) {
      throw new IllegalStateException(
          "The first configured section of '%s' must be MAIN".formatted(grid.getName()));
    }

    ColumnRange columns = ColumnRange.of(config.getFirstColumn(), config.getLastColumn());
    log.debug("Scanning '{}' columns {}", grid.getName(), columns);

    HeaderMap mainHeaders = null;
    List<ParsedUnitRecord> records = new ArrayList<>();
    for (SectionLayout layout : sections) {
      HeaderMap headers =
          headerLocator.locate(
              grid, layout.headerRow() - 1, columns, config.getHeaderPatterns(), false);
      if (mainHeaders == null) {
        mainHeaders = headers;
      } else {
        headers = headers.withMonthColumnsOf(mainHeaders);
      }

      log.info(
          "[{}] Headers found: {} | Monthly columns: {}",
          layout.section().label(),
          headers.namedColumns().keySet(),
          headers.describeMonths());

      try {
        List<ParsedUnitRecord> parsed = sectionParser.parse(grid, layout, headers);
        if (layout.section().isHistorical()) {
          parsed = forceStatus(parsed, config.getCancelledStatusText());
        }
        records.addAll(parsed);
      } catch (ColumnResolutionException e) {
        log.error(e.getMessage());
        errors.add(e);
      }
    }
    return records;
  }

  private static List<ParsedUnitRecord> forceStatus(List<ParsedUnitRecord> records, String status) {
    return records.stream()
        .map(r -> r.toBuilder().rawStatus(status).build())
        .collect(Collectors.toList());
  }

  private static Sheet requireSheet(Workbook workbook, String name) {
    Sheet sheet = workbook.getSheet(name);
    if (sheet == null) {
      List<String> available =
          StreamSupport.stream(workbook.spliterator(), false)
              .map(Sheet::getSheetName)
              .collect(Collectors.toList());
      throw new WorkbookAccessException(
          "Sheet '%s' not found in workbook. Available sheets: %s".formatted(name, available));
    }
    return sheet;
  }
}
