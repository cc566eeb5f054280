package com.foo.ledger.service.pipeline;

import com.foo.ledger.config.LedgerImportConfig;
import com.foo.ledger.config.LedgerImportProperties;
import com.foo.ledger.model.LedgerDataset;
import com.foo.ledger.service.contract.ProjectDefinition;
import com.foo.ledger.service.contract.StoreConfigurationException;
import com.foo.ledger.service.pipeline.load.LifecycleLoader;
import com.foo.ledger.service.pipeline.load.LoadResult;
import com.foo.ledger.service.pipeline.parse.ColumnResolutionBatchException;
import com.foo.ledger.service.pipeline.parse.LedgerWorkbookParser;
import com.foo.ledger.service.pipeline.report.DryRunSummary;
import com.foo.ledger.service.pipeline.report.ImportSummaryReporter;
import com.foo.ledger.util.WorkbookFiles;
import com.foo.ledger.validation.CrossSectionValidator;
import com.foo.ledger.validation.Severity;
import com.foo.ledger.validation.ValidationReport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

/**
 * Runs one workbook through parse, validate and then either the dry-run summary or the load.
 *
 * <p>Parsing and validation are identical in both modes. Store credentials are checked only in
 * execute mode, after validation and before the first write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerImportOrchestrator {

  private final LedgerWorkbookParser parser;
  private final CrossSectionValidator validator;
  private final ImportSummaryReporter reporter;
  private final LifecycleLoader loader;
  private final LedgerImportProperties properties;
  private final List<ProjectDefinition> projectDefinitions;

  @Builder
  public record ImportResult(
      boolean success,
      String projectName,
      boolean executed,
      int recordsParsed,
      int expectedInstallments,
      int errorCount,
      int warningCount,
      List<String> errors,
      DryRunSummary summary,
      LoadResult load,
      Map<String, Long> verification,
      String message) {}

  public List<ProjectDefinition> getProjectDefinitions() {
    return projectDefinitions;
  }

  /**
   * @throws IllegalArgumentException when no project has this name
   * @throws IOException when the file is not a readable xlsx workbook
   * @throws com.foo.ledger.service.pipeline.parse.WorkbookAccessException when a sheet is missing
   * @throws StoreConfigurationException in execute mode without store credentials
   */
  public ImportResult process(Path file, String projectName, boolean execute) throws IOException {
    ProjectDefinition project = findProject(projectName);
    LedgerImportConfig config = project.getConfig();
    log.info("Project: {} | file: {}", project.getDisplayName(), file.getFileName());

    LedgerDataset dataset;
    try (Workbook workbook = WorkbookFiles.open(file, properties.getMaxFileSizeMb())) {
      dataset = parser.parse(workbook, config);
    } catch (ColumnResolutionBatchException e) {
      log.error("Required columns could not be located: {}", e.getMessage());
      return ImportResult.builder()
          .success(false)
          .projectName(project.getProjectName())
          .errorCount(e.getExceptions().size())
          .errors(e.messages())
          .message(e.getMessage())
          .build();
    }
    log.info(
        "Parsed {} records and {} expected installments",
        dataset.records().size(),
        dataset.expectedInstallments().size());

    ValidationReport report =
        validator.validate(dataset, project.getNormalizer(), config.getBudgetLayout() != null);
    reporter.logValidation(report);

    ImportResult.ImportResultBuilder result =
        ImportResult.builder()
            .projectName(project.getProjectName())
            .executed(execute)
            .recordsParsed(dataset.records().size())
            .expectedInstallments(dataset.expectedInstallments().size())
            .errorCount(report.count(Severity.ERROR))
            .warningCount(report.count(Severity.WARNING))
            .errors(report.errorMessages());

    if (!report.isValid()) {
      return result
          .success(false)
          .message("Validation failed with %d errors".formatted(report.count(Severity.ERROR)))
          .build();
    }

    if (!execute) {
      DryRunSummary summary = reporter.logDryRun(project, dataset);
      return result.success(true).summary(summary).message("Dry run complete").build();
    }

    if (!properties.getStore().isConfigured()) {
      throw new StoreConfigurationException(
          "Store url, username and password are required with --execute"
              + " (LEDGER_STORE_URL, LEDGER_STORE_USERNAME, LEDGER_STORE_PASSWORD)");
    }

    LoadResult load = loader.load(project, dataset);
    Map<String, Long> counts = loader.verify(load.projectId());
    reporter.logLoad(load, counts);
    return result
        .success(true)
        .load(load)
        .verification(counts)
        .message("Load complete")
        .build();
  }

  private ProjectDefinition findProject(String projectName) {
    return projectDefinitions.stream()
        .filter(p -> p.getProjectName().equals(projectName))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown project '%s'. Known projects: %s"
                        .formatted(
                            projectName,
                            projectDefinitions.stream()
                                .map(ProjectDefinition::getProjectName)
                                .collect(Collectors.toList()))));
  }
}
