package com.foo.ledger.cli;

import com.foo.ledger.service.contract.ProjectDefinition;
import com.foo.ledger.service.contract.StoreConfigurationException;
import com.foo.ledger.service.pipeline.LedgerImportOrchestrator;
import com.foo.ledger.service.pipeline.LedgerImportOrchestrator.ImportResult;
import com.foo.ledger.service.pipeline.parse.WorkbookAccessException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Command line entry point.
 *
 * <pre>
 * sales-ledger-import &lt;workbook.xlsx&gt; [--project=&lt;name&gt;] [--execute] [--verbose]
 * </pre>
 *
 * <p>Without {@code --project} every configured project is imported from the same workbook, in
 * registration order, stopping at the first failure. Without {@code --execute} nothing is
 * written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "ledger.import.command",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LedgerImportCommand implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_CONFIGURATION = 2;

  static final String USAGE =
      "Usage: <workbook.xlsx> [--project=<name>] [--execute] [--verbose]";

  private final LedgerImportOrchestrator orchestrator;

  private int exitCode = EXIT_OK;

  @Override
  public void run(ApplicationArguments args) {
    exitCode = execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int execute(ApplicationArguments args) {
    if (args.containsOption("verbose")) {
      LoggingSystem.get(getClass().getClassLoader())
          .setLogLevel("com.foo.ledger", LogLevel.DEBUG);
    }

    List<String> files = args.getNonOptionArgs();
    if (files.size() != 1) {
      log.error(USAGE);
      return EXIT_CONFIGURATION;
    }
    Path file = Path.of(files.get(0));
    if (!Files.isRegularFile(file)) {
      log.error("File not found: {}", file);
      return EXIT_FAILURE;
    }

    List<String> projects = projectNames(args);
    if (projects.isEmpty()) {
      log.error("--project needs a value. {}", USAGE);
      return EXIT_CONFIGURATION;
    }
    boolean execute = args.containsOption("execute");
    log.info("Mode: {}", execute ? "EXECUTE" : "DRY RUN");

    for (String project : projects) {
      int code = importProject(file, project, execute);
      if (code != EXIT_OK) {
        return code;
      }
    }
    return EXIT_OK;
  }

  private int importProject(Path file, String project, boolean execute) {
    try {
      ImportResult result = orchestrator.process(file, project, execute);
      if (!result.success()) {
        log.error("{}: {}", project, result.message());
        return EXIT_FAILURE;
      }
      log.info("{}: {}", project, result.message());
      return EXIT_OK;
    } catch (IllegalArgumentException | StoreConfigurationException e) {
      log.error(e.getMessage());
      return EXIT_CONFIGURATION;
    } catch (IOException | SecurityException | WorkbookAccessException e) {
      log.error("Cannot read workbook {}: {}", file, e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private List<String> projectNames(ApplicationArguments args) {
    if (!args.containsOption("project")) {
      return orchestrator.getProjectDefinitions().stream()
          .map(ProjectDefinition::getProjectName)
          .collect(Collectors.toList());
    }
    return args.getOptionValues("project").stream()
        .filter(name -> !name.isBlank())
        .collect(Collectors.toList());
  }
}
