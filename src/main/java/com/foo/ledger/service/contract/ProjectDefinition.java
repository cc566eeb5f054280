package com.foo.ledger.service.contract;

import com.foo.ledger.config.LedgerImportConfig;
import com.foo.ledger.normalize.FieldNormalizer;
import lombok.Getter;

/** A project the importer knows how to load, with the layout of its workbook. */
@Getter
public class ProjectDefinition {

  private final String projectName;
  private final String displayName;
  private final LedgerImportConfig config;
  private final FieldNormalizer normalizer;

  public ProjectDefinition(String projectName, String displayName, LedgerImportConfig config) {
    this.projectName = projectName;
    this.displayName = displayName;
    this.config = config;
    this.normalizer = new FieldNormalizer(config.getNormalizationTables());
  }
}
