package com.foo.ledger.normalize;

import java.util.Optional;

/**
 * Maps free-text ledger values to canonical values using one project's tables.
 *
 * <p>Every method is total: it never throws and always returns a defined value or {@code null}.
 */
public class FieldNormalizer {

  private final NormalizationTables tables;

  public FieldNormalizer(NormalizationTables tables) {
    this.tables = tables;
  }

  /** Unit state for a raw status; blank and unrecognized text both mean {@code available}. */
  public UnitStatus normalizeUnitStatus(String raw) {
    if (isBlank(raw)) {
      return UnitStatus.AVAILABLE;
    }
    return tables.unitStatuses().getOrDefault(NormalizationTables.key(raw), UnitStatus.AVAILABLE);
  }

  /**
   * Sale state for a raw status, or {@code null} when the record does not stand for a sale
   * (availability or unrecognized text).
   */
  public SaleStatus normalizeSaleStatus(String raw) {
    if (isBlank(raw)) {
      return null;
    }
    return tables.saleStatuses().get(NormalizationTables.key(raw));
  }

  /** Whether a non-blank raw status has an entry in the status table. */
  public boolean isKnownStatus(String raw) {
    return !isBlank(raw) && tables.unitStatuses().containsKey(NormalizationTables.key(raw));
  }

  /**
   * Canonical rep name. Sentinel aliases give {@code null}; unregistered names pass through
   * trimmed.
   */
  public String normalizeRepName(String raw) {
    if (isBlank(raw)) {
      return null;
    }
    Optional<String> canonical = tables.repAliases().get(NormalizationTables.key(raw));
    if (canonical != null) {
      return canonical.orElse(null);
    }
    return raw.trim();
  }

  /** Client identity key: trimmed with inner whitespace collapsed, {@code null} when blank. */
  public String normalizeClientName(String raw) {
    if (isBlank(raw)) {
      return null;
    }
    return raw.trim().replaceAll("\\s+", " ");
  }

  private static boolean isBlank(String raw) {
    return raw == null || raw.isBlank();
  }
}
