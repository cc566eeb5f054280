package com.foo.ledger.config;

import com.foo.ledger.model.LedgerField;
import java.util.List;
import java.util.Locale;

/**
 * Header spellings that identify one logical field. Candidates are compared against headers that
 * have been trimmed, lower-cased and whitespace-collapsed, so they are stored the same way.
 */
public record HeaderPattern(LedgerField field, List<String> candidates) {

  /** Candidates this short only ever match a header exactly. */
  public static final int MIN_SUBSTRING_LENGTH = 5;

  public HeaderPattern {
    candidates =
        candidates.stream().map(c -> c.trim().toLowerCase(Locale.ROOT)).toList();
  }

  public static HeaderPattern of(LedgerField field, String... candidates) {
    return new HeaderPattern(field, List.of(candidates));
  }

  public boolean matchesExactly(String normalizedHeader) {
    return candidates.contains(normalizedHeader);
  }

  public boolean matchesPartially(String normalizedHeader) {
    return candidates.stream()
        .anyMatch(c -> c.length() >= MIN_SUBSTRING_LENGTH && normalizedHeader.contains(c));
  }
}
