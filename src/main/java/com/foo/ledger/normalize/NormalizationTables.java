package com.foo.ledger.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable lookup tables for one project. Keys are stored lower-cased and trimmed.
 *
 * <p>A rep alias mapped to {@link Optional#empty()} is a sentinel meaning "no rep".
 */
public final class NormalizationTables {

  private static final Pattern LEADING_ORDINAL = Pattern.compile("^(\\d+)\\s*[.,]\\s*");

  private final Map<String, UnitStatus> unitStatuses;
  private final Map<String, SaleStatus> saleStatuses;
  private final Map<String, Optional<String>> repAliases;

  private NormalizationTables(Builder builder) {
    this.unitStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(builder.unitStatuses));
    this.saleStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(builder.saleStatuses));
    this.repAliases = Collections.unmodifiableMap(new LinkedHashMap<>(builder.repAliases));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Lookup key: lower-cased, whitespace collapsed, and a leading ordinal written as
   * {@code "2."}, so {@code "2,Reserva"}, {@code "2. reserva"} and {@code "2.reserva"} share one
   * key.
   */
  static String key(String raw) {
    String folded = raw.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    return LEADING_ORDINAL.matcher(folded).replaceFirst("$1.");
  }

  Map<String, UnitStatus> unitStatuses() {
    return unitStatuses;
  }

  Map<String, SaleStatus> saleStatuses() {
    return saleStatuses;
  }

  Map<String, Optional<String>> repAliases() {
    return repAliases;
  }

  public static final class Builder {

    private final Map<String, UnitStatus> unitStatuses = new LinkedHashMap<>();
    private final Map<String, SaleStatus> saleStatuses = new LinkedHashMap<>();
    private final Map<String, Optional<String>> repAliases = new LinkedHashMap<>();

    private Builder() {}

    /** Registers a status spelling that leaves the unit in the given state with no sale. */
    public Builder status(String spelling, UnitStatus unitStatus) {
      unitStatuses.put(key(spelling), unitStatus);
      return this;
    }

    /** Registers a status spelling that puts the unit in the given state under a sale. */
    public Builder status(String spelling, UnitStatus unitStatus, SaleStatus saleStatus) {
      unitStatuses.put(key(spelling), unitStatus);
      saleStatuses.put(key(spelling), saleStatus);
      return this;
    }

    public Builder rep(String alias, String canonicalName) {
      repAliases.put(key(alias), Optional.of(canonicalName));
      return this;
    }

    public Builder noRep(String alias) {
      repAliases.put(key(alias), Optional.empty());
      return this;
    }

    public NormalizationTables build() {
      return new NormalizationTables(this);
    }
  }
}
