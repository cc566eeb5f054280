package com.foo.ledger.templates.santaelisa.config;

import static com.foo.ledger.model.LedgerField.CLIENT;
import static com.foo.ledger.model.LedgerField.DOWN_PAYMENT;
import static com.foo.ledger.model.LedgerField.FINANCED_BALANCE;
import static com.foo.ledger.model.LedgerField.INSTALLMENTS_AGREED;
import static com.foo.ledger.model.LedgerField.INSTALLMENTS_PAID;
import static com.foo.ledger.model.LedgerField.PRICE_WITH_TAX;
import static com.foo.ledger.model.LedgerField.RESERVATION_DATE;
import static com.foo.ledger.model.LedgerField.SALES_REP;
import static com.foo.ledger.model.LedgerField.STATUS;
import static com.foo.ledger.model.LedgerField.UNIT_KEY;
import static com.foo.ledger.model.LedgerField.UNIT_TYPE;

import com.foo.ledger.config.BudgetLayout;
import com.foo.ledger.config.HeaderPattern;
import com.foo.ledger.config.LedgerImportConfig;
import com.foo.ledger.config.SectionLayout;
import com.foo.ledger.config.TaxInclusiveDivisor;
import com.foo.ledger.config.TaxStrategy;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.normalize.NormalizationTables;
import com.foo.ledger.normalize.SaleStatus;
import com.foo.ledger.normalize.UnitStatus;
import java.math.BigDecimal;
import java.util.List;

public class SantaElisaImportConfig implements LedgerImportConfig {

  private static final int HEADER_ROW = 4;

  /** IVA 8.4% plus stamp tax 0.9% of the net price. */
  private static final BigDecimal TAX_DIVISOR = new BigDecimal("1.093");

  private static final List<HeaderPattern> HEADER_PATTERNS =
      List.of(
          HeaderPattern.of(UNIT_KEY, "apto", "apto."),
          HeaderPattern.of(UNIT_TYPE, "tipo", "tipo.", "modelo"),
          HeaderPattern.of(SALES_REP, "vendedor"),
          HeaderPattern.of(CLIENT, "cliente"),
          HeaderPattern.of(RESERVATION_DATE, "reservado", "fecha reserva", "fecha"),
          HeaderPattern.of(STATUS, "estatus", "tipo de plan"),
          HeaderPattern.of(PRICE_WITH_TAX, "precio de venta", "p. venta", "p.venta"),
          HeaderPattern.of(DOWN_PAYMENT, "enganche"),
          HeaderPattern.of(
              FINANCED_BALANCE, "monto a financiar por banco", "saldo a financiar por el banco"),
          HeaderPattern.of(INSTALLMENTS_AGREED, "cuotas pactadas"),
          HeaderPattern.of(INSTALLMENTS_PAID, "cuotas pagadas"));

  private static final NormalizationTables TABLES =
      NormalizationTables.builder()
          .status("1.disponible", UnitStatus.AVAILABLE)
          .status("2.reserva", UnitStatus.RESERVED, SaleStatus.ACTIVE)
          .status("2.reservado", UnitStatus.RESERVED, SaleStatus.ACTIVE)
          .status("4.plan de pagos", UnitStatus.SOLD, SaleStatus.ACTIVE)
          .status("desistimiento", UnitStatus.CANCELLED, SaleStatus.CANCELLED)
          .rep("noemi m.", "Noemí Menendez")
          .rep("noemí menendez", "Noemí Menendez")
          .rep("paula h.", "Paula Hernández")
          .rep("paula hernández", "Paula Hernández")
          .rep("paula hernandez", "Paula Hernández")
          .rep("andrea g.", "Andrea Gonzalez")
          .rep("andrea gonzalez", "Andrea Gonzalez")
          .rep("antonio r", "Antonio Rada")
          .rep("antonio rada", "Antonio Rada")
          .rep("eder v.", "Eder Veliz")
          .rep("eder daniel v.", "Eder Veliz")
          .rep("eder veliz", "Eder Veliz")
          .rep("efren sanchez", "Efren Sánchez")
          .rep("efren sánchez", "Efren Sánchez")
          .rep("efren sanchéz", "Efren Sánchez")
          .rep("efrén sanchez", "Efren Sánchez")
          // full names unknown
          .rep("ricardo o.", "Ricardo O.")
          .rep("francisco s.", "Francisco S.")
          .rep("lilian g.", "Lilian G.")
          .noRep("**")
          .noRep("sin datos")
          .build();

  @Override
  public String getActualsSheetName() {
    return "SANTA ELISA";
  }

  /** The cancelled and refund blocks only carry a label row, so they read the main header. */
  @Override
  public List<SectionLayout> getSections() {
    return List.of(
        new SectionLayout(LifecycleSection.MAIN, HEADER_ROW, 5, 79),
        new SectionLayout(LifecycleSection.CANCELLED, HEADER_ROW, 85, 100),
        new SectionLayout(LifecycleSection.REFUND, HEADER_ROW, 103, 106));
  }

  @Override
  public String getLastColumn() {
    return "BJ";
  }

  @Override
  public List<HeaderPattern> getHeaderPatterns() {
    return HEADER_PATTERNS;
  }

  @Override
  public BudgetLayout getBudgetLayout() {
    return new BudgetLayout(
        "SANTA ELISA PPTO",
        4,
        5,
        79,
        "A",
        "AL",
        List.of(HeaderPattern.of(UNIT_KEY, "apto", "apto.")),
        true);
  }

  @Override
  public NormalizationTables getNormalizationTables() {
    return TABLES;
  }

  @Override
  public TaxStrategy getTaxStrategy() {
    return new TaxInclusiveDivisor(TAX_DIVISOR);
  }

  @Override
  public String getUnknownSalesRepId() {
    return "Unknown";
  }
}
