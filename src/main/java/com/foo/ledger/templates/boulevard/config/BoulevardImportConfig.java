package com.foo.ledger.templates.boulevard.config;

import static com.foo.ledger.model.LedgerField.AGREED_INSTALLMENT_AMOUNT;
import static com.foo.ledger.model.LedgerField.AGREED_RESERVATION_AMOUNT;
import static com.foo.ledger.model.LedgerField.CLIENT;
import static com.foo.ledger.model.LedgerField.DOWN_PAYMENT;
import static com.foo.ledger.model.LedgerField.FINANCED_BALANCE;
import static com.foo.ledger.model.LedgerField.INSTALLMENTS_AGREED;
import static com.foo.ledger.model.LedgerField.INSTALLMENTS_PAID;
import static com.foo.ledger.model.LedgerField.IVA;
import static com.foo.ledger.model.LedgerField.NOTES;
import static com.foo.ledger.model.LedgerField.OBSERVATIONS;
import static com.foo.ledger.model.LedgerField.PRICE_WITH_TAX;
import static com.foo.ledger.model.LedgerField.RESERVATION_DATE;
import static com.foo.ledger.model.LedgerField.SALES_REP;
import static com.foo.ledger.model.LedgerField.SPECIAL_CASE;
import static com.foo.ledger.model.LedgerField.STAMP_TAX;
import static com.foo.ledger.model.LedgerField.STATUS;
import static com.foo.ledger.model.LedgerField.TOTAL_DOWN_PAYMENTS;
import static com.foo.ledger.model.LedgerField.UNIT_KEY;
import static com.foo.ledger.model.LedgerField.UNIT_TYPE;

import com.foo.ledger.config.BudgetLayout;
import com.foo.ledger.config.HeaderPattern;
import com.foo.ledger.config.LedgerImportConfig;
import com.foo.ledger.config.SectionLayout;
import com.foo.ledger.config.TaxComponentSubtraction;
import com.foo.ledger.config.TaxStrategy;
import com.foo.ledger.model.LifecycleSection;
import com.foo.ledger.normalize.NormalizationTables;
import com.foo.ledger.normalize.SaleStatus;
import com.foo.ledger.normalize.UnitStatus;
import java.util.List;
import java.util.Map;

public class BoulevardImportConfig implements LedgerImportConfig {

  private static final List<HeaderPattern> HEADER_PATTERNS =
      List.of(
          HeaderPattern.of(UNIT_KEY, "apto", "apto."),
          HeaderPattern.of(UNIT_TYPE, "tipo", "tipo.", "modelo"),
          HeaderPattern.of(NOTES, "notas"),
          HeaderPattern.of(SALES_REP, "vendedor"),
          HeaderPattern.of(CLIENT, "cliente"),
          HeaderPattern.of(RESERVATION_DATE, "fecha reserva", "fecha"),
          HeaderPattern.of(STATUS, "estatus", "tipo de plan"),
          HeaderPattern.of(PRICE_WITH_TAX, "precio de venta", "p. venta", "p.venta"),
          HeaderPattern.of(DOWN_PAYMENT, "enganche"),
          HeaderPattern.of(TOTAL_DOWN_PAYMENTS, "total enganches y reservas"),
          HeaderPattern.of(FINANCED_BALANCE, "saldo a financiar por el banco"),
          HeaderPattern.of(INSTALLMENTS_AGREED, "cuotas pactadas"),
          HeaderPattern.of(AGREED_RESERVATION_AMOUNT, "monto de reserva pactado"),
          HeaderPattern.of(AGREED_INSTALLMENT_AMOUNT, "monto de cuota pactada"),
          HeaderPattern.of(INSTALLMENTS_PAID, "cuotas pagadas"),
          HeaderPattern.of(SPECIAL_CASE, "caso especial / f&f", "caso especial"),
          HeaderPattern.of(OBSERVATIONS, "observaciones"),
          HeaderPattern.of(IVA, "iva"),
          HeaderPattern.of(STAMP_TAX, "timbres"));

  private static final NormalizationTables TABLES =
      NormalizationTables.builder()
          .status("1.disponible", UnitStatus.AVAILABLE)
          .status("2.reserva", UnitStatus.RESERVED, SaleStatus.ACTIVE)
          .status("4.plan de pagos", UnitStatus.SOLD, SaleStatus.ACTIVE)
          .status("desistimiento", UnitStatus.CANCELLED, SaleStatus.CANCELLED)
          .rep("ronaldo", "Ronaldo Ogaldez")
          .rep("ronaldo ogaldez", "Ronaldo Ogaldez")
          .rep("anahi cisneros", "Anahí Cisneros")
          .rep("anahí cisneros", "Anahí Cisneros")
          .rep("puerta abierta", "walk_in")
          .noRep("**")
          .noRep("sin datos")
          .build();

  @Override
  public String getActualsSheetName() {
    return "BOULEVARD 5";
  }

  @Override
  public List<SectionLayout> getSections() {
    return List.of(
        new SectionLayout(LifecycleSection.MAIN, 6, 7, 304),
        new SectionLayout(LifecycleSection.CANCELLED, 319, 320, 351),
        new SectionLayout(LifecycleSection.DISPUTED_CANCELLED, 357, 358, 366));
  }

  @Override
  public String getLastColumn() {
    return "CF";
  }

  @Override
  public List<HeaderPattern> getHeaderPatterns() {
    return HEADER_PATTERNS;
  }

  @Override
  public BudgetLayout getBudgetLayout() {
    return new BudgetLayout(
        "BOULEVARD PPTO",
        1,
        2,
        299,
        "A",
        "BJ",
        List.of(HeaderPattern.of(UNIT_KEY, "apto", "apto."), HeaderPattern.of(STATUS, "estatus")),
        false);
  }

  @Override
  public NormalizationTables getNormalizationTables() {
    return TABLES;
  }

  @Override
  public TaxStrategy getTaxStrategy() {
    return new TaxComponentSubtraction();
  }

  @Override
  public boolean isSalesRepTableEnabled() {
    return true;
  }

  @Override
  public Map<String, String> getSalesRepDisplayNames() {
    return Map.of(
        "walk_in", "Puerta Abierta",
        "unknown", "Unknown / Directo",
        "05", "Sales Rep 05",
        "06", "Sales Rep 06",
        "35", "Sales Rep 35",
        "GV1", "Sales Rep GV1");
  }
}
