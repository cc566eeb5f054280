package com.foo.ledger.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One ownership episode of a unit. At most one sale per unit has status {@code active}; that
 * rule is enforced on write by the store, since it is a partial uniqueness constraint.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "sales",
    indexes = {
      @Index(name = "idx_sales_unit_status", columnList = "unit_id, status"),
      @Index(name = "idx_sales_project", columnList = "project_id")
    })
public class Sale {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "project_id", nullable = false)
  private Long projectId;

  @Column(name = "unit_id", nullable = false)
  private Long unitId;

  @Column(name = "client_id", nullable = false)
  private Long clientId;

  @Column(name = "sales_rep_id", length = 100)
  private String salesRepId;

  @Column(name = "sale_date", nullable = false)
  private LocalDate saleDate;

  @Column(name = "price_with_tax", precision = 15, scale = 2)
  private BigDecimal priceWithTax;

  @Column(name = "price_without_tax", precision = 15, scale = 2)
  private BigDecimal priceWithoutTax;

  @Column(name = "down_payment_amount", precision = 15, scale = 2)
  private BigDecimal downPaymentAmount;

  @Column(name = "financed_amount", precision = 15, scale = 2)
  private BigDecimal financedAmount;

  @Column(name = "status", length = 20, nullable = false)
  private String status;

  @Column(name = "referral_applies", nullable = false)
  private boolean referralApplies;

  @Column(name = "special_case", nullable = false)
  private boolean specialCase;

  @Column(name = "special_case_type", length = 100)
  private String specialCaseType;

  @Column(name = "observations", length = 1000)
  private String observations;

  @Column(name = "notes", length = 1000)
  private String notes;
}
