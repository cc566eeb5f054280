package com.foo.ledger.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Current state of a physical unit. Written from the main section only. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "units",
    uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "unit_number"}))
public class Unit {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "project_id", nullable = false)
  private Long projectId;

  @Column(name = "unit_number", length = 20, nullable = false)
  private String unitNumber;

  @Column(name = "unit_type", length = 50)
  private String unitType;

  @Column(name = "price_with_tax", precision = 15, scale = 2)
  private BigDecimal priceWithTax;

  @Column(name = "price_without_tax", precision = 15, scale = 2)
  private BigDecimal priceWithoutTax;

  @Column(name = "down_payment_amount", precision = 15, scale = 2)
  private BigDecimal downPaymentAmount;

  @Column(name = "status", length = 20, nullable = false)
  private String status;
}
