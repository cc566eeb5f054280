package com.foo.ledger.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "sales_reps")
public class SalesRep {

  /** Canonical rep name, or a short code such as {@code "walk_in"}. */
  @Id
  @Column(name = "id", length = 100)
  private String id;

  @Column(name = "name", length = 100, nullable = false)
  private String name;
}
