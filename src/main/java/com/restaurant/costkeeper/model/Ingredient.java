package com.restaurant.costkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Catalog ingredient. Master data shared by all tenants; the costing core only reads it.
 */
@Entity
@Table(name = "ingredients")
@Data
@org.hibernate.annotations.SQLDelete(sql = "UPDATE ingredients SET deleted = true WHERE id = ?")
@org.hibernate.annotations.SQLRestriction("deleted = false")
public class Ingredient {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UnitOfMeasure unit;

    private String category;

    // Default shelf life in days
    private Integer shelfLifeDays;

    @Column(length = 500)
    private String allergens;

    // Below this total remaining quantity a low-stock alert is raised
    @Column(precision = 19, scale = 4)
    private BigDecimal minStockThreshold = BigDecimal.ZERO;

    private boolean deleted = false;
}
