package com.restaurant.costkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * A recipe used inside another recipe. The quantity is the fraction of the component's
 * full yield that the parent consumes.
 */
@Entity
@Table(name = "recipe_components")
@Data
public class RecipeComponent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "recipe_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Recipe recipe;

    @ManyToOne(optional = false)
    @JoinColumn(name = "component_recipe_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Recipe componentRecipe;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @PrePersist
    protected void onCreate() {
        if (recipe != null && componentRecipe != null && recipe == componentRecipe) {
            throw new IllegalStateException("Recipe cannot contain itself as a component");
        }
    }
}
