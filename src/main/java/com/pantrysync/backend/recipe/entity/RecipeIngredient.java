package com.pantrysync.backend.recipe.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(
        name = "recipe_ingredients",
        indexes = @Index(name = "idx_recipe_ingredients_recipe", columnList = "recipe_id")
)
public class RecipeIngredient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "recipe_id", nullable = false)
    private Long recipeId;

    @Column(name = "name")
    private String name;

    /** 單人份用量；null 視為 0 */
    @Column(name = "quantity")
    private Double quantity;

    @Column(name = "unit", length = 32)
    private String unit;

    /** 沒連到 pantry 的食材不參與扣量 */
    @Column(name = "linked_pantry_id")
    private Long linkedPantryId;

    public double quantityPerServing() {
        return quantity == null ? 0.0d : quantity;
    }
}
