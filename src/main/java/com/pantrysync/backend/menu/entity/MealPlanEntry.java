package com.pantrysync.backend.menu.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(
        name = "menu_entries",
        indexes = @Index(name = "idx_menu_entries_pending", columnList = "usage_applied, plan_date")
)
public class MealPlanEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "plan_date", nullable = false)
    private LocalDate planDate;

    @Column(name = "recipe_id", nullable = false)
    private Long recipeId;

    /** 份數倍率；null 視為 1 */
    @Column(name = "servings")
    private Double servings;

    /** 一次性旗標：pantry 扣量已套用過就不再處理 */
    @Column(name = "usage_applied", nullable = false)
    private boolean usageApplied = false;

    @Column(name = "applied_at")
    private Instant appliedAt;

    public double servingsOrDefault() {
        return servings == null ? 1.0d : servings;
    }

    public void markApplied(Instant now) {
        this.usageApplied = true;
        this.appliedAt = now;
    }
}
