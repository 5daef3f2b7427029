package com.pantrysync.backend.pantry.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.OptionalDouble;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(name = "pantry_items")
public class PantryItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "brand")
    private String brand;

    @Column(name = "category")
    private String category;

    @Column(name = "store")
    private String store;

    /** 原生單位（g / ml / pcs / 自由文字） */
    @Column(name = "unit", length = 32)
    private String unit;

    /** 目前剩餘量（原生單位）；null 視為 0 */
    @Column(name = "amount")
    private Double amount;

    /** 有紀錄以來的最高量，ratio threshold 的 100% 基準；可為 null */
    @Column(name = "base_amount")
    private Double baseAmount;

    /**
     * (0,1] → baseAmount 的比例；> 1 → 絕對剩餘量；<= 0 / null → 不自動補貨
     */
    @Column(name = "threshold")
    private Double threshold;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist @PreUpdate
    public void touchUpdatedAt() {
        this.updatedAt = Instant.now();
    }

    public double currentAmount() {
        return amount == null ? 0.0d : amount;
    }

    /**
     * 補貨後量超過舊基準（或還沒有基準）→ 基準拉到目前量。
     * @return 是否有更新
     */
    public boolean ensureBaseline() {
        double now = currentAmount();
        if (baseAmount == null || now > baseAmount) {
            this.baseAmount = now;
            return true;
        }
        return false;
    }

    /** 扣量，clamp 到 >= 0（超用不報錯）；used <= 0 不動庫存 */
    public double deduct(double used) {
        if (!(used > 0.0d)) return currentAmount();
        double remaining = Math.max(currentAmount() - used, 0.0d);
        this.amount = remaining;
        return remaining;
    }

    /**
     * 補貨門檻（原生單位）。
     * 比例型以 baseAmount 換算；算出來 <= 0 視同沒有門檻。
     */
    public OptionalDouble replenishCutoff() {
        double thr = threshold == null ? 0.0d : threshold;
        double cutoff;
        if (thr > 0.0d && thr <= 1.0d) {
            cutoff = (baseAmount == null ? 0.0d : baseAmount) * thr;
        } else {
            cutoff = thr;
        }
        return cutoff > 0.0d ? OptionalDouble.of(cutoff) : OptionalDouble.empty();
    }
}
