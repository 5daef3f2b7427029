package com.pantrysync.backend.shopping.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(
        name = "shopping_list",
        indexes = {
                @Index(name = "idx_shop_linked_pantry", columnList = "linked_pantry_id"),
                @Index(name = "idx_shop_name_unit", columnList = "name, unit")
        }
)
public class ShoppingListEntry {

    public static final String STATUS_PENDING = "pending";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "brand")
    private String brand;

    /** 使用者可手動改成 "2 bags" 之類的文字，所以存字串 */
    @Column(name = "quantity", length = 64)
    private String quantity;

    @Column(name = "unit", length = 32)
    private String unit;

    @Column(name = "category")
    private String category;

    @Column(name = "notes", length = 512)
    private String notes;

    @Column(name = "store")
    private String store;

    /** pending / purchased / ...；null 或空字串也算 open */
    @Column(name = "status", length = 32)
    private String status;

    @Column(name = "linked_pantry_id")
    private Long linkedPantryId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isOpen() {
        return status == null || status.isBlank() || STATUS_PENDING.equalsIgnoreCase(status.trim());
    }
}
