package com.pantrysync.backend.shopping.dto;

/**
 * 要放進購物清單的候選項目。除了 name 以外都可以是 null。
 */
public record ShoppingCandidate(
        String name,
        String brand,
        Double quantity,
        String unit,
        String category,
        String notes,
        String store,
        String status,
        Long linkedPantryId
) {

    public boolean isLinked() {
        return linkedPantryId != null;
    }

    public double quantityOrDefault() {
        return quantity == null ? 1.0d : quantity;
    }
}
