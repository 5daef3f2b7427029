package com.pantrysync.backend.consumption.dto;

/** 一次 sync 的統計；auto_added 算的是觸發次數，不是新增幾列 */
public record SyncReport(
        int processedEntries,
        int updatedItems,
        int skippedIngredients,
        int autoAdded
) {
    private static final SyncReport ZERO = new SyncReport(0, 0, 0, 0);

    public static SyncReport zero() {
        return ZERO;
    }

    public SyncReport plus(SyncReport other) {
        if (other == null) return this;
        return new SyncReport(
                processedEntries + other.processedEntries,
                updatedItems + other.updatedItems,
                skippedIngredients + other.skippedIngredients,
                autoAdded + other.autoAdded
        );
    }
}
