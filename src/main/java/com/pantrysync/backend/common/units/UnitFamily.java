package com.pantrysync.backend.common.units;

/**
 * 單位家族：質量以 g 為標準，容量以 ml 為標準，其餘一律 UNKNOWN（含空字串、個數單位）。
 */
public enum UnitFamily {
    MASS("g"),
    VOLUME("ml"),
    UNKNOWN(null);

    private final String canonicalUnit;

    UnitFamily(String canonicalUnit) {
        this.canonicalUnit = canonicalUnit;
    }

    /** g / ml；UNKNOWN 沒有標準單位（回 null） */
    public String canonicalUnit() {
        return canonicalUnit;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
