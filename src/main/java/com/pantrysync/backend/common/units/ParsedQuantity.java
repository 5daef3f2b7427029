package com.pantrysync.backend.common.units;

/**
 * 從自由文字解析出的數量，例如 "2 bags" → (2.0, "bags")、"3" → (3.0, "")。
 * unitSuffix 保留使用者原本寫的字（只 trim），不做正規化。
 */
public record ParsedQuantity(double value, String unitSuffix) {

    public boolean hasUnitSuffix() {
        return unitSuffix != null && !unitSuffix.isEmpty();
    }
}
