package com.pantrysync.backend.consumption.model;

/**
 * 食材單位跟 pantry 單位對不上時的處理方式。
 * 同一家族一定換算；質量對容量（兩邊都已知）一定跳過。差別只在「有一邊是 UNKNOWN」：
 */
public enum UnitPolicy {
    /** 單位字面不同就跳過（預設） */
    STRICT,
    /** 有一邊 UNKNOWN 時照原數字扣（例如 "pcs" 對 "piece"） */
    PERMISSIVE
}
