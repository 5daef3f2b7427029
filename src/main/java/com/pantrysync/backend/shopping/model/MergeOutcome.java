package com.pantrysync.backend.shopping.model;

public enum MergeOutcome {
    /** 沒有可合併的 open 項目 → 新增一筆 */
    INSERTED,
    /** 已有 open 項目 → 數量累加 */
    INCREMENTED,
    /** 已有 open 項目但數量無法累加（非數字 / 沒有數量欄位）→ 視為已在清單上 */
    ALREADY_LISTED
}
