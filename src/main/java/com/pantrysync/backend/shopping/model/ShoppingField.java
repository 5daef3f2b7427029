package com.pantrysync.backend.shopping.model;

/**
 * 購物清單可選欄位。name 永遠必填，不在這裡列。
 * 部署時用 pantry.shopping.fields 宣告「這個 schema 有哪些欄位」，沒宣告的一律不寫。
 */
public enum ShoppingField {
    BRAND,
    QUANTITY,
    UNIT,
    CATEGORY,
    NOTES,
    STORE,
    STATUS,
    LINKED_PANTRY_ID
}
