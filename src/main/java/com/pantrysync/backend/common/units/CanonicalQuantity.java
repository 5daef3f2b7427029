package com.pantrysync.backend.common.units;

/** 換算到標準單位後的數量（MASS=g、VOLUME=ml、UNKNOWN=原值） */
public record CanonicalQuantity(double value, UnitFamily family) {}
