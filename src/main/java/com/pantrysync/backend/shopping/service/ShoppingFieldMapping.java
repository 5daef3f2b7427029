package com.pantrysync.backend.shopping.service;

import com.pantrysync.backend.common.units.Units;
import com.pantrysync.backend.shopping.dto.ShoppingCandidate;
import com.pantrysync.backend.shopping.entity.ShoppingListEntry;
import com.pantrysync.backend.shopping.model.ShoppingField;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * candidate → 購物清單資料列的欄位對應。
 * 部署沒有的欄位直接丟掉（不報錯），name 永遠寫入。
 */
public final class ShoppingFieldMapping {

    private final Set<ShoppingField> supported;
    private final String defaultStatus;

    private ShoppingFieldMapping(Set<ShoppingField> supported, String defaultStatus) {
        this.supported = Collections.unmodifiableSet(supported);
        this.defaultStatus = (defaultStatus == null || defaultStatus.isBlank())
                ? ShoppingListEntry.STATUS_PENDING
                : defaultStatus.trim();
    }

    public static ShoppingFieldMapping of(Collection<ShoppingField> fields, String defaultStatus) {
        EnumSet<ShoppingField> set = (fields == null || fields.isEmpty())
                ? EnumSet.noneOf(ShoppingField.class)
                : EnumSet.copyOf(fields);
        return new ShoppingFieldMapping(set, defaultStatus);
    }

    public static ShoppingFieldMapping allFields() {
        return of(EnumSet.allOf(ShoppingField.class), ShoppingListEntry.STATUS_PENDING);
    }

    public boolean supports(ShoppingField field) {
        return supported.contains(field);
    }

    public Set<ShoppingField> supportedFields() {
        return supported;
    }

    public ShoppingListEntry toNewEntry(ShoppingCandidate c) {
        ShoppingListEntry e = new ShoppingListEntry();
        e.setName(c.name());

        if (supports(ShoppingField.BRAND)) e.setBrand(c.brand());
        if (supports(ShoppingField.QUANTITY)) e.setQuantity(Units.formatAmount(c.quantityOrDefault()));
        if (supports(ShoppingField.UNIT)) e.setUnit(c.unit());
        if (supports(ShoppingField.CATEGORY)) e.setCategory(c.category());
        if (supports(ShoppingField.NOTES)) e.setNotes(c.notes());
        if (supports(ShoppingField.STORE)) e.setStore(c.store());
        if (supports(ShoppingField.LINKED_PANTRY_ID)) e.setLinkedPantryId(c.linkedPantryId());
        if (supports(ShoppingField.STATUS)) {
            boolean hasStatus = c.status() != null && !c.status().isBlank();
            e.setStatus(hasStatus ? c.status() : defaultStatus);
        }
        return e;
    }
}
