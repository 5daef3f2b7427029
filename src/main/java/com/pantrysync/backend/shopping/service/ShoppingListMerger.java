package com.pantrysync.backend.shopping.service;

import com.pantrysync.backend.common.units.ParsedQuantity;
import com.pantrysync.backend.common.units.Units;
import com.pantrysync.backend.shopping.dto.ShoppingCandidate;
import com.pantrysync.backend.shopping.entity.ShoppingListEntry;
import com.pantrysync.backend.shopping.model.MergeOutcome;
import com.pantrysync.backend.shopping.model.ShoppingField;
import com.pantrysync.backend.shopping.repo.ShoppingListEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 購物清單 merge-or-insert：
 * 1) 有 linkedPantryId → 找同一個 pantry 項目的 open 列
 * 2) 沒有 → 找 name + unit 相同的 open 列
 * 找到就累加數量（其他欄位不動），找不到才新增。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShoppingListMerger {

    private final ShoppingListEntryRepository repo;
    private final ShoppingFieldMapping mapping;

    @Transactional
    public MergeOutcome mergeOrInsert(ShoppingCandidate candidate) {
        if (candidate == null || candidate.name() == null || candidate.name().isBlank()) {
            throw new IllegalArgumentException("shopping candidate name is required");
        }

        Optional<ShoppingListEntry> existing = findOpenMatch(candidate);
        if (existing.isPresent()) {
            return increment(existing.get(), candidate);
        }

        ShoppingListEntry saved = repo.save(mapping.toNewEntry(candidate));
        log.debug("shopping insert id={} name={} linkedPantryId={}",
                saved.getId(), saved.getName(), saved.getLinkedPantryId());
        return MergeOutcome.INSERTED;
    }

    private Optional<ShoppingListEntry> findOpenMatch(ShoppingCandidate c) {
        boolean statusAware = mapping.supports(ShoppingField.STATUS);

        List<ShoppingListEntry> rows;
        if (c.isLinked() && mapping.supports(ShoppingField.LINKED_PANTRY_ID)) {
            rows = statusAware
                    ? repo.findOpenByLinkedPantryId(c.linkedPantryId())
                    : repo.findAnyByLinkedPantryId(c.linkedPantryId());
        } else {
            // schema 沒有 unit 欄位時，既有資料的 unit 一定是 null → 用 "" 比對
            String unit = mapping.supports(ShoppingField.UNIT) && c.unit() != null ? c.unit() : "";
            rows = statusAware
                    ? repo.findOpenByNameAndUnit(c.name(), unit)
                    : repo.findAnyByNameAndUnit(c.name(), unit);
        }
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private MergeOutcome increment(ShoppingListEntry row, ShoppingCandidate c) {
        if (!mapping.supports(ShoppingField.QUANTITY)) {
            return MergeOutcome.ALREADY_LISTED;
        }

        String current = row.getQuantity();
        ParsedQuantity parsed;
        if (current == null || current.isBlank()) {
            parsed = new ParsedQuantity(0.0d, "");
        } else {
            Optional<ParsedQuantity> p = Units.parseQuantity(current);
            if (p.isEmpty()) {
                // 使用者手寫的非數字（例如 "some"）→ 不動它，也不新增重複列
                log.debug("shopping id={} quantity '{}' not numeric, treated as already listed", row.getId(), current);
                return MergeOutcome.ALREADY_LISTED;
            }
            parsed = p.get();
        }

        String next = Units.formatAmount(parsed.value() + c.quantityOrDefault());
        if (parsed.hasUnitSuffix()) next = next + " " + parsed.unitSuffix();

        row.setQuantity(next);
        repo.save(row);
        log.debug("shopping increment id={} quantity {} -> {}", row.getId(), current, next);
        return MergeOutcome.INCREMENTED;
    }
}
