package com.pantrysync.backend.consumption.service;

import com.pantrysync.backend.common.units.UnitFamily;
import com.pantrysync.backend.common.units.Units;
import com.pantrysync.backend.consumption.config.ConsumptionProperties;
import com.pantrysync.backend.consumption.dto.SyncReport;
import com.pantrysync.backend.consumption.model.UnitPolicy;
import com.pantrysync.backend.menu.entity.MealPlanEntry;
import com.pantrysync.backend.menu.repo.MealPlanEntryRepository;
import com.pantrysync.backend.pantry.entity.PantryItem;
import com.pantrysync.backend.pantry.repo.PantryItemRepository;
import com.pantrysync.backend.recipe.entity.RecipeIngredient;
import com.pantrysync.backend.recipe.repo.RecipeIngredientRepository;
import com.pantrysync.backend.shopping.dto.ShoppingCandidate;
import com.pantrysync.backend.shopping.entity.ShoppingListEntry;
import com.pantrysync.backend.shopping.model.MergeOutcome;
import com.pantrysync.backend.shopping.service.ShoppingListMerger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 套用單一 menu entry：扣 pantry → 檢查補貨門檻 → 寫購物清單 → 標記 usage_applied。
 * 一筆 entry 一個 transaction（REQUIRES_NEW）：中途 DB 失敗整筆 rollback，不會只扣一半。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MealPlanEntryApplier {

    static final String DEFAULT_ITEM_NAME = "Item";
    static final double RESTOCK_QUANTITY = 1.0d;

    private final MealPlanEntryRepository menuRepo;
    private final RecipeIngredientRepository ingredientRepo;
    private final PantryItemRepository pantryRepo;
    private final ShoppingListMerger shoppingMerger;
    private final ConsumptionProperties props;
    private final Clock clock;

    /**
     * @return 這筆 entry 的統計；entry 已被別的 run 套用過（或不存在）→ zero
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncReport apply(Long entryId) {
        // 鎖住 entry 再檢查旗標：兩個 sync 同時跑時，後到的會看到 applied=true 直接跳過
        Optional<MealPlanEntry> locked = menuRepo.findByIdForUpdate(entryId);
        if (locked.isEmpty() || locked.get().isUsageApplied()) {
            log.debug("menu entry {} already applied or gone, skip", entryId);
            return SyncReport.zero();
        }
        MealPlanEntry entry = locked.get();
        double servings = entry.servingsOrDefault();

        int updated = 0, skipped = 0, autoAdded = 0;

        for (RecipeIngredient ing : ingredientRepo.findByRecipeIdOrderByIdAsc(entry.getRecipeId())) {
            Long pid = ing.getLinkedPantryId();
            if (pid == null) {
                skipped++;
                log.debug("entry={} ingredient={} not linked to pantry, skip", entryId, ing.getId());
                continue;
            }
            PantryItem item = pantryRepo.findByIdForUpdate(pid).orElse(null);
            if (item == null) {
                skipped++;
                log.debug("entry={} ingredient={} pantry item {} not found, skip", entryId, ing.getId(), pid);
                continue;
            }

            // 先更新基準，再扣量（補貨後 ratio 門檻才有意義）
            if (item.ensureBaseline()) pantryRepo.save(item);

            double required = ing.quantityPerServing() * servings;
            OptionalDouble converted = resolveRequired(required, ing.getUnit(), item.getUnit());
            if (converted.isEmpty()) {
                skipped++;
                log.debug("entry={} ingredient={} unit '{}' incompatible with pantry unit '{}', skip",
                        entryId, ing.getId(), ing.getUnit(), item.getUnit());
                continue;
            }

            double remaining = item.deduct(converted.getAsDouble());
            pantryRepo.save(item);
            updated++;

            OptionalDouble cutoff = item.replenishCutoff();
            if (cutoff.isPresent() && remaining <= cutoff.getAsDouble()) {
                MergeOutcome outcome = shoppingMerger.mergeOrInsert(restockCandidate(item, remaining, cutoff.getAsDouble()));
                autoAdded++;
                log.debug("entry={} pantry={} remaining={} cutoff={} -> shopping {}",
                        entryId, pid, remaining, cutoff.getAsDouble(), outcome);
            }
        }

        entry.markApplied(Instant.now(clock));
        menuRepo.save(entry);

        return new SyncReport(1, updated, skipped, autoAdded);
    }

    OptionalDouble resolveRequired(double required, String ingredientUnit, String pantryUnit) {
        OptionalDouble strict = Units.convertIfCompatible(required, ingredientUnit, pantryUnit);
        if (strict.isPresent()) return strict;

        if (props.getUnitPolicy() == UnitPolicy.PERMISSIVE
                && (Units.classify(ingredientUnit) == UnitFamily.UNKNOWN
                    || Units.classify(pantryUnit) == UnitFamily.UNKNOWN)) {
            return OptionalDouble.of(required);
        }
        return OptionalDouble.empty();
    }

    static ShoppingCandidate restockCandidate(PantryItem item, double remaining, double cutoff) {
        String name = (item.getName() == null || item.getName().isBlank()) ? DEFAULT_ITEM_NAME : item.getName();
        String unit = item.getUnit() == null ? "" : item.getUnit().trim();

        StringBuilder notes = new StringBuilder("Auto-added: remaining ").append(Units.formatAmount(remaining));
        if (!unit.isEmpty()) notes.append(' ').append(unit);
        notes.append(" ≤ threshold ").append(Units.formatAmount(cutoff));

        return new ShoppingCandidate(
                name,
                item.getBrand(),
                RESTOCK_QUANTITY,
                item.getUnit(),
                item.getCategory(),
                notes.toString(),
                item.getStore(),
                ShoppingListEntry.STATUS_PENDING,
                item.getId()
        );
    }
}
