package com.pantrysync.backend.consumption.service;

import com.pantrysync.backend.consumption.config.ConsumptionProperties;
import com.pantrysync.backend.consumption.dto.SyncReport;
import com.pantrysync.backend.consumption.web.ConsumptionSyncException;
import com.pantrysync.backend.menu.entity.MealPlanEntry;
import com.pantrysync.backend.menu.repo.MealPlanEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 依 menu 排程扣 pantry 庫存，低於門檻自動加入購物清單。
 * 可重複執行：usage_applied 已是 true 的 entry 不會再扣第二次。
 *
 * 流程：撈 plan_date <= asOf 且未套用的 entry（依 date, id）→ 一筆一筆交給 {@link MealPlanEntryApplier}。
 * 食材層級的問題只計數；DB 層級失敗才會中止並往外丟 {@link ConsumptionSyncException}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsumptionSyncEngine {

    private final MealPlanEntryRepository menuRepo;
    private final MealPlanEntryApplier applier;
    private final ConsumptionProperties props;
    private final Clock clock;

    /** asOf = 設定時區的今天 */
    public SyncReport syncMenuConsumption() {
        return syncMenuConsumption(LocalDate.now(clock.withZone(props.zoneId())));
    }

    public SyncReport syncMenuConsumption(LocalDate asOf) {
        if (asOf == null) throw new IllegalArgumentException("asOf is required");

        List<MealPlanEntry> pending = menuRepo.findPendingUpTo(asOf);
        if (pending.isEmpty()) {
            log.debug("consumption sync asOf={}: nothing pending", asOf);
            return SyncReport.zero();
        }

        SyncReport total = SyncReport.zero();
        for (MealPlanEntry entry : pending) {
            try {
                total = total.plus(applier.apply(entry.getId()));
            } catch (DataAccessException | TransactionException e) {
                log.warn("consumption sync aborted at entry={} asOf={} committedSoFar={}",
                        entry.getId(), asOf, total, e);
                throw new ConsumptionSyncException(entry.getId(), total, e);
            }
        }

        log.info("consumption sync asOf={} processed={} updatedItems={} skippedIngredients={} autoAdded={}",
                asOf, total.processedEntries(), total.updatedItems(), total.skippedIngredients(), total.autoAdded());
        return total;
    }
}
