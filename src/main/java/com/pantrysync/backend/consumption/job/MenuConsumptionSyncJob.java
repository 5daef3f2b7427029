package com.pantrysync.backend.consumption.job;

import com.pantrysync.backend.consumption.config.ConsumptionProperties;
import com.pantrysync.backend.consumption.dto.SyncReport;
import com.pantrysync.backend.consumption.service.ConsumptionSyncEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

//頻率：每天 00:15（pantry.consumption.zone 時區）跑一次，把「到今天為止」還沒套用的 menu entry 扣掉。
//不用 @Transactional：每筆 entry 自己一個 transaction（見 MealPlanEntryApplier）。
//失敗只記 log，下次排程會接著處理還沒套用的 entry。
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "pantry.consumption.job", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MenuConsumptionSyncJob {

    static final String MDC_KEY = "rid";

    private final ConsumptionSyncEngine engine;
    private final ConsumptionProperties props;

    @Scheduled(cron = "${pantry.consumption.job.cron:0 15 0 * * *}", zone = "${pantry.consumption.zone:UTC}")
    public void run() {
        if (!props.getJob().isEnabled()) return;

        MDC.put(MDC_KEY, "sync-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            SyncReport report = engine.syncMenuConsumption();
            log.info("MenuConsumptionSyncJob finished: {}", report);
        } catch (Exception e) {
            log.warn("MenuConsumptionSyncJob failed: {}", e.toString(), e);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
