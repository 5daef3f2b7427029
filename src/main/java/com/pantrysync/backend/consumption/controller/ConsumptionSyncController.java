package com.pantrysync.backend.consumption.controller;

import com.pantrysync.backend.consumption.dto.SyncReport;
import com.pantrysync.backend.consumption.service.ConsumptionSyncEngine;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/consumption")
public class ConsumptionSyncController {

    private final ConsumptionSyncEngine engine;

    public ConsumptionSyncController(ConsumptionSyncEngine engine) {
        this.engine = engine;
    }

    /**
     * 手動觸發（例如使用者在行事曆按「套用」）。
     * asOf 省略 → 伺服器設定時區的今天。
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncReport> sync(
            @RequestParam(value = "asOf", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf
    ) {
        SyncReport report = (asOf == null) ? engine.syncMenuConsumption() : engine.syncMenuConsumption(asOf);
        return ResponseEntity.ok(report);
    }
}
