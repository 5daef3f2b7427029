package com.pantrysync.backend.consumption.config;

import com.pantrysync.backend.consumption.model.UnitPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * application.yml:
 * pantry.consumption.*
 */
@ConfigurationProperties(prefix = "pantry.consumption")
public class ConsumptionProperties {

    /** 「今天」用哪個時區算（沒帶 asOf 時） */
    private String zone = "UTC";

    private UnitPolicy unitPolicy = UnitPolicy.STRICT;

    private Job job = new Job();

    public ZoneId zoneId() {
        return (zone == null || zone.isBlank()) ? ZoneId.of("UTC") : ZoneId.of(zone.trim());
    }

    // ===== getters/setters =====
    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public UnitPolicy getUnitPolicy() { return unitPolicy; }
    public void setUnitPolicy(UnitPolicy unitPolicy) { this.unitPolicy = unitPolicy; }

    public Job getJob() { return job; }
    public void setJob(Job job) { this.job = job; }

    public static class Job {
        /** 一鍵開關 */
        private boolean enabled = true;

        /** @Scheduled 用字串 placeholder 讀這個 key */
        private String cron = "0 15 0 * * *";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }
    }
}
