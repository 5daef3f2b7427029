package com.pantrysync.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class PantrySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PantrySyncApplication.class, args);
    }

    // 每日扣量排程只在非 test profile 開；測試直接呼叫 ConsumptionSyncEngine 並自己給 asOf
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingConfig {
    }
}
