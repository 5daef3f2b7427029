package com.pantrysync.backend.consumption.job;

import com.pantrysync.backend.consumption.config.ConsumptionProperties;
import com.pantrysync.backend.consumption.dto.SyncReport;
import com.pantrysync.backend.consumption.service.ConsumptionSyncEngine;
import com.pantrysync.backend.consumption.web.ConsumptionSyncException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

class MenuConsumptionSyncJobTest {

    @Test
    void run_delegates_to_engine_and_clears_mdc() {
        ConsumptionSyncEngine engine = Mockito.mock(ConsumptionSyncEngine.class);
        when(engine.syncMenuConsumption()).thenAnswer(inv -> {
            assertThat(MDC.get(MenuConsumptionSyncJob.MDC_KEY)).startsWith("sync-");
            return new SyncReport(1, 1, 0, 0);
        });

        new MenuConsumptionSyncJob(engine, new ConsumptionProperties()).run();

        verify(engine).syncMenuConsumption();
        assertThat(MDC.get(MenuConsumptionSyncJob.MDC_KEY)).isNull();
    }

    @Test
    void failure_is_logged_not_rethrown() {
        ConsumptionSyncEngine engine = Mockito.mock(ConsumptionSyncEngine.class);
        when(engine.syncMenuConsumption()).thenThrow(new ConsumptionSyncException(
                7L, SyncReport.zero(), new DataAccessResourceFailureException("db down")));

        MenuConsumptionSyncJob job = new MenuConsumptionSyncJob(engine, new ConsumptionProperties());

        assertThatCode(job::run).doesNotThrowAnyException();
        assertThat(MDC.get(MenuConsumptionSyncJob.MDC_KEY)).isNull();
    }

    @Test
    void disabled_job_does_nothing() {
        ConsumptionSyncEngine engine = Mockito.mock(ConsumptionSyncEngine.class);
        ConsumptionProperties props = new ConsumptionProperties();
        props.getJob().setEnabled(false);

        new MenuConsumptionSyncJob(engine, props).run();

        verifyNoInteractions(engine);
    }
}
