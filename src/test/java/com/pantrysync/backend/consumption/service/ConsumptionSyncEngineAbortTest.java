package com.pantrysync.backend.consumption.service;

import com.pantrysync.backend.consumption.config.ConsumptionProperties;
import com.pantrysync.backend.consumption.dto.SyncReport;
import com.pantrysync.backend.consumption.web.ConsumptionSyncException;
import com.pantrysync.backend.menu.entity.MealPlanEntry;
import com.pantrysync.backend.menu.repo.MealPlanEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConsumptionSyncEngineAbortTest {

    private MealPlanEntryRepository menuRepo;
    private MealPlanEntryApplier applier;
    private ConsumptionProperties props;
    private ConsumptionSyncEngine engine;

    // 2026-03-09 23:30 UTC = 2026-03-10 07:30 Asia/Taipei
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-09T23:30:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        menuRepo = Mockito.mock(MealPlanEntryRepository.class);
        applier = Mockito.mock(MealPlanEntryApplier.class);
        props = new ConsumptionProperties();
        engine = new ConsumptionSyncEngine(menuRepo, applier, props, clock);
    }

    private static MealPlanEntry entry(long id) {
        MealPlanEntry e = new MealPlanEntry();
        e.setId(id);
        e.setRecipeId(1L);
        e.setPlanDate(LocalDate.of(2026, 3, 1));
        return e;
    }

    @Test
    void store_failure_aborts_with_partial_report() {
        when(menuRepo.findPendingUpTo(any())).thenReturn(List.of(entry(1), entry(2), entry(3)));
        when(applier.apply(1L)).thenReturn(new SyncReport(1, 2, 1, 1));
        when(applier.apply(2L)).thenThrow(new DataAccessResourceFailureException("db down"));

        ConsumptionSyncException ex = catchThrowableOfType(
                () -> engine.syncMenuConsumption(LocalDate.of(2026, 3, 10)),
                ConsumptionSyncException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.entryId()).isEqualTo(2L);
        assertThat(ex.partial()).isEqualTo(new SyncReport(1, 2, 1, 1));
        assertThat(ex.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
        verify(applier, never()).apply(3L);
    }

    @Test
    void entries_already_applied_elsewhere_add_nothing() {
        when(menuRepo.findPendingUpTo(any())).thenReturn(List.of(entry(1), entry(2)));
        when(applier.apply(1L)).thenReturn(SyncReport.zero());
        when(applier.apply(2L)).thenReturn(new SyncReport(1, 1, 0, 0));

        assertThat(engine.syncMenuConsumption(LocalDate.of(2026, 3, 10)))
                .isEqualTo(new SyncReport(1, 1, 0, 0));
    }

    @Test
    void no_pending_entries_never_touches_applier() {
        when(menuRepo.findPendingUpTo(any())).thenReturn(List.of());

        assertThat(engine.syncMenuConsumption(LocalDate.of(2026, 3, 10))).isEqualTo(SyncReport.zero());
        verifyNoInteractions(applier);
    }

    @Test
    void default_as_of_uses_configured_zone() {
        when(menuRepo.findPendingUpTo(any())).thenReturn(List.of());

        engine.syncMenuConsumption();
        verify(menuRepo).findPendingUpTo(LocalDate.of(2026, 3, 9));

        props.setZone("Asia/Taipei");
        engine.syncMenuConsumption();
        verify(menuRepo).findPendingUpTo(LocalDate.of(2026, 3, 10));
    }
}
