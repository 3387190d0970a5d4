package com.bhavyahealth.fetcher.scheduler;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.FetchJob;
import com.bhavyahealth.fetcher.output.JdbcHealthRecordStore;
import com.bhavyahealth.fetcher.service.HealthFetchService;
import com.bhavyahealth.fetcher.service.ProgressStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FetchSchedulerTest {

    @Mock
    private HealthFetchService fetchService;

    @Mock
    private JdbcHealthRecordStore jdbcStore;

    private final HealthFetcherProperties properties = new HealthFetcherProperties();
    private FetchScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new FetchScheduler(fetchService, jdbcStore, properties);
    }

    @Test
    void onStartup_EnsuresSchemaOnly() {
        scheduler.onStartup();

        verify(jdbcStore).ensureSchema();
        verifyNoInteractions(fetchService);
    }

    @Test
    void onStartup_SchemaFailure_IsNotFatal() {
        doThrow(new IllegalStateException("no database")).when(jdbcStore).ensureSchema();

        assertDoesNotThrow(() -> scheduler.onStartup());
    }

    @Test
    void scheduledFetch_Disabled_DoesNothing() {
        scheduler.scheduledFetch();

        verifyNoInteractions(fetchService);
    }

    @Test
    void scheduledFetch_Enabled_ReadsTodayToTheEnd() {
        properties.getScheduling().setEnabled(true);
        DateKey today = DateKey.parse("2024-01-01");
        FetchJob job = new FetchJob(List.of(today), List.of());
        ProgressStream stream = new ProgressStream(job, 4, s -> { });
        // the stream never produces; a closed stream simply ends
        stream.close();
        when(fetchService.runToday()).thenReturn(stream);

        scheduler.scheduledFetch();

        verify(fetchService).runToday();
        assertTrue(job.isCancelled());
    }
}
