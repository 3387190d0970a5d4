package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.exception.InvalidRangeException;
import com.bhavyahealth.fetcher.exception.StorageException;
import com.bhavyahealth.fetcher.model.BatchSummary;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.DebugReport;
import com.bhavyahealth.fetcher.model.FetchJob;
import com.bhavyahealth.fetcher.model.FetchStatus;
import com.bhavyahealth.fetcher.model.ProgressEvent;
import com.bhavyahealth.fetcher.model.TableSetup;
import com.bhavyahealth.fetcher.output.HealthRecordStore;
import com.bhavyahealth.fetcher.output.JdbcHealthRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthFetchServiceTest {

    @Mock
    private FetchOrchestrator orchestrator;

    @Mock
    private HealthRecordStore store;

    @Mock
    private JdbcHealthRecordStore jdbcStore;

    private final HealthFetcherProperties properties = new HealthFetcherProperties();
    private HealthFetchService service;

    @BeforeEach
    void setUp() {
        // 20:00 UTC is already the next day in India
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T20:00:00Z"), ZoneId.of("Asia/Kolkata"));
        service = new HealthFetchService(orchestrator, new DuplicateFilter(), store, jdbcStore,
                EndpointCatalog.bhavya(), properties, clock);

        lenient().when(orchestrator.run(any()))
                .thenAnswer(inv -> new ProgressStream(inv.getArgument(0), 1, s -> { }));
    }

    @Test
    void runRange_StartAfterEnd_ThrowsWithoutTouchingStore() {
        InvalidRangeException e = assertThrows(InvalidRangeException.class,
                () -> service.runRange(DateKey.parse("2024-01-05"), DateKey.parse("2024-01-01")));

        assertEquals("From date cannot be after To date", e.getMessage());
        verifyNoInteractions(orchestrator, store);
    }

    @Test
    void runRange_LongerThanLimit_Throws() {
        properties.getFetch().setMaxRangeDays(31);

        assertThrows(InvalidRangeException.class,
                () -> service.runRange(DateKey.parse("2024-01-01"), DateKey.parse("2024-02-01")));
        verifyNoInteractions(orchestrator, store);
    }

    @Test
    void runRange_HandsOnlyUnstoredDatesToOrchestrator() {
        DateKey d1 = DateKey.parse("2024-01-01");
        DateKey d2 = DateKey.parse("2024-01-02");
        DateKey d3 = DateKey.parse("2024-01-03");
        when(store.exists(anySet())).thenReturn(Set.of(d2));

        ProgressStream stream = service.runRange(d1, d3);

        ArgumentCaptor<FetchJob> job = ArgumentCaptor.forClass(FetchJob.class);
        verify(orchestrator).run(job.capture());
        assertSame(job.getValue(), stream.job());
        assertEquals(List.of(d1, d2, d3), job.getValue().getRequested());
        assertEquals(Set.of(d1, d3), job.getValue().getPending());
        verify(store, times(1)).exists(anySet());
    }

    @Test
    void runRange_SingleDay_IsAllowed() {
        DateKey day = DateKey.parse("2024-01-01");
        when(store.exists(anySet())).thenReturn(Set.of());

        ProgressStream stream = service.runRange(day, day);

        assertEquals(List.of(day), stream.job().getRequested());
    }

    @Test
    void runToday_UsesDateInConfiguredZone() {
        when(store.exists(anySet())).thenReturn(Set.of());

        ProgressStream stream = service.runToday();

        assertEquals(List.of(DateKey.parse("2024-01-02")), stream.job().getRequested());
        assertTrue(stream.job().isPending(DateKey.parse("2024-01-02")));
    }

    @Test
    void runToday_AlreadyStored_JobHasNothingPending() {
        when(store.exists(anySet())).thenReturn(Set.of(DateKey.parse("2024-01-02")));

        ProgressStream stream = service.runToday();

        assertTrue(stream.job().getPending().isEmpty());
    }

    @Test
    void runToday_StoreUnreachable_StreamsOnlyBatchDoneWithError() {
        when(store.exists(anySet())).thenThrow(new StorageException("Existence lookup failed: connection refused", null));

        ProgressStream stream = service.runToday();

        List<ProgressEvent> events = new ArrayList<>();
        while (stream.hasNext()) {
            events.add(stream.next());
        }
        assertEquals(1, events.size());
        assertEquals(ProgressEvent.Type.BATCH_DONE, events.get(0).getType());
        BatchSummary batch = events.get(0).getBatch();
        assertEquals(1, batch.getRequested());
        assertEquals(0, batch.getProcessed());
        assertTrue(batch.getError().contains("connection refused"));
        verifyNoInteractions(orchestrator);
    }

    @Test
    void runRange_StoreUnreachable_DoesNotThrow() {
        when(store.exists(anySet())).thenThrow(new StorageException("Existence lookup failed: timeout", null));

        ProgressStream stream = service.runRange(DateKey.parse("2024-01-01"), DateKey.parse("2024-01-03"));

        assertTrue(stream.hasNext());
        assertEquals(3, stream.next().getBatch().getRequested());
        assertFalse(stream.hasNext());
    }

    @Test
    void status_SummarisesStore() {
        when(jdbcStore.tableExists()).thenReturn(true);
        when(store.count()).thenReturn(12L);
        when(store.lastFetchedAt()).thenReturn(Optional.of("2024-01-02 23:30:00"));
        when(store.recentDates(10)).thenReturn(List.of(DateKey.parse("2024-01-02"), DateKey.parse("2024-01-01")));

        FetchStatus status = service.status();

        assertEquals("ok", status.getStatus());
        assertEquals("connected", status.getDatabase());
        assertTrue(status.isTableExists());
        assertEquals(12L, status.getRecordCount());
        assertEquals("2024-01-02 23:30:00", status.getLastFetchedAt());
        assertEquals(List.of("2024-01-02", "2024-01-01"), status.getRecentDates());
        assertEquals("bhavya_realtime_health__report_data", status.getTableName());
        assertEquals(34, status.getEndpointCount());
        verify(jdbcStore, never()).ensureSchema();
    }

    @Test
    void status_MissingTable_IsCreated() {
        when(jdbcStore.tableExists()).thenReturn(false);
        when(jdbcStore.ensureSchema()).thenReturn(true);
        when(store.lastFetchedAt()).thenReturn(Optional.empty());
        when(store.recentDates(10)).thenReturn(List.of());

        FetchStatus status = service.status();

        verify(jdbcStore).ensureSchema();
        assertTrue(status.isTableExists());
        assertEquals("ok", status.getStatus());
        assertEquals(0, status.getRecordCount());
    }

    @Test
    void status_DatabaseUnreachable_ReportsDisconnected() {
        when(jdbcStore.tableExists()).thenThrow(new StorageException("Table check failed: connection refused", null));

        FetchStatus status = service.status();

        assertEquals("error", status.getStatus());
        assertEquals("disconnected", status.getDatabase());
        assertFalse(status.isTableExists());
        assertEquals(0, status.getRecordCount());
        assertEquals(List.of(), status.getRecentDates());
        assertTrue(status.getError().contains("connection refused"));
        verifyNoInteractions(store);
    }

    @Test
    void status_TableCannotBeCreated_ReportsError() {
        when(jdbcStore.tableExists()).thenReturn(false);
        when(jdbcStore.ensureSchema()).thenThrow(new StorageException("Creating table failed: access denied", null));

        FetchStatus status = service.status();

        assertEquals("error", status.getStatus());
        assertEquals("connected", status.getDatabase());
        assertFalse(status.isTableExists());
        verifyNoInteractions(store);
    }

    @Test
    void setupTable_ExistingTable_ReportsCount() {
        when(jdbcStore.ensureSchema()).thenReturn(false);
        when(store.count()).thenReturn(7L);

        TableSetup setup = service.setupTable();

        assertTrue(setup.isSuccess());
        assertEquals("Table already exists", setup.getMessage());
        assertFalse(setup.getTableCreated());
        assertEquals(7L, setup.getRecordCount());
    }

    @Test
    void setupTable_MissingTable_IsCreated() {
        when(jdbcStore.ensureSchema()).thenReturn(true);

        TableSetup setup = service.setupTable();

        assertTrue(setup.isSuccess());
        assertTrue(setup.getTableCreated());
        assertEquals(0L, setup.getRecordCount());
        verifyNoInteractions(store);
    }

    @Test
    void setupTable_DatabaseFailure_IsReportedNotThrown() {
        when(jdbcStore.ensureSchema()).thenThrow(new StorageException("Table check failed: connection refused", null));

        TableSetup setup = service.setupTable();

        assertFalse(setup.isSuccess());
        assertTrue(setup.getMessage().contains("connection refused"));
        assertNull(setup.getTableCreated());
    }

    @Test
    void debug_CountFails_RunsOtherChecksAndCollectsError() {
        when(jdbcStore.tableName()).thenReturn("bhavya_realtime_health__report_data");
        when(jdbcStore.describeConnection()).thenReturn(Map.of("url", "jdbc:mysql://db/bhavya", "user", "fetcher"));
        when(jdbcStore.tableExists()).thenReturn(true);
        when(jdbcStore.count()).thenThrow(new StorageException("Record count failed: lock wait timeout", null));

        DebugReport report = service.debug();

        assertTrue(report.isConnection());
        assertEquals("exists", report.getTableCheck());
        assertNull(report.getRecordCount());
        assertEquals("bhavya_realtime_health__report_data", report.getConfig().get("table_name"));
        assertEquals("jdbc:mysql://db/bhavya", report.getConfig().get("url"));
        assertEquals(List.of("Record count error: Record count failed: lock wait timeout"), report.getErrors());
    }

    @Test
    void debug_NoConnection_SkipsRemainingChecks() {
        when(jdbcStore.describeConnection()).thenThrow(new StorageException("Connection failed: refused", null));

        DebugReport report = service.debug();

        assertFalse(report.isConnection());
        assertNull(report.getTableCheck());
        assertEquals(1, report.getErrors().size());
        verify(jdbcStore, never()).count();
    }

    @Test
    void listEndpoints_IsCatalogOrder() {
        assertEquals(34, service.listEndpoints().size());
        assertEquals("staff_data", service.listEndpoints().get(0).id());
    }
}
