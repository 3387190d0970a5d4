package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.exception.InvalidRangeException;
import com.bhavyahealth.fetcher.exception.StorageException;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.DebugReport;
import com.bhavyahealth.fetcher.model.EndpointSpec;
import com.bhavyahealth.fetcher.model.FetchJob;
import com.bhavyahealth.fetcher.model.FetchStatus;
import com.bhavyahealth.fetcher.model.TableSetup;
import com.bhavyahealth.fetcher.output.HealthRecordStore;
import com.bhavyahealth.fetcher.output.JdbcHealthRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry points for fetch runs, status queries and table setup.
 *
 * The run methods only decide which dates to fetch and hand back a lazy progress stream;
 * nothing is fetched until the caller starts reading it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthFetchService {

    private static final int RECENT_DATES = 10;

    private final FetchOrchestrator orchestrator;
    private final DuplicateFilter duplicateFilter;
    private final HealthRecordStore store;
    private final JdbcHealthRecordStore jdbcStore;
    private final EndpointCatalog catalog;
    private final HealthFetcherProperties properties;
    private final Clock clock;

    /** Fetch today's date in the configured zone, unless it is already stored. */
    public ProgressStream runToday() {
        DateKey today = DateKey.of(LocalDate.now(clock));
        log.info("Fetch requested for today ({})", today);
        return runDates(List.of(today));
    }

    /**
     * Fetch every date from {@code start} to {@code end} inclusive that is not already stored.
     *
     * @throws InvalidRangeException if start is after end or the range is longer than allowed
     */
    public ProgressStream runRange(DateKey start, DateKey end) {
        if (start.isAfter(end)) {
            throw new InvalidRangeException("From date cannot be after To date");
        }
        long days = ChronoUnit.DAYS.between(start.date(), end.date()) + 1;
        int maxDays = properties.getFetch().getMaxRangeDays();
        if (maxDays > 0 && days > maxDays) {
            throw new InvalidRangeException("Date range of " + days + " days exceeds the limit of " + maxDays);
        }
        log.info("Fetch requested for {} to {} ({} days)", start, end, days);
        return runDates(DateKey.range(start, end));
    }

    ProgressStream runDates(List<DateKey> dates) {
        List<DateKey> pending;
        try {
            pending = duplicateFilter.pending(dates, store::exists);
        } catch (StorageException e) {
            log.error("Cannot check stored dates, nothing will be fetched: {}", e.getMessage(), e);
            return ProgressStream.failed(new FetchJob(dates, List.of()), "Database unavailable: " + e.getMessage());
        }
        FetchJob job = new FetchJob(dates, pending);
        log.info("Job {}: {} of {} dates need fetching", job.getId(), pending.size(), job.getRequested().size());
        return orchestrator.run(job);
    }

    public List<EndpointSpec> listEndpoints() {
        return catalog.all();
    }

    /**
     * Store summary. A missing table is created first; a store that cannot be reached is
     * reported as disconnected instead of failing the call.
     */
    public FetchStatus status() {
        FetchStatus.FetchStatusBuilder status = FetchStatus.builder()
                .status("ok")
                .tableName(properties.getStorage().getTableName())
                .recentDates(List.of())
                .endpointCount(catalog.size());

        boolean tableExists;
        try {
            tableExists = jdbcStore.tableExists();
        } catch (StorageException e) {
            log.error("Status check could not reach the database: {}", e.getMessage());
            return status.status("error").database("disconnected").error(e.getMessage()).build();
        }
        status.database("connected");

        if (!tableExists) {
            log.warn("Table {} not found, creating it", jdbcStore.tableName());
            try {
                jdbcStore.ensureSchema();
                tableExists = true;
            } catch (StorageException e) {
                log.error("Could not create table {}: {}", jdbcStore.tableName(), e.getMessage());
                return status.status("error").error(e.getMessage()).build();
            }
        }
        status.tableExists(tableExists);

        try {
            return status
                    .recordCount(store.count())
                    .lastFetchedAt(store.lastFetchedAt().orElse(null))
                    .recentDates(store.recentDates(RECENT_DATES).stream().map(DateKey::toString).toList())
                    .build();
        } catch (StorageException e) {
            log.error("Status query failed: {}", e.getMessage());
            return status.status("error").error(e.getMessage()).build();
        }
    }

    /** Creates the table if it is missing and reports whether this call created it. */
    public TableSetup setupTable() {
        try {
            boolean created = jdbcStore.ensureSchema();
            return TableSetup.builder()
                    .success(true)
                    .message(created ? "Table created successfully" : "Table already exists")
                    .tableCreated(created)
                    .recordCount(created ? 0L : store.count())
                    .build();
        } catch (StorageException e) {
            log.error("Table setup failed: {}", e.getMessage(), e);
            return TableSetup.builder()
                    .success(false)
                    .message("Failed to create table: " + e.getMessage())
                    .build();
        }
    }

    public DebugReport debug() {
        Map<String, String> config = new LinkedHashMap<>();
        config.put("table_name", jdbcStore.tableName());
        List<String> errors = new ArrayList<>();
        DebugReport.DebugReportBuilder report = DebugReport.builder();

        try {
            config.putAll(jdbcStore.describeConnection());
            report.connection(true);
        } catch (StorageException e) {
            errors.add("Connection error: " + e.getMessage());
            return report.config(config).connection(false).errors(errors).build();
        }
        try {
            report.tableCheck(jdbcStore.tableExists() ? "exists" : "not found");
        } catch (StorageException e) {
            errors.add("Table check error: " + e.getMessage());
        }
        try {
            report.recordCount(jdbcStore.count());
        } catch (StorageException e) {
            errors.add("Record count error: " + e.getMessage());
        }
        return report.config(config).errors(errors).build();
    }
}
