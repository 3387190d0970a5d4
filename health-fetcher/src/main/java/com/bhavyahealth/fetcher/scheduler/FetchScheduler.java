package com.bhavyahealth.fetcher.scheduler;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.model.BatchSummary;
import com.bhavyahealth.fetcher.model.ProgressEvent;
import com.bhavyahealth.fetcher.output.JdbcHealthRecordStore;
import com.bhavyahealth.fetcher.service.HealthFetchService;
import com.bhavyahealth.fetcher.service.ProgressStream;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Schema setup on startup and the optional nightly fetch of today's data.
 *
 * Default schedule: 23:30 Asia/Kolkata, disabled unless bhavya-fetcher.scheduling.enabled=true.
 * Override the time with FETCH_CRON or bhavya-fetcher.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FetchScheduler {

    private final HealthFetchService fetchService;
    private final JdbcHealthRecordStore jdbcStore;
    private final HealthFetcherProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getStorage().isEnsureSchemaOnStartup()) {
            try {
                jdbcStore.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise table {}: {} (retry with POST /api/setup-table)", jdbcStore.tableName(), e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, fetching today");
            fetchToday();
        } else if (properties.getScheduling().isEnabled()) {
            log.info("Fetcher ready. Scheduled run: {}", properties.getScheduling().getCron());
        } else {
            log.info("Fetcher ready. Scheduled runs disabled");
        }
    }

    @Scheduled(cron = "${bhavya-fetcher.scheduling.cron:0 30 23 * * *}", zone = "${bhavya-fetcher.fetch.zone:Asia/Kolkata}")
    public void scheduledFetch() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled fetch triggered");
        fetchToday();
    }

    void fetchToday() {
        try (ProgressStream progress = fetchService.runToday()) {
            BatchSummary batch = null;
            while (progress.hasNext()) {
                ProgressEvent event = progress.next();
                if (event.getType() == ProgressEvent.Type.BATCH_DONE) {
                    batch = event.getBatch();
                }
            }
            if (batch != null && batch.getError() != null) {
                log.error("Fetch of today failed: {}", batch.getError());
            } else if (batch != null) {
                log.info("Fetch of today done: {} processed, {} skipped, {} errored, {} endpoint failures",
                        batch.getProcessed(), batch.getSkipped(), batch.getErrored(), batch.getEndpointFailures());
            }
        } catch (Exception e) {
            log.error("Fetch of today failed: {}", e.getMessage(), e);
        }
    }
}
