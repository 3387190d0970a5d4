package com.bhavyahealth.fetcher.output;

import com.bhavyahealth.fetcher.config.HealthFetcherProperties;
import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.HealthRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * The store the fetch path talks to. The table is the system of record; when the CSV
 * mirror is enabled every successful upsert is also written out as a file.
 */
@Primary
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter implements HealthRecordStore {

    private final JdbcHealthRecordStore jdbcStore;
    private final CsvWriter csvWriter;
    private final HealthFetcherProperties properties;

    @Override
    public void upsert(HealthRecord record) {
        jdbcStore.upsert(record);

        if (properties.getOutput().getCsv().isEnabled()) {
            try {
                csvWriter.write(record);
            } catch (Exception e) {
                log.warn("CSV mirror failed for {}: {}", record.getDate(), e.getMessage());
            }
        }
    }

    @Override
    public Set<DateKey> exists(Set<DateKey> dates) {
        return jdbcStore.exists(dates);
    }

    @Override
    public long count() {
        return jdbcStore.count();
    }

    @Override
    public SortedSet<DateKey> listKnownDates() {
        return jdbcStore.listKnownDates();
    }

    @Override
    public List<DateKey> recentDates(int limit) {
        return jdbcStore.recentDates(limit);
    }

    @Override
    public Optional<String> lastFetchedAt() {
        return jdbcStore.lastFetchedAt();
    }

    @Override
    public Optional<HealthRecord> find(DateKey date) {
        return jdbcStore.find(date);
    }
}
