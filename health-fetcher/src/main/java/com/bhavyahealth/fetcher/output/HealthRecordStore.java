package com.bhavyahealth.fetcher.output;

import com.bhavyahealth.fetcher.model.DateKey;
import com.bhavyahealth.fetcher.model.HealthRecord;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * Persistence of merged records, one row per date.
 *
 * Query methods throw {@link com.bhavyahealth.fetcher.exception.StorageException};
 * {@link #upsert} throws {@link com.bhavyahealth.fetcher.exception.StoragePersistException}.
 */
public interface HealthRecordStore {

    /** Subset of {@code dates} that already has a row. */
    Set<DateKey> exists(Set<DateKey> dates);

    /** Insert or overwrite the row for the record's date. */
    void upsert(HealthRecord record);

    long count();

    SortedSet<DateKey> listKnownDates();

    /** Latest dates first. */
    List<DateKey> recentDates(int limit);

    Optional<String> lastFetchedAt();

    Optional<HealthRecord> find(DateKey date);
}
