package com.bhavyahealth.fetcher.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One orchestration run: the requested dates in order, the subset still to fetch,
 * and a cancellation flag flipped by whoever is watching the progress stream.
 */
@Getter
public class FetchJob {

    private final String id;
    private final List<DateKey> requested;
    private final Set<DateKey> pending;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public FetchJob(List<DateKey> requested, List<DateKey> pending) {
        this.id = UUID.randomUUID().toString().substring(0, 8);
        this.requested = List.copyOf(new LinkedHashSet<>(requested));
        this.pending = Set.copyOf(pending);
        if (!this.requested.containsAll(this.pending)) {
            throw new IllegalArgumentException("Pending dates must be a subset of the requested dates");
        }
    }

    public boolean isPending(DateKey date) {
        return pending.contains(date);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
