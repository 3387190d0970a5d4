package com.bhavyahealth.fetcher.service;

import com.bhavyahealth.fetcher.model.DateKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Works out which requested dates still need fetching, with a single existence lookup.
 */
@Component
public class DuplicateFilter {

    @FunctionalInterface
    public interface StoredDateLookup {
        /** Returns the subset of {@code candidates} already stored. */
        Set<DateKey> existing(Set<DateKey> candidates);
    }

    public List<DateKey> pending(List<DateKey> requested, StoredDateLookup lookup) {
        if (requested.isEmpty()) {
            return List.of();
        }
        Set<DateKey> distinct = new LinkedHashSet<>(requested);
        Set<DateKey> stored = lookup.existing(distinct);

        List<DateKey> pending = new ArrayList<>(distinct.size());
        for (DateKey d : distinct) {
            if (!stored.contains(d)) pending.add(d);
        }
        return pending;
    }
}
