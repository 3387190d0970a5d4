package com.bhavyahealth.fetcher.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Calendar date used as the natural key of one stored row.
 * Always rendered as YYYY-MM-DD, which is also the stored form of data_date.
 */
public record DateKey(LocalDate date) implements Comparable<DateKey> {

    public DateKey {
        Objects.requireNonNull(date, "date");
    }

    public static DateKey of(LocalDate date) {
        return new DateKey(date);
    }

    public static DateKey parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Invalid date format. Use YYYY-MM-DD");
        }
        try {
            return new DateKey(LocalDate.parse(text.trim(), DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date format. Use YYYY-MM-DD", e);
        }
    }

    /** Every date from start to end, both inclusive. Empty when start is after end. */
    public static List<DateKey> range(DateKey start, DateKey end) {
        List<DateKey> dates = new ArrayList<>();
        for (LocalDate d = start.date(); !d.isAfter(end.date()); d = d.plusDays(1)) {
            dates.add(new DateKey(d));
        }
        return dates;
    }

    public boolean isAfter(DateKey other) {
        return date.isAfter(other.date);
    }

    @Override
    public int compareTo(DateKey other) {
        return date.compareTo(other.date);
    }

    @Override
    public String toString() {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
