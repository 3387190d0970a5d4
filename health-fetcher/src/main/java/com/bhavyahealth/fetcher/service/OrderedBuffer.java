package com.bhavyahealth.fetcher.service;

import java.util.Map;
import java.util.TreeMap;

/**
 * Buffers out-of-order items and hands them back in increasing index order.
 * Not thread-safe; owned by a single consumer.
 */
class OrderedBuffer<T> {

    private int nextIndex;
    private final TreeMap<Integer, T> buffer = new TreeMap<>();

    OrderedBuffer(int startingIndex) {
        this.nextIndex = startingIndex;
    }

    void add(int index, T item) {
        if (index < nextIndex || buffer.containsKey(index)) {
            throw new IllegalStateException("Index " + index + " already added");
        }
        buffer.put(index, item);
    }

    /**
     * Pop the item at the next index, or null if it has not arrived yet.
     */
    T pollNext() {
        Map.Entry<Integer, T> first = buffer.firstEntry();
        if (first == null || first.getKey() != nextIndex) return null;
        buffer.pollFirstEntry();
        nextIndex++;
        return first.getValue();
    }

    int buffered() {
        return buffer.size();
    }
}
