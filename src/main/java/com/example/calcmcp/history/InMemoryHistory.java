package com.example.calcmcp.history;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * {@link History} kept on the heap. Unbounded unless constructed with a
 * positive capacity, in which case the oldest record is evicted once the
 * capacity is reached.
 */
public class InMemoryHistory implements History {

    public static final int UNBOUNDED = 0;

    private final Deque<String> entries = new ArrayDeque<>();
    private final int capacity;

    public InMemoryHistory() {
        this(UNBOUNDED);
    }

    public InMemoryHistory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("History capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void addEntry(String record) {
        Objects.requireNonNull(record, "record");
        if (capacity != UNBOUNDED && entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(record);
    }

    @Override
    public synchronized List<String> getLastOperations(int count) {
        int n = Math.min(Math.max(count, 0), entries.size());
        if (n == 0) return List.of();
        String[] tail = new String[n];
        Iterator<String> newestFirst = entries.descendingIterator();
        for (int i = n - 1; i >= 0; i--) {
            tail[i] = newestFirst.next();
        }
        return List.of(tail);
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
