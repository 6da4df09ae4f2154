package com.example.calcmcp.history;

import java.util.List;

/**
 * Append-only log of formatted operation records.
 */
public interface History {

    /** Appends {@code record} after every entry already present. */
    void addEntry(String record);

    /**
     * Returns the last {@code min(count, size())} records, oldest first.
     * A count of zero or less yields an empty list.
     */
    List<String> getLastOperations(int count);

    int size();
}
