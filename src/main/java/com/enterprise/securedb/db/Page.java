package com.enterprise.securedb.db;

import java.util.List;
import java.util.Map;

/**
 * One page of rows plus the row count of the unpaginated query.
 */
public record Page(long totalRows, List<Map<String, Object>> rows) {

    public Page {
        rows = List.copyOf(rows);
    }
}
