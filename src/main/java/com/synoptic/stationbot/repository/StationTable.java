package com.synoptic.stationbot.repository;

import java.util.List;

/**
 * In-memory extract of a single station: column names in dataset order and the rows
 * in time order. Temporal values are already rendered as ISO-8601 text.
 */
public record StationTable(List<String> columns, List<List<Object>> rows) {

    public StationTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
