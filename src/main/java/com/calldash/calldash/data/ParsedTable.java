package com.calldash.calldash.data;

import java.util.List;
import java.util.Map;

/**
 * Header columns and raw string rows of one parsed file.
 */
public record ParsedTable(List<String> columns, List<Map<String, String>> rows, char delimiter) {

    public ParsedTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }
}
