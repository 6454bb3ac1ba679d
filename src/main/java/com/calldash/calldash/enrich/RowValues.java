package com.calldash.calldash.enrich;

import java.util.Map;

final class RowValues {

    private RowValues() {
    }

    /**
     * Trimmed text of a cell, or null when the cell is absent or blank.
     */
    static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static boolean isResolved(String value) {
        return value != null && !EnrichmentConstants.NOT_FOUND.equalsIgnoreCase(value);
    }

    static boolean isCalifornia(Map<String, Object> row) {
        return EnrichmentConstants.STATE_CALIFORNIA.equalsIgnoreCase(text(row, EnrichmentConstants.COLUMN_CALLER_STATE));
    }
}
