package com.calldash.calldash.data;

import java.util.List;

/**
 * Column drift of an uploaded file against the existing merged schema.
 */
public record SchemaDiff(List<String> newColumns, List<String> missingColumns, boolean hasChanges) {

    public SchemaDiff {
        newColumns = newColumns == null ? List.of() : List.copyOf(newColumns);
        missingColumns = missingColumns == null ? List.of() : List.copyOf(missingColumns);
    }

    public static SchemaDiff none() {
        return new SchemaDiff(List.of(), List.of(), false);
    }
}
