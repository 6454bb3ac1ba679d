package com.calldash.calldash.data;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Registry entry for one uploaded call-log file. {@code columns} is the header detected at upload.
 */
public record DataFile(
        Long id,
        @JsonIgnore String storedPath,
        String originalName,
        long sizeBytes,
        int rowCount,
        List<String> columns,
        String dateRangeStart,
        String dateRangeEnd,
        Long uploadedBy,
        String uploadedByName,
        long createdAt,
        boolean active
) {

    public DataFile {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }
}
