package com.calldash.calldash.data;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Parses the date part of call timestamps such as {@code 03-14-24 09:15:02}.
 */
public final class CallDates {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ofPattern("MM-dd-yy"),
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yy"),
            DateTimeFormatter.ISO_LOCAL_DATE
    );

    private CallDates() {
    }

    /**
     * Returns the date of the first whitespace-separated token, or null when no known format matches.
     */
    public static LocalDate parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String datePart = value.trim().split("[\\sT]+", 2)[0];
        for (DateTimeFormatter format : FORMATS) {
            try {
                return LocalDate.parse(datePart, format);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return null;
    }
}
