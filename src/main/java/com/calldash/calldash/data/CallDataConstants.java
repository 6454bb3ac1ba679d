package com.calldash.calldash.data;

import java.util.List;

/**
 * Shared constants for call data ingestion.
 */
public final class CallDataConstants {

    private CallDataConstants() {
    }

    public static final String DEFAULT_DATA_DIRECTORY = "data/uploads";
    public static final long DEFAULT_MAX_UPLOAD_BYTES = 100L * 1024 * 1024;
    public static final List<String> DEFAULT_ALLOWED_EXTENSIONS = List.of("csv", "tsv", "txt");
    public static final String DEFAULT_DATE_COLUMN = "CallStart";
    public static final int DEFAULT_QUERY_MAX_RESULTS = 100;

    public static final String COLUMN_SOURCE_FILE = "_sourceFile";
    public static final String COLUMN_SOURCE_FILE_ID = "_sourceFileId";
    public static final List<String> PROVENANCE_COLUMNS = List.of(COLUMN_SOURCE_FILE, COLUMN_SOURCE_FILE_ID);

    public static final String CSV_DEFAULT_COLUMN_PREFIX = "column_";
    public static final char DELIMITER_COMMA = ',';
    public static final char DELIMITER_TAB = '\t';

    public static final String MSG_FILE_NOT_DECODABLE = "File is not valid UTF-8 text: %s";
    public static final String MSG_FILE_NO_HEADER = "File has no header row: %s";
    public static final String MSG_FILE_PARSE_FAILED = "Unable to parse delimited file: %s";
    public static final String MSG_UPLOAD_EMPTY = "Uploaded file is empty";
    public static final String MSG_UPLOAD_NAME_MISSING = "Uploaded file must have a name";
    public static final String MSG_UPLOAD_EXTENSION = "Only %s files are accepted";
    public static final String MSG_UPLOAD_TOO_LARGE = "Uploaded file exceeds the %d byte limit";
    public static final String MSG_FILE_NOT_FOUND = "Data file %d not found";
    public static final String MSG_STORED_FILE_MISSING = "Stored content for data file %d no longer exists";
    public static final String MSG_STORE_WRITE_FAILED = "Failed to store uploaded file: %s";
    public static final String MSG_STORE_READ_FAILED = "Failed to read stored file: %s";
    public static final String MSG_STORE_DELETE_FAILED = "Failed to delete stored file: %s";
    public static final String MSG_INGESTION_FAILED = "Unable to load call data from the file registry";
}
