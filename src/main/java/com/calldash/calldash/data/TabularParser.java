package com.calldash.calldash.data;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses one comma- or tab-delimited call-log file into header columns and string rows.
 */
@Component
public class TabularParser {

    private static final char BYTE_ORDER_MARK = '﻿';

    /**
     * Parses {@code content}; {@code sourceName} only labels error messages.
     */
    public ParsedTable parse(byte[] content, String sourceName) {
        String text = decode(content, sourceName);
        char delimiter = detectDelimiter(text);

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .build();

        try (CSVParser parser = csvFormat.parse(new StringReader(text))) {
            List<String> headerNames = parser.getHeaderNames();
            if (headerNames.isEmpty()) {
                throw new TabularParseException(CallDataConstants.MSG_FILE_NO_HEADER.formatted(sourceName));
            }
            List<String> columns = normalizeHeaders(headerNames);

            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (isBlank(record)) {
                    continue;
                }
                Map<String, String> row = new LinkedHashMap<>(columns.size() * 2);
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), record.isSet(i) ? record.get(i) : null);
                }
                rows.add(row);
            }
            return new ParsedTable(columns, rows, delimiter);
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException ex) {
            throw new TabularParseException(CallDataConstants.MSG_FILE_PARSE_FAILED.formatted(sourceName), ex);
        }
    }

    /**
     * Tab when the first line contains a tab, comma otherwise.
     */
    char detectDelimiter(String text) {
        int end = text.indexOf('\n');
        String firstLine = end < 0 ? text : text.substring(0, end);
        return firstLine.indexOf(CallDataConstants.DELIMITER_TAB) >= 0
                ? CallDataConstants.DELIMITER_TAB
                : CallDataConstants.DELIMITER_COMMA;
    }

    private String decode(byte[] content, String sourceName) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(content == null ? new byte[0] : content)).toString();
            if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
                text = text.substring(1);
            }
            if (text.isBlank()) {
                throw new TabularParseException(CallDataConstants.MSG_FILE_NO_HEADER.formatted(sourceName));
            }
            return text;
        } catch (CharacterCodingException ex) {
            throw new TabularParseException(CallDataConstants.MSG_FILE_NOT_DECODABLE.formatted(sourceName), ex);
        }
    }

    /**
     * Keeps header names as written, naming blank headers by position and suffixing duplicates.
     */
    private List<String> normalizeHeaders(List<String> headers) {
        List<String> normalized = new ArrayList<>(headers.size());
        Map<String, Integer> seen = new HashMap<>();

        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i) == null ? "" : headers.get(i).trim();
            if (header.isEmpty()) {
                header = CallDataConstants.CSV_DEFAULT_COLUMN_PREFIX + (i + 1);
            }
            int count = seen.getOrDefault(header, 0);
            seen.put(header, count + 1);
            normalized.add(count == 0 ? header : header + "_" + (count + 1));
        }
        return normalized;
    }

    private boolean isBlank(CSVRecord record) {
        for (String value : record) {
            if (value != null && !value.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
