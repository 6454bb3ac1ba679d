package com.calldash.calldash.data;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TabularParserTest {

    private final TabularParser parser = new TabularParser();

    @Test
    void shouldParseCommaSeparatedFileWithQuotedDelimitersAndNewlines() {
        ParsedTable table = parser.parse(bytes(
                "CallerID,CallerName,Notes\n"
                        + "5551234567,\"Smith, John\",\"first line\nsecond line\"\n"
                        + "5559876543,Jane,plain\n"
        ), "calls.csv");

        assertEquals(List.of("CallerID", "CallerName", "Notes"), table.columns());
        assertEquals(',', table.delimiter());
        assertEquals(2, table.rows().size());
        assertEquals("Smith, John", table.rows().get(0).get("CallerName"));
        assertEquals("first line\nsecond line", table.rows().get(0).get("Notes"));
        assertEquals("plain", table.rows().get(1).get("Notes"));
    }

    @Test
    void shouldDetectTabDelimiterFromFirstLine() {
        ParsedTable table = parser.parse(bytes("CallerID\tCallerState\n5551234567\tCA\n"), "calls.tsv");

        assertEquals('\t', table.delimiter());
        assertEquals(List.of("CallerID", "CallerState"), table.columns());
        assertEquals("CA", table.rows().get(0).get("CallerState"));
    }

    @Test
    void shouldUseCommaWhenOnlyLaterLinesContainTabs() {
        ParsedTable table = parser.parse(bytes("CallerID,Notes\n555,\"a\tb\"\n"), "calls.txt");

        assertEquals(',', table.delimiter());
        assertEquals("a\tb", table.rows().get(0).get("Notes"));
    }

    @Test
    void shouldSkipEmptyLinesAndFillShortRowsWithNull() {
        ParsedTable table = parser.parse(bytes("A,B,C\n1,2,3\n\n4,5\n,,\n"), "short.csv");

        assertEquals(2, table.rows().size());
        assertEquals("5", table.rows().get(1).get("B"));
        assertNull(table.rows().get(1).get("C"));
        assertTrue(table.rows().get(1).containsKey("C"));
    }

    @Test
    void shouldStripByteOrderMark() {
        ParsedTable table = parser.parse(bytes("\uFEFFCallerID,CallerState\n1,CA\n"), "bom.csv");

        assertEquals("CallerID", table.columns().get(0));
    }

    @Test
    void shouldRejectContentThatIsNotUtf8() {
        byte[] content = {(byte) 0x43, (byte) 0x2C, (byte) 0xC3, (byte) 0x28, (byte) 0x0A};

        TabularParseException ex = assertThrows(TabularParseException.class, () -> parser.parse(content, "latin.csv"));
        assertTrue(ex.getMessage().contains("latin.csv"));
    }

    @Test
    void shouldRejectEmptyContent() {
        assertThrows(TabularParseException.class, () -> parser.parse(bytes("   \n"), "empty.csv"));
    }

    private byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
