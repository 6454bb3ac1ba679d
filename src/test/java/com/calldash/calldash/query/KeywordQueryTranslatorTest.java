package com.calldash.calldash.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordQueryTranslatorTest {

    private static final List<String> COLUMNS = List.of("CallerID", "CallerState", "CallerCity", "CallerCarrier", "Duration");

    private final KeywordQueryTranslator translator = new KeywordQueryTranslator();

    @Test
    void shouldTurnStateCodeAndGroupingIntoStructuredQuery() {
        QueryModels.QuerySpecification spec = translator.translate("How many calls from CA by state", COLUMNS);

        assertEquals(Map.of("CallerState", "CA"), spec.filters());
        assertEquals("count", spec.aggregation().type());
        assertEquals("CallerState", spec.aggregation().groupBy());
        assertNull(spec.search());
        assertNull(spec.sort());
    }

    @Test
    void shouldKeepLowercaseWordsThatLookLikeStateCodesAsKeywords() {
        QueryModels.QuerySpecification spec = translator.translate("show me callers in fresno", COLUMNS);

        assertTrue(spec.filters().isEmpty());
        assertEquals("fresno", spec.search());
    }

    @Test
    void shouldRecognizeSortRequests() {
        QueryModels.QuerySpecification spec = translator.translate("verizon calls sorted by duration descending", COLUMNS);

        assertEquals("Duration", spec.sort().column());
        assertEquals("desc", spec.sort().direction());
        assertNull(spec.aggregation());
        assertEquals("verizon", spec.search());
    }

    @Test
    void shouldIgnoreStateCodeWhenDatasetHasNoStateColumn() {
        QueryModels.QuerySpecification spec = translator.translate("calls from NY", List.of("CallerID"));

        assertTrue(spec.filters().isEmpty());
        assertEquals("ny", spec.search());
    }

    @Test
    void shouldExplainEmptyQuery() {
        QueryModels.QuerySpecification spec = translator.translate("show me all calls", COLUMNS);

        assertEquals("Showing all records", spec.explanation());
        assertNull(spec.search());
    }
}
