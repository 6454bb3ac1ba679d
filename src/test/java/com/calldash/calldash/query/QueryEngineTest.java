package com.calldash.calldash.query;

import com.calldash.calldash.data.CallDataProperties;
import com.calldash.calldash.data.Dataset;
import com.calldash.calldash.data.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryEngineTest {

    private CallDataProperties properties;
    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        properties = new CallDataProperties();
        engine = new QueryEngine(properties);
    }

    @Test
    void shouldCountCaliforniaCallersGroupedByState() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            rows.add(row("CallerID", String.valueOf(5550000000L + i), "CallerState", i < 40 ? "CA" : "NY"));
        }
        Dataset dataset = Dataset.fromMaps(rows);

        QueryModels.QueryResponse response = engine.execute(dataset, spec(
                Map.of("CallerState", "CA"),
                null,
                new QueryModels.AggregationSpec("count", null, "CallerState")
        ));

        assertEquals(40, response.resultCount());
        assertEquals(40, response.results().size());
        assertEquals(1, response.aggregation().buckets().size());
        Map<String, Object> bucket = response.aggregation().buckets().get(0);
        assertEquals("CA", bucket.get("CallerState"));
        assertEquals(40, ((Number) bucket.get("count")).intValue());
    }

    @Test
    void shouldCapResultsButReportTrueCount() {
        properties.setQueryMaxResults(10);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            rows.add(row("CallerID", String.valueOf(i)));
        }

        QueryModels.QueryResponse response = engine.execute(Dataset.fromMaps(rows), spec(Map.of(), null, null));

        assertEquals(25, response.resultCount());
        assertEquals(10, response.results().size());
    }

    @Test
    void shouldMatchFiltersBySubstringIgnoringCase() {
        Dataset dataset = Dataset.fromMaps(List.of(
                row("CallerCity", "San Francisco"),
                row("CallerCity", "South San Francisco"),
                row("CallerCity", "Fresno")
        ));

        QueryModels.QueryResponse response = engine.execute(dataset, spec(Map.of("CallerCity", "san fran"), null, null));

        assertEquals(2, response.resultCount());
    }

    @Test
    void shouldSortNumericallyWhenValuesAreNumbers() {
        Dataset dataset = Dataset.fromMaps(List.of(
                row("Duration", "9"),
                row("Duration", "100"),
                row("Duration", null),
                row("Duration", "25")
        ));

        QueryModels.QueryResponse ascending = engine.execute(dataset,
                spec(Map.of(), new QueryModels.SortSpec("Duration", "asc"), null));
        QueryModels.QueryResponse descending = engine.execute(dataset,
                spec(Map.of(), new QueryModels.SortSpec("Duration", "desc"), null));

        assertEquals(List.of("9", "25", "100"), durations(ascending.results()).subList(0, 3));
        assertNull(ascending.results().get(3).get("Duration"));
        assertEquals(List.of("100", "25", "9"), durations(descending.results()).subList(0, 3));
        assertNull(descending.results().get(3).get("Duration"));
    }

    @Test
    void shouldSortTextLexicographically() {
        Dataset dataset = Dataset.fromMaps(List.of(row("Name", "bravo"), row("Name", "alpha"), row("Name", "charlie")));

        QueryModels.QueryResponse response = engine.execute(dataset,
                spec(Map.of(), new QueryModels.SortSpec("Name", null), null));

        assertEquals("alpha", response.results().get(0).get("Name"));
        assertEquals("charlie", response.results().get(2).get("Name"));
    }

    @Test
    void shouldAggregateNumericStatisticsDescendingWithUnknownBucket() {
        Dataset dataset = Dataset.fromMaps(List.of(
                row("CallerState", "CA", "Duration", "10"),
                row("CallerState", "CA", "Duration", "30"),
                row("CallerState", "NY", "Duration", "50"),
                row("CallerState", "", "Duration", "5"),
                row("CallerState", "TX", "Duration", "n/a")
        ));

        QueryModels.QueryResponse response = engine.execute(dataset,
                spec(Map.of(), null, new QueryModels.AggregationSpec("avg", "Duration", "CallerState")));

        List<Map<String, Object>> buckets = response.aggregation().buckets();
        assertEquals(List.of("NY", "CA", "Unknown", "TX"),
                buckets.stream().map(bucket -> bucket.get("CallerState")).toList());
        assertEquals(20.0, ((Number) buckets.get(1).get("avg")).doubleValue());
        assertNull(buckets.get(3).get("avg"));
    }

    @Test
    void shouldSkipAggregationWithoutGroupBy() {
        Dataset dataset = Dataset.fromMaps(List.of(row("Duration", "1")));

        QueryModels.QueryResponse response = engine.execute(dataset,
                spec(Map.of(), null, new QueryModels.AggregationSpec("sum", "Duration", null)));

        assertNull(response.aggregation());
        assertEquals(1, response.resultCount());

        QueryModels.QueryResponse withoutColumn = engine.execute(dataset,
                spec(Map.of(), null, new QueryModels.AggregationSpec("sum", null, null)));

        assertNull(withoutColumn.aggregation());
        assertEquals(1, withoutColumn.resultCount());
    }

    @Test
    void shouldKeepGroupValueWhenGroupColumnIsNamedAfterStatistic() {
        Dataset dataset = Dataset.fromMaps(List.of(
                row("count", "low"),
                row("count", "high"),
                row("count", "high")
        ));

        QueryModels.AggregationResult aggregation = engine.execute(dataset,
                spec(Map.of(), null, new QueryModels.AggregationSpec("count", null, "count"))).aggregation();

        assertEquals("countValue", aggregation.valueKey());
        Map<String, Object> top = aggregation.buckets().get(0);
        assertEquals("high", top.get("count"));
        assertEquals(2, ((Number) top.get("countValue")).intValue());
    }

    @Test
    void shouldRequireEverySearchTermSomewhereInRow() {
        Dataset dataset = Dataset.fromMaps(List.of(
                row("CallerCity", "Fresno", "CallerCarrier", "AT&T"),
                row("CallerCity", "Fresno", "CallerCarrier", "Verizon"),
                row("CallerCity", "Oakland", "CallerCarrier", "AT&T")
        ));

        QueryModels.QueryResponse response = engine.execute(dataset, new QueryModels.QuerySpecification(
                null, null, null, "fresno at&t", null, null));

        assertEquals(1, response.resultCount());
    }

    @Test
    void shouldFilterByDateRangeAndKeepUndatedRows() {
        Dataset dataset = Dataset.fromMaps(List.of(
                row("CallStart", "03-01-24 10:00"),
                row("CallStart", "03-15-24 10:00"),
                row("CallStart", "04-02-24 10:00"),
                row("CallStart", "")
        ));

        QueryModels.QueryResponse response = engine.execute(dataset, new QueryModels.QuerySpecification(
                null, null, null, null,
                new QueryModels.DateRangeSpec(LocalDate.of(2024, 3, 10), LocalDate.of(2024, 3, 31)), null));

        assertEquals(2, response.resultCount());
        assertEquals("03-15-24 10:00", response.results().get(0).get("CallStart"));
    }

    @Test
    void shouldRejectInvalidSpecifications() {
        Dataset dataset = Dataset.fromMaps(List.of(row("CallerState", "CA", "Duration", "1")));

        assertThrows(QueryValidationException.class, () -> engine.execute(dataset,
                spec(Map.of(), null, new QueryModels.AggregationSpec("median", "Duration", "CallerState"))));
        assertThrows(QueryValidationException.class, () -> engine.execute(dataset,
                spec(Map.of(), null, new QueryModels.AggregationSpec("sum", null, "CallerState"))));
        assertThrows(QueryValidationException.class, () -> engine.execute(dataset,
                spec(Map.of("NoSuchColumn", "x"), null, null)));
        assertThrows(QueryValidationException.class, () -> engine.execute(dataset,
                spec(Map.of(), new QueryModels.SortSpec("Duration", "sideways"), null)));
        assertThrows(QueryValidationException.class, () -> engine.execute(dataset, null));
    }

    private QueryModels.QuerySpecification spec(
            Map<String, String> filters,
            QueryModels.SortSpec sort,
            QueryModels.AggregationSpec aggregation
    ) {
        return new QueryModels.QuerySpecification(filters, sort, aggregation, null, null, null);
    }

    private List<Object> durations(List<Row> rows) {
        List<Object> values = new ArrayList<>();
        for (Row row : rows) {
            values.add(row.get("Duration"));
        }
        return values;
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
