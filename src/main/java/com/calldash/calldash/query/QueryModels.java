package com.calldash.calldash.query;

import com.calldash.calldash.data.Row;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public final class QueryModels {

    private QueryModels() {
    }

    /**
     * Structured query over the current call dataset. Every part is optional.
     */
    public record QuerySpecification(
            Map<String, String> filters,
            SortSpec sort,
            AggregationSpec aggregation,
            String search,
            DateRangeSpec dateRange,
            String explanation
    ) {

        public QuerySpecification {
            filters = filters == null ? Map.of() : filters;
        }
    }

    public record SortSpec(String column, String direction) {
    }

    /**
     * {@code type} is one of count, sum, avg, max, min; {@code column} is required except for count.
     */
    public record AggregationSpec(String type, String column, String groupBy) {
    }

    /**
     * Inclusive call-date bounds; either side may be open.
     */
    public record DateRangeSpec(LocalDate start, LocalDate end) {
    }

    public record NaturalLanguageQueryRequest(String message) {
    }

    /**
     * Buckets hold the group value under {@code groupBy} and the statistic under {@code type}.
     */
    /**
     * Each bucket maps {@code groupBy} to the group value and {@code valueKey} to the statistic.
     */
    public record AggregationResult(
            String type,
            String column,
            String groupBy,
            String valueKey,
            List<Map<String, Object>> buckets
    ) {
    }

    public record QueryResponse(
            int resultCount,
            List<Row> results,
            AggregationResult aggregation,
            String explanation,
            QuerySpecification query
    ) {
    }
}
