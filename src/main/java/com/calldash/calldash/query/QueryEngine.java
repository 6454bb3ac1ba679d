package com.calldash.calldash.query;

import com.calldash.calldash.data.CallDataProperties;
import com.calldash.calldash.data.Dataset;
import com.calldash.calldash.data.Row;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Executes structured queries against an in-memory dataset: filter, search, date range, sort,
 * grouped aggregation and a capped result page.
 */
@Component
public class QueryEngine {

    private final CallDataProperties callDataProperties;

    public QueryEngine(CallDataProperties callDataProperties) {
        this.callDataProperties = callDataProperties;
    }

    public QueryModels.QueryResponse execute(Dataset dataset, QueryModels.QuerySpecification spec) {
        List<Row> matches = select(dataset, spec);
        int cap = Math.max(0, callDataProperties.getQueryMaxResults());
        List<Row> page = matches.size() > cap ? List.copyOf(matches.subList(0, cap)) : matches;
        return new QueryModels.QueryResponse(
                matches.size(),
                page,
                aggregate(matches, spec.aggregation()),
                spec.explanation(),
                spec
        );
    }

    /**
     * Returns every row matching {@code spec}, sorted, without the result cap.
     *
     * @throws QueryValidationException when the specification does not fit the dataset
     */
    public List<Row> select(Dataset dataset, QueryModels.QuerySpecification spec) {
        if (spec == null) {
            throw new QueryValidationException(QueryConstants.MSG_SPEC_REQUIRED);
        }
        validate(dataset, spec);

        List<String> terms = searchTerms(spec.search());
        List<Row> matches = new ArrayList<>();
        for (Row row : dataset.rows()) {
            if (matchesFilters(row, spec.filters()) && matchesSearch(row, terms) && inDateRange(row, spec.dateRange())) {
                matches.add(row);
            }
        }

        QueryModels.SortSpec sort = spec.sort();
        if (sort != null) {
            matches.sort(comparator(sort.column(), isDescending(sort)));
        }
        return matches;
    }

    private void validate(Dataset dataset, QueryModels.QuerySpecification spec) {
        List<String> columns = dataset.columns();
        for (String column : spec.filters().keySet()) {
            requireKnownColumn(columns, column, "filters");
        }

        QueryModels.SortSpec sort = spec.sort();
        if (sort != null) {
            if (sort.column() == null || sort.column().isBlank()) {
                throw new QueryValidationException(QueryConstants.MSG_SORT_COLUMN_REQUIRED);
            }
            requireKnownColumn(columns, sort.column(), "sort");
            String direction = sort.direction();
            if (direction != null
                    && !QueryConstants.DIRECTION_ASC.equalsIgnoreCase(direction)
                    && !QueryConstants.DIRECTION_DESC.equalsIgnoreCase(direction)) {
                throw new QueryValidationException(QueryConstants.MSG_UNKNOWN_DIRECTION.formatted(direction));
            }
        }

        QueryModels.AggregationSpec aggregation = spec.aggregation();
        if (aggregation != null && aggregation.groupBy() != null && !aggregation.groupBy().isBlank()) {
            String type = aggregation.type() == null ? null : aggregation.type().toLowerCase(Locale.ROOT);
            if (!QueryConstants.AGGREGATION_TYPES.contains(type)) {
                throw new QueryValidationException(QueryConstants.MSG_UNKNOWN_AGGREGATION.formatted(aggregation.type()));
            }
            if (!QueryConstants.AGG_COUNT.equals(type)) {
                if (aggregation.column() == null || aggregation.column().isBlank()) {
                    throw new QueryValidationException(QueryConstants.MSG_AGGREGATION_COLUMN_REQUIRED.formatted(type));
                }
                requireKnownColumn(columns, aggregation.column(), "aggregation");
            }
            requireKnownColumn(columns, aggregation.groupBy(), "groupBy");
        }

        QueryModels.DateRangeSpec range = spec.dateRange();
        if (range != null && range.start() != null && range.end() != null && range.start().isAfter(range.end())) {
            throw new QueryValidationException(QueryConstants.MSG_DATE_RANGE_INVERTED.formatted(range.start(), range.end()));
        }
    }

    private void requireKnownColumn(List<String> columns, String column, String part) {
        // an empty dataset has no schema to check against
        if (!columns.isEmpty() && !columns.contains(column)) {
            throw new QueryValidationException(QueryConstants.MSG_UNKNOWN_COLUMN.formatted(part, column));
        }
    }

    private boolean matchesFilters(Row row, Map<String, String> filters) {
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            if (filter.getValue() == null) {
                continue;
            }
            String target = filter.getValue().trim().toLowerCase(Locale.ROOT);
            String value = row.text(filter.getKey()).toLowerCase(Locale.ROOT);
            if (!value.equals(target) && !value.contains(target)) {
                return false;
            }
        }
        return true;
    }

    private List<String> searchTerms(String search) {
        List<String> terms = new ArrayList<>();
        if (search == null) {
            return terms;
        }
        for (String term : search.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    private boolean matchesSearch(Row row, List<String> terms) {
        for (String term : terms) {
            boolean found = false;
            for (Object value : row.asMap().values()) {
                if (value != null && value.toString().toLowerCase(Locale.ROOT).contains(term)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    /**
     * Rows without a parseable call date are kept.
     */
    private boolean inDateRange(Row row, QueryModels.DateRangeSpec range) {
        if (range == null || (range.start() == null && range.end() == null)) {
            return true;
        }
        LocalDate date = row.date(callDataProperties.getDateColumn());
        if (date == null) {
            return true;
        }
        return (range.start() == null || !date.isBefore(range.start()))
                && (range.end() == null || !date.isAfter(range.end()));
    }

    private boolean isDescending(QueryModels.SortSpec sort) {
        return QueryConstants.DIRECTION_DESC.equalsIgnoreCase(sort.direction());
    }

    /**
     * Numbers compare numerically and sort ahead of text; empty values always sort last.
     */
    static Comparator<Row> comparator(String column, boolean descending) {
        Comparator<Row> byValue = (a, b) -> {
            Double left = a.number(column);
            Double right = b.number(column);
            if (left != null && right != null) {
                return Double.compare(left, right);
            }
            if (left != null) {
                return -1;
            }
            if (right != null) {
                return 1;
            }
            return a.text(column).compareTo(b.text(column));
        };
        if (descending) {
            byValue = byValue.reversed();
        }
        return Comparator.comparing((Row row) -> row.text(column).isEmpty()).thenComparing(byValue);
    }

    private QueryModels.AggregationResult aggregate(List<Row> matches, QueryModels.AggregationSpec aggregation) {
        if (aggregation == null || aggregation.groupBy() == null || aggregation.groupBy().isBlank()) {
            return null;
        }
        String type = aggregation.type().toLowerCase(Locale.ROOT);
        String groupBy = aggregation.groupBy();

        Map<String, List<Row>> groups = new LinkedHashMap<>();
        for (Row row : matches) {
            String key = row.text(groupBy).trim();
            groups.computeIfAbsent(key.isEmpty() ? QueryConstants.UNKNOWN_GROUP : key, k -> new ArrayList<>()).add(row);
        }

        // A group column literally named after the statistic keeps its key; the statistic moves aside.
        String valueKey = groupBy.equals(type) ? type + QueryConstants.VALUE_KEY_SUFFIX : type;
        List<Map<String, Object>> buckets = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Row>> group : groups.entrySet()) {
            Map<String, Object> bucket = new LinkedHashMap<>();
            bucket.put(groupBy, group.getKey());
            bucket.put(valueKey, statistic(type, aggregation.column(), group.getValue()));
            buckets.add(bucket);
        }
        buckets.sort(Comparator.comparing(
                (Map<String, Object> bucket) -> (Number) bucket.get(valueKey),
                Comparator.nullsLast(Comparator.<Number>comparingDouble(Number::doubleValue).reversed())
        ));
        return new QueryModels.AggregationResult(type, aggregation.column(), groupBy, valueKey, buckets);
    }

    /**
     * Non-count statistics use only numeric values and are null when a group has none.
     */
    private Number statistic(String type, String column, List<Row> rows) {
        if (QueryConstants.AGG_COUNT.equals(type)) {
            return rows.size();
        }
        double sum = 0;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        int count = 0;
        for (Row row : rows) {
            Double value = row.number(column);
            if (value == null) {
                continue;
            }
            sum += value;
            max = Math.max(max, value);
            min = Math.min(min, value);
            count++;
        }
        if (count == 0) {
            return null;
        }
        return switch (type) {
            case QueryConstants.AGG_SUM -> sum;
            case QueryConstants.AGG_AVG -> sum / count;
            case QueryConstants.AGG_MAX -> max;
            case QueryConstants.AGG_MIN -> min;
            default -> throw new QueryValidationException(QueryConstants.MSG_UNKNOWN_AGGREGATION.formatted(type));
        };
    }
}
