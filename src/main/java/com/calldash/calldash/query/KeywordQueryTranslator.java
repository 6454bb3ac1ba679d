package com.calldash.calldash.query;

import com.calldash.calldash.enrich.ReferenceTables;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based translator: upper-case state codes become a {@code CallerState} filter,
 * {@code by <column>} groups a count by that column ({@code sort by <column>} sorts instead),
 * and the remaining non-stop-word keywords become the global search.
 */
@Component
public class KeywordQueryTranslator implements QueryTranslator {

    private static final Set<String> SEARCH_STOP_WORDS = Set.of(
            "i", "want", "to", "search", "all", "for", "the", "and", "or", "of", "in", "on",
            "show", "me", "a", "an", "are", "is", "there", "what", "which", "who", "how", "many",
            "list", "find", "get", "give", "with", "from", "where", "count", "number",
            "call", "calls", "caller", "callers", "record", "records"
    );
    private static final Set<String> SORT_WORDS = Set.of("sort", "sorted", "order", "ordered");
    private static final Set<String> DESCENDING_WORDS = Set.of("desc", "descending", "highest", "largest", "most");

    @Override
    public QueryModels.QuerySpecification translate(String message, List<String> availableColumns) {
        String rawQuery = message == null ? "" : message.trim();
        List<String> tokens = tokenize(rawQuery);

        Map<String, String> filters = new LinkedHashMap<>();
        QueryModels.AggregationSpec aggregation = null;
        QueryModels.SortSpec sort = null;
        boolean descending = false;
        List<String> keywords = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            String lower = token.toLowerCase(Locale.ROOT);

            if (DESCENDING_WORDS.contains(lower)) {
                descending = true;
                continue;
            }
            if ("by".equals(lower) && i + 1 < tokens.size()) {
                String column = resolveColumn(tokens.get(i + 1), availableColumns);
                if (column != null) {
                    boolean sortRequested = i > 0 && SORT_WORDS.contains(tokens.get(i - 1).toLowerCase(Locale.ROOT));
                    if (sortRequested) {
                        sort = new QueryModels.SortSpec(column, QueryConstants.DIRECTION_ASC);
                    } else {
                        aggregation = new QueryModels.AggregationSpec(QueryConstants.AGG_COUNT, null, column);
                    }
                    i++;
                    continue;
                }
            }
            if (isStateCode(token) && availableColumns.contains(QueryConstants.COLUMN_CALLER_STATE)) {
                filters.putIfAbsent(QueryConstants.COLUMN_CALLER_STATE, token);
                continue;
            }
            if ("by".equals(lower) || SORT_WORDS.contains(lower) || SEARCH_STOP_WORDS.contains(lower)) {
                continue;
            }
            keywords.add(lower);
        }

        if (sort != null && descending) {
            sort = new QueryModels.SortSpec(sort.column(), QueryConstants.DIRECTION_DESC);
        }
        String search = keywords.isEmpty() ? null : String.join(" ", keywords);
        return new QueryModels.QuerySpecification(
                filters,
                sort,
                aggregation,
                search,
                null,
                explain(filters, sort, aggregation, search)
        );
    }

    private List<String> tokenize(String query) {
        List<String> tokens = new ArrayList<>();
        for (String token : query.split("[^A-Za-z0-9_@.-]+")) {
            String trimmed = stripEdgePunctuation(token);
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }

    private String stripEdgePunctuation(String token) {
        return token.replaceAll("^[.\\-]+|[.\\-]+$", "");
    }

    /**
     * Only upper-case two-letter tokens count, so words like "in" or "or" stay keywords.
     */
    private boolean isStateCode(String token) {
        return token.length() == 2
                && token.equals(token.toUpperCase(Locale.ROOT))
                && ReferenceTables.isKnownRegion(token);
    }

    /**
     * Matches a column by exact name, then by suffix, so "state" resolves to {@code CallerState}.
     */
    private String resolveColumn(String token, List<String> availableColumns) {
        String normalized = normalizeKey(token);
        if (normalized.isEmpty()) {
            return null;
        }
        for (String column : availableColumns) {
            if (normalizeKey(column).equals(normalized)) {
                return column;
            }
        }
        for (String column : availableColumns) {
            if (normalizeKey(column).endsWith(normalized)) {
                return column;
            }
        }
        return null;
    }

    private String normalizeKey(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    private String explain(
            Map<String, String> filters,
            QueryModels.SortSpec sort,
            QueryModels.AggregationSpec aggregation,
            String search
    ) {
        List<String> parts = new ArrayList<>();
        filters.forEach((column, value) -> parts.add("%s matches '%s'".formatted(column, value)));
        if (search != null) {
            parts.add("any field contains '%s'".formatted(search));
        }
        if (aggregation != null) {
            parts.add("counted by " + aggregation.groupBy());
        }
        if (sort != null) {
            parts.add("sorted by %s %s".formatted(sort.column(), sort.direction()));
        }
        return parts.isEmpty() ? "Showing all records" : "Showing records: " + String.join("; ", parts);
    }
}
