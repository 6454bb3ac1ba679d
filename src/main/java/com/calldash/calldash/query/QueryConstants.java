package com.calldash.calldash.query;

import java.util.Set;

public final class QueryConstants {

    private QueryConstants() {
    }

    public static final String AGG_COUNT = "count";
    public static final String AGG_SUM = "sum";
    public static final String AGG_AVG = "avg";
    public static final String AGG_MAX = "max";
    public static final String AGG_MIN = "min";
    public static final Set<String> AGGREGATION_TYPES = Set.of(AGG_COUNT, AGG_SUM, AGG_AVG, AGG_MAX, AGG_MIN);

    public static final String DIRECTION_ASC = "asc";
    public static final String DIRECTION_DESC = "desc";

    public static final String UNKNOWN_GROUP = "Unknown";
    public static final String VALUE_KEY_SUFFIX = "Value";
    public static final String COLUMN_CALLER_STATE = "CallerState";
    public static final String EXPORT_FILE_NAME = "call-data-export.csv";

    public static final String MSG_MESSAGE_REQUIRED = "Query message is required";
    public static final String MSG_SPEC_REQUIRED = "Query specification is required";
    public static final String MSG_UNKNOWN_COLUMN = "Unknown column in %s: %s";
    public static final String MSG_UNKNOWN_AGGREGATION = "Unsupported aggregation type: %s (expected one of count, sum, avg, max, min)";
    public static final String MSG_AGGREGATION_COLUMN_REQUIRED = "Aggregation '%s' requires a column";
    public static final String MSG_SORT_COLUMN_REQUIRED = "Sort requires a column";
    public static final String MSG_UNKNOWN_DIRECTION = "Unsupported sort direction: %s (expected asc or desc)";
    public static final String MSG_DATE_RANGE_INVERTED = "Date range start %s is after end %s";
}
