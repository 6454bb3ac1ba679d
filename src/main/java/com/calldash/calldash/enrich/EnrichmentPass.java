package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Row;

import java.util.List;
import java.util.Map;

/**
 * One idempotent row transform that adds or overwrites a fixed set of derived columns.
 */
public interface EnrichmentPass {

    /**
     * Path segment identifying the pass, e.g. {@code geocode}.
     */
    String type();

    /**
     * Columns the pass writes; every output row carries them, null when unresolved.
     */
    List<String> ownedColumns();

    /**
     * Resolves any reference data the pass needs for {@code rows} and returns the per-row transform.
     * Fails before any row is touched when that data is unavailable.
     */
    RowEnricher begin(List<Row> rows);

    String message(int enrichedCount);

    @FunctionalInterface
    interface RowEnricher {

        /**
         * Mutates {@code row} in place and reports whether it counts as enriched.
         */
        boolean enrich(Map<String, Object> row);
    }
}
