package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Row;

import java.util.List;
import java.util.Map;

public final class EnrichmentModels {

    private EnrichmentModels() {
    }

    /**
     * Rows to enrich; omit {@code data} to enrich the caller's current working view.
     */
    public record EnrichmentRequest(List<Map<String, Object>> data) {
    }

    public record EnrichmentResponse(
            List<Row> data,
            List<String> columns,
            String message,
            List<String> addedColumns,
            int enrichedCount
    ) {

        public static EnrichmentResponse of(EnrichmentResult result) {
            return new EnrichmentResponse(
                    result.dataset().rows(),
                    result.dataset().columns(),
                    result.message(),
                    result.addedColumns(),
                    result.enrichedCount()
            );
        }
    }
}
