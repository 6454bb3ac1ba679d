package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Dataset;

import java.util.List;

public record EnrichmentResult(Dataset dataset, List<String> addedColumns, int enrichedCount, String message) {

    public EnrichmentResult {
        addedColumns = addedColumns == null ? List.of() : List.copyOf(addedColumns);
    }
}
