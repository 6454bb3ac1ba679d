package com.calldash.calldash.enrich;

import com.calldash.calldash.data.CallDataConstants;
import com.calldash.calldash.data.Dataset;
import com.calldash.calldash.data.IngestionService;
import com.calldash.calldash.data.Row;
import com.calldash.calldash.data.WorkingViewCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one enrichment pass over a row set and adopts the rectangular result as the caller's working view.
 */
@Service
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final Map<String, EnrichmentPass> passes;
    private final IngestionService ingestionService;
    private final WorkingViewCache workingViewCache;

    public EnrichmentService(
            List<EnrichmentPass> passes,
            IngestionService ingestionService,
            WorkingViewCache workingViewCache
    ) {
        Map<String, EnrichmentPass> byType = new LinkedHashMap<>();
        for (EnrichmentPass pass : passes) {
            if (byType.putIfAbsent(pass.type(), pass) != null) {
                throw new IllegalStateException("Duplicate enrichment type: " + pass.type());
            }
        }
        this.passes = byType;
        this.ingestionService = ingestionService;
        this.workingViewCache = workingViewCache;
    }

    public List<String> availableTypes() {
        return List.copyOf(passes.keySet());
    }

    /**
     * Enriches {@code data} when given, otherwise the caller's working view, otherwise the merged dataset.
     */
    public EnrichmentResult enrich(String type, List<Map<String, Object>> data, long userId) {
        EnrichmentPass pass = passes.get(type);
        if (pass == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown enrichment type: " + type);
        }
        Dataset input = data != null
                ? Dataset.fromMaps(data)
                : workingViewCache.get(userId).orElseGet(() -> ingestionService.loadAll(false));

        EnrichmentResult result = apply(pass, input);
        workingViewCache.put(userId, result.dataset());
        log.info("Enrichment complete. type={}, rows={}, enriched={}, addedColumns={}",
                type, input.rows().size(), result.enrichedCount(), result.addedColumns());
        return result;
    }

    /**
     * Applies {@code pass} to detached copies of the rows; {@code input} is left untouched.
     */
    EnrichmentResult apply(EnrichmentPass pass, Dataset input) {
        EnrichmentPass.RowEnricher enricher = pass.begin(input.rows());

        List<Map<String, Object>> mutated = new ArrayList<>(input.rows().size());
        int enrichedCount = 0;
        for (Row row : input.rows()) {
            Map<String, Object> copy = row.toMutableMap();
            if (enricher.enrich(copy)) {
                enrichedCount++;
            }
            for (String column : pass.ownedColumns()) {
                copy.putIfAbsent(column, null);
            }
            mutated.add(copy);
        }

        List<String> columns = columnUnion(input, mutated, pass.ownedColumns());
        List<String> addedColumns = new ArrayList<>();
        for (String column : columns) {
            if (!input.columns().contains(column)) {
                addedColumns.add(column);
            }
        }

        Dataset enriched = Dataset.fromMaps(mutated, columns, input.sourceFiles());
        return new EnrichmentResult(enriched, addedColumns, enrichedCount, pass.message(enrichedCount));
    }

    private List<String> columnUnion(Dataset input, List<Map<String, Object>> rows, List<String> ownedColumns) {
        Set<String> user = new LinkedHashSet<>(input.userColumns());
        user.addAll(ownedColumns);
        for (Map<String, Object> row : rows) {
            user.addAll(row.keySet());
        }
        user.removeAll(CallDataConstants.PROVENANCE_COLUMNS);

        List<String> columns = new ArrayList<>(user);
        for (String provenance : CallDataConstants.PROVENANCE_COLUMNS) {
            if (input.columns().contains(provenance)) {
                columns.add(provenance);
            }
        }
        return columns;
    }
}
