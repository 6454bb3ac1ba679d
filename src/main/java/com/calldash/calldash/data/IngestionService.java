package com.calldash.calldash.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges every active call-log file into one rectangular dataset: reads files oldest first,
 * accumulates the column union, tags rows with provenance and fills absent columns with null.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final FileRegistry fileRegistry;
    private final DataFileStore dataFileStore;
    private final TabularParser tabularParser;
    private final SchemaReconciler schemaReconciler;
    private final MergeCache mergeCache;

    public IngestionService(
            FileRegistry fileRegistry,
            DataFileStore dataFileStore,
            TabularParser tabularParser,
            SchemaReconciler schemaReconciler,
            MergeCache mergeCache
    ) {
        this.fileRegistry = fileRegistry;
        this.dataFileStore = dataFileStore;
        this.tabularParser = tabularParser;
        this.schemaReconciler = schemaReconciler;
        this.mergeCache = mergeCache;
    }

    /**
     * Returns the cached merged dataset, re-parsing the active files only when the cache
     * was invalidated or {@code forceRefresh} is set.
     */
    public Dataset loadAll(boolean forceRefresh) {
        if (forceRefresh) {
            return mergeCache.rebuild(this::mergeActiveFiles);
        }
        return mergeCache.getOrRebuild(this::mergeActiveFiles);
    }

    private Dataset mergeActiveFiles() {
        List<DataFile> activeFiles;
        try {
            activeFiles = fileRegistry.listActive();
        } catch (DataAccessException ex) {
            throw new IngestionException(CallDataConstants.MSG_INGESTION_FAILED, ex);
        }

        if (activeFiles.isEmpty()) {
            return loadDefaultFile();
        }

        List<String> union = new ArrayList<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        List<DataFile> loadedFiles = new ArrayList<>(activeFiles.size());

        for (DataFile file : activeFiles) {
            ParsedTable table;
            try {
                table = tabularParser.parse(dataFileStore.read(file.storedPath()), file.originalName());
            } catch (TabularParseException | DataFileStoreException ex) {
                log.error("Skipping unreadable data file. id={}, name={}, reason={}",
                        file.id(), file.originalName(), ex.getMessage(), ex);
                continue;
            }

            union = schemaReconciler.union(union, table.columns());
            for (Map<String, String> parsedRow : table.rows()) {
                rows.add(tagProvenance(parsedRow, file.originalName(), file.id()));
            }
            loadedFiles.add(file);
        }

        Dataset merged = Dataset.fromMaps(rows, withProvenance(union), loadedFiles);
        log.info("Merged call data. files={}, skipped={}, rows={}, columns={}",
                loadedFiles.size(), activeFiles.size() - loadedFiles.size(), merged.rows().size(), merged.columns().size());
        return merged;
    }

    private Dataset loadDefaultFile() {
        Optional<DataFileStore.StoredContent> fallback = dataFileStore.readDefaultFile();
        if (fallback.isEmpty()) {
            return Dataset.empty();
        }

        DataFileStore.StoredContent content = fallback.get();
        ParsedTable table;
        try {
            table = tabularParser.parse(content.content(), content.fileName());
        } catch (TabularParseException ex) {
            log.error("Skipping unreadable default data file. name={}, reason={}", content.fileName(), ex.getMessage(), ex);
            return Dataset.empty();
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.rows().size());
        for (Map<String, String> parsedRow : table.rows()) {
            rows.add(tagProvenance(parsedRow, content.fileName(), null));
        }
        log.info("Loaded default call data file. name={}, rows={}", content.fileName(), rows.size());
        return Dataset.fromMaps(rows, withProvenance(table.columns()), List.of());
    }

    private Map<String, Object> tagProvenance(Map<String, String> parsedRow, String fileName, Long fileId) {
        Map<String, Object> row = new LinkedHashMap<>(parsedRow);
        row.put(CallDataConstants.COLUMN_SOURCE_FILE, fileName);
        row.put(CallDataConstants.COLUMN_SOURCE_FILE_ID, fileId);
        return row;
    }

    private List<String> withProvenance(List<String> userColumns) {
        return schemaReconciler.union(userColumns, CallDataConstants.PROVENANCE_COLUMNS);
    }
}
