package com.calldash.calldash.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Registers uploaded call-log files and manages their active state. Every registry
 * mutation invalidates the merged dataset and drops all working views.
 */
@Service
public class DataFileService {

    private static final Logger log = LoggerFactory.getLogger(DataFileService.class);

    private final FileRegistry fileRegistry;
    private final DataFileStore dataFileStore;
    private final TabularParser tabularParser;
    private final SchemaReconciler schemaReconciler;
    private final IngestionService ingestionService;
    private final MergeCache mergeCache;
    private final WorkingViewCache workingViewCache;
    private final CallDataProperties callDataProperties;

    public DataFileService(
            FileRegistry fileRegistry,
            DataFileStore dataFileStore,
            TabularParser tabularParser,
            SchemaReconciler schemaReconciler,
            IngestionService ingestionService,
            MergeCache mergeCache,
            WorkingViewCache workingViewCache,
            CallDataProperties callDataProperties
    ) {
        this.fileRegistry = fileRegistry;
        this.dataFileStore = dataFileStore;
        this.tabularParser = tabularParser;
        this.schemaReconciler = schemaReconciler;
        this.ingestionService = ingestionService;
        this.mergeCache = mergeCache;
        this.workingViewCache = workingViewCache;
        this.callDataProperties = callDataProperties;
    }

    /**
     * Validates, parses and stores one upload, returning its registry entry and its column
     * drift against the dataset as it stood before the upload.
     */
    public DataModels.UploadResponse upload(String originalName, byte[] content, Long uploadedBy) {
        validateUpload(originalName, content);
        ParsedTable table = tabularParser.parse(content, originalName);

        Dataset before = ingestionService.loadAll(false);
        SchemaDiff schemaDiff = before.userColumns().isEmpty()
                ? SchemaDiff.none()
                : schemaReconciler.diff(before.userColumns(), table.columns());

        String[] dateRange = dateRange(table);
        String storedPath = dataFileStore.store(originalName, content);
        DataFile created;
        try {
            created = fileRegistry.insert(new DataFile(
                    null,
                    storedPath,
                    originalName,
                    content.length,
                    table.rows().size(),
                    table.columns(),
                    dateRange[0],
                    dateRange[1],
                    uploadedBy,
                    null,
                    System.currentTimeMillis(),
                    true
            ));
        } catch (RuntimeException ex) {
            discardStoredContent(storedPath, ex);
            throw ex;
        }
        invalidate();

        log.info("Registered data file. id={}, name={}, rows={}, newColumns={}, missingColumns={}",
                created.id(), originalName, created.rowCount(), schemaDiff.newColumns(), schemaDiff.missingColumns());
        return new DataModels.UploadResponse(created, schemaDiff);
    }

    public List<DataFile> listFiles() {
        return fileRegistry.listAll();
    }

    /**
     * Deactivates a file; its stored bytes are deleted only when {@code deleteStoredContent} is set.
     */
    public DataModels.RemoveFileResponse remove(long fileId, boolean deleteStoredContent) {
        DataFile file = requireFile(fileId);
        fileRegistry.deactivate(fileId);
        try {
            if (deleteStoredContent) {
                dataFileStore.delete(file.storedPath());
            }
        } finally {
            invalidate();
        }
        log.info("Removed data file. id={}, name={}, storedContentDeleted={}", fileId, file.originalName(), deleteStoredContent);
        return new DataModels.RemoveFileResponse(requireFile(fileId), deleteStoredContent);
    }

    public DataFile restore(long fileId) {
        DataFile file = requireFile(fileId);
        if (!dataFileStore.exists(file.storedPath())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, CallDataConstants.MSG_STORED_FILE_MISSING.formatted(fileId));
        }
        fileRegistry.activate(fileId);
        invalidate();
        log.info("Restored data file. id={}, name={}", fileId, file.originalName());
        return requireFile(fileId);
    }

    /**
     * Removes bytes stored for an upload whose registry insert failed.
     */
    private void discardStoredContent(String storedPath, RuntimeException insertFailure) {
        try {
            dataFileStore.delete(storedPath);
            log.warn("Registry insert failed; discarded stored content. storedPath={}", storedPath, insertFailure);
        } catch (DataFileStoreException ex) {
            insertFailure.addSuppressed(ex);
            log.error("Registry insert failed and stored content could not be discarded. storedPath={}", storedPath, ex);
        }
    }

    private void invalidate() {
        mergeCache.invalidate();
        workingViewCache.clear();
    }

    private DataFile requireFile(long fileId) {
        return fileRegistry.findById(fileId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, CallDataConstants.MSG_FILE_NOT_FOUND.formatted(fileId)));
    }

    private void validateUpload(String originalName, byte[] content) {
        if (originalName == null || originalName.isBlank()) {
            throw new IllegalArgumentException(CallDataConstants.MSG_UPLOAD_NAME_MISSING);
        }
        String lower = originalName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        String extension = dot < 0 ? "" : lower.substring(dot + 1);
        if (!callDataProperties.getAllowedExtensions().contains(extension)) {
            throw new IllegalArgumentException(CallDataConstants.MSG_UPLOAD_EXTENSION
                    .formatted(String.join(", ", callDataProperties.getAllowedExtensions())));
        }
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException(CallDataConstants.MSG_UPLOAD_EMPTY);
        }
        if (content.length > callDataProperties.getMaxUploadBytes()) {
            throw new IllegalArgumentException(CallDataConstants.MSG_UPLOAD_TOO_LARGE.formatted(callDataProperties.getMaxUploadBytes()));
        }
    }

    /**
     * Earliest and latest call date in the configured date column, ISO formatted; nulls when none parse.
     */
    private String[] dateRange(ParsedTable table) {
        String dateColumn = callDataProperties.getDateColumn();
        LocalDate min = null;
        LocalDate max = null;
        if (dateColumn != null && table.columns().contains(dateColumn)) {
            for (Map<String, String> row : table.rows()) {
                LocalDate date = CallDates.parse(row.get(dateColumn));
                if (date == null) {
                    continue;
                }
                if (min == null || date.isBefore(min)) {
                    min = date;
                }
                if (max == null || date.isAfter(max)) {
                    max = date;
                }
            }
        }
        return new String[] {
                min == null ? null : min.toString(),
                max == null ? null : max.toString()
        };
    }
}
