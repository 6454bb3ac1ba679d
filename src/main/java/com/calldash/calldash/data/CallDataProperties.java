package com.calldash.calldash.data;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized call data configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "calldata")
public class CallDataProperties {

    private String dataDirectory = CallDataConstants.DEFAULT_DATA_DIRECTORY;
    private String defaultFile;
    private long maxUploadBytes = CallDataConstants.DEFAULT_MAX_UPLOAD_BYTES;
    private List<String> allowedExtensions = new ArrayList<>(CallDataConstants.DEFAULT_ALLOWED_EXTENSIONS);
    private String dateColumn = CallDataConstants.DEFAULT_DATE_COLUMN;
    private int queryMaxResults = CallDataConstants.DEFAULT_QUERY_MAX_RESULTS;

    public String getDataDirectory() {
        return dataDirectory;
    }

    public void setDataDirectory(String dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    /**
     * Dataset served when no uploaded file is active; blank disables the fallback.
     */
    public String getDefaultFile() {
        return defaultFile;
    }

    public void setDefaultFile(String defaultFile) {
        this.defaultFile = defaultFile;
    }

    public long getMaxUploadBytes() {
        return maxUploadBytes;
    }

    public void setMaxUploadBytes(long maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public void setDateColumn(String dateColumn) {
        this.dateColumn = dateColumn;
    }

    public int getQueryMaxResults() {
        return queryMaxResults;
    }

    public void setQueryMaxResults(int queryMaxResults) {
        this.queryMaxResults = queryMaxResults;
    }
}
