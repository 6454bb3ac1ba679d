package com.calldash.calldash.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Persistent metadata for every uploaded call-log file.
 */
@Repository
public class FileRegistry {

    private static final TypeReference<List<String>> COLUMN_LIST = new TypeReference<>() {
    };

    private static final String SELECT_FILE = """
            SELECT f.file_id, f.stored_path, f.original_name, f.size_bytes, f.row_count, f.column_list,
                   f.date_range_start, f.date_range_end, f.uploaded_by, u.username AS uploaded_by_name,
                   f.created_at, f.active
            FROM data_file f
            LEFT JOIN app_user u ON u.user_id = f.uploaded_by
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public FileRegistry(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        ensureTable();
    }

    /**
     * Inserts a new active entry and returns it with its generated id.
     */
    public DataFile insert(DataFile file) {
        jdbcTemplate.update(
                """
                INSERT INTO data_file (stored_path, original_name, size_bytes, row_count, column_list,
                                       date_range_start, date_range_end, uploaded_by, created_at, active)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE)
                """,
                file.storedPath(),
                file.originalName(),
                file.sizeBytes(),
                file.rowCount(),
                writeColumns(file.columns()),
                file.dateRangeStart(),
                file.dateRangeEnd(),
                file.uploadedBy(),
                file.createdAt()
        );

        return jdbcTemplate.queryForObject(SELECT_FILE + " WHERE f.stored_path = ?", this::mapFile, file.storedPath());
    }

    public Optional<DataFile> findById(long fileId) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(SELECT_FILE + " WHERE f.file_id = ?", this::mapFile, fileId));
        } catch (EmptyResultDataAccessException ex) {
            return Optional.empty();
        }
    }

    /**
     * Returns active files oldest first; this order drives column-union order.
     */
    public List<DataFile> listActive() {
        return jdbcTemplate.query(
                SELECT_FILE + " WHERE f.active = TRUE ORDER BY f.created_at ASC, f.file_id ASC",
                this::mapFile
        );
    }

    /**
     * Returns every file, including removed ones, newest first.
     */
    public List<DataFile> listAll() {
        return jdbcTemplate.query(SELECT_FILE + " ORDER BY f.created_at DESC, f.file_id DESC", this::mapFile);
    }

    public boolean deactivate(long fileId) {
        return jdbcTemplate.update("UPDATE data_file SET active = FALSE WHERE file_id = ?", fileId) > 0;
    }

    public boolean activate(long fileId) {
        return jdbcTemplate.update("UPDATE data_file SET active = TRUE WHERE file_id = ?", fileId) > 0;
    }

    private DataFile mapFile(ResultSet rs, int rowNum) throws SQLException {
        long uploadedById = rs.getLong("uploaded_by");
        Long uploadedBy = rs.wasNull() ? null : uploadedById;
        return new DataFile(
                rs.getLong("file_id"),
                rs.getString("stored_path"),
                rs.getString("original_name"),
                rs.getLong("size_bytes"),
                rs.getInt("row_count"),
                readColumns(rs.getString("column_list")),
                rs.getString("date_range_start"),
                rs.getString("date_range_end"),
                uploadedBy,
                rs.getString("uploaded_by_name"),
                rs.getLong("created_at"),
                rs.getBoolean("active")
        );
    }

    private String writeColumns(List<String> columns) {
        try {
            return objectMapper.writeValueAsString(columns);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to encode column list", ex);
        }
    }

    private List<String> readColumns(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, COLUMN_LIST);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to decode column list", ex);
        }
    }

    private void ensureTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS data_file (
                    file_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    stored_path VARCHAR NOT NULL,
                    original_name VARCHAR NOT NULL,
                    size_bytes BIGINT NOT NULL,
                    row_count INT NOT NULL,
                    column_list VARCHAR NOT NULL,
                    date_range_start VARCHAR,
                    date_range_end VARCHAR,
                    uploaded_by BIGINT,
                    created_at BIGINT NOT NULL,
                    active BOOLEAN NOT NULL
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_data_file_active_created ON data_file(active, created_at)");
    }
}
