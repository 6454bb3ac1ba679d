package com.calldash.calldash.data;

import java.util.List;

public final class DataModels {

    private DataModels() {
    }

    public record UploadResponse(DataFile file, SchemaDiff schemaDiff) {
    }

    public record MergedDataResponse(List<Row> rows, List<String> columns, List<DataFile> files) {

        public static MergedDataResponse of(Dataset dataset) {
            return new MergedDataResponse(dataset.rows(), dataset.columns(), dataset.sourceFiles());
        }
    }

    public record RemoveFileResponse(DataFile file, boolean storedContentDeleted) {
    }
}
