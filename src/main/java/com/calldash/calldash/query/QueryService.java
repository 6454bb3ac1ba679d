package com.calldash.calldash.query;

import com.calldash.calldash.data.Dataset;
import com.calldash.calldash.data.IngestionService;
import com.calldash.calldash.data.Row;
import com.calldash.calldash.data.WorkingViewCache;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers queries against the caller's working view, or the merged dataset when the caller has none.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final QueryEngine queryEngine;
    private final QueryTranslator queryTranslator;
    private final IngestionService ingestionService;
    private final WorkingViewCache workingViewCache;

    public QueryService(
            QueryEngine queryEngine,
            QueryTranslator queryTranslator,
            IngestionService ingestionService,
            WorkingViewCache workingViewCache
    ) {
        this.queryEngine = queryEngine;
        this.queryTranslator = queryTranslator;
        this.ingestionService = ingestionService;
        this.workingViewCache = workingViewCache;
    }

    public QueryModels.QueryResponse ask(String message, long userId) {
        if (message == null || message.isBlank()) {
            throw new QueryValidationException(QueryConstants.MSG_MESSAGE_REQUIRED);
        }
        Dataset view = currentView(userId);
        QueryModels.QuerySpecification spec = queryTranslator.translate(message.trim(), view.columns());
        QueryModels.QueryResponse response = queryEngine.execute(view, spec);
        log.info("Natural language query answered. resultCount={}, explanation={}", response.resultCount(), spec.explanation());
        return response;
    }

    public QueryModels.QueryResponse execute(QueryModels.QuerySpecification spec, long userId) {
        return queryEngine.execute(currentView(userId), spec);
    }

    /**
     * Writes every row matching {@code spec} as CSV with the dataset's columns as header.
     */
    public String exportCsv(QueryModels.QuerySpecification spec, long userId) {
        Dataset view = currentView(userId);
        List<Row> matches = queryEngine.select(view, spec);

        StringWriter writer = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(view.columns().toArray(new String[0]))
                .build();
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Row row : matches) {
                List<Object> record = new ArrayList<>(view.columns().size());
                for (String column : view.columns()) {
                    record.add(row.get(column));
                }
                printer.printRecord(record);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        log.info("Exported {} rows as CSV", matches.size());
        return writer.toString();
    }

    private Dataset currentView(long userId) {
        return workingViewCache.get(userId).orElseGet(() -> ingestionService.loadAll(false));
    }
}
