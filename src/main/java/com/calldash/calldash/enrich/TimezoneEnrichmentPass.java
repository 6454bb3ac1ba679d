package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Row;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class TimezoneEnrichmentPass implements EnrichmentPass {

    @Override
    public String type() {
        return EnrichmentConstants.TYPE_TIMEZONE;
    }

    @Override
    public List<String> ownedColumns() {
        return List.of(EnrichmentConstants.COLUMN_CALLER_TIMEZONE);
    }

    @Override
    public RowEnricher begin(List<Row> rows) {
        return row -> {
            String state = RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_STATE);
            String timezone = ReferenceTables.timezoneForState(state == null ? null : state.toUpperCase(Locale.ROOT));
            row.put(EnrichmentConstants.COLUMN_CALLER_TIMEZONE, timezone);
            return timezone != null;
        };
    }

    @Override
    public String message(int enrichedCount) {
        return "Added timezone for %d records".formatted(enrichedCount);
    }
}
