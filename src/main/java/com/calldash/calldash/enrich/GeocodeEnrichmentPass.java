package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Row;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Sets {@code Latitude}/{@code Longitude} to the centre of the caller's state, null when unknown.
 */
@Component
public class GeocodeEnrichmentPass implements EnrichmentPass {

    @Override
    public String type() {
        return EnrichmentConstants.TYPE_GEOCODE;
    }

    @Override
    public List<String> ownedColumns() {
        return List.of(EnrichmentConstants.COLUMN_LATITUDE, EnrichmentConstants.COLUMN_LONGITUDE);
    }

    @Override
    public RowEnricher begin(List<Row> rows) {
        return row -> {
            String state = RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_STATE);
            ReferenceTables.Coordinates coordinates =
                    ReferenceTables.coordinatesForState(state == null ? null : state.toUpperCase(Locale.ROOT));
            row.put(EnrichmentConstants.COLUMN_LATITUDE, coordinates == null ? null : coordinates.latitude());
            row.put(EnrichmentConstants.COLUMN_LONGITUDE, coordinates == null ? null : coordinates.longitude());
            return coordinates != null;
        };
    }

    @Override
    public String message(int enrichedCount) {
        return "Added coordinates for %d records".formatted(enrichedCount);
    }
}
