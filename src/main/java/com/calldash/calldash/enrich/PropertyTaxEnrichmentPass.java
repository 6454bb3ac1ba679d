package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Row;
import com.calldash.calldash.enrich.boe.BoeReferenceCache;
import com.calldash.calldash.enrich.boe.BoeReferenceData;
import com.calldash.calldash.enrich.boe.CountyTaxInfo;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves county and county tax figures for California callers from BOE data.
 * The BOE feeds are only consulted when the rows contain a California caller.
 */
@Component
public class PropertyTaxEnrichmentPass implements EnrichmentPass {

    private final BoeReferenceCache boeReferenceCache;

    public PropertyTaxEnrichmentPass(BoeReferenceCache boeReferenceCache) {
        this.boeReferenceCache = boeReferenceCache;
    }

    @Override
    public String type() {
        return EnrichmentConstants.TYPE_PROPERTY_TAX;
    }

    @Override
    public List<String> ownedColumns() {
        return List.of(
                EnrichmentConstants.COLUMN_CALLER_COUNTY,
                EnrichmentConstants.COLUMN_PROPERTY_TAX_RATE,
                EnrichmentConstants.COLUMN_COUNTY_ASSESSED_VALUE,
                EnrichmentConstants.COLUMN_TAX_DATA_YEAR
        );
    }

    @Override
    public RowEnricher begin(List<Row> rows) {
        boolean anyCalifornia = rows.stream().anyMatch(row -> RowValues.isCalifornia(row.asMap()));
        if (!anyCalifornia) {
            return row -> false;
        }
        BoeReferenceData boe = boeReferenceCache.get();
        return row -> {
            if (!RowValues.isCalifornia(row)) {
                return false;
            }
            String county = boe.countyForCity(RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_CITY));
            if (county != null) {
                row.put(EnrichmentConstants.COLUMN_CALLER_COUNTY, county);
            } else {
                county = RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_COUNTY);
            }

            CountyTaxInfo taxInfo = boe.taxInfoForCounty(county);
            row.put(EnrichmentConstants.COLUMN_PROPERTY_TAX_RATE, taxInfo == null ? null : taxInfo.averageTaxRate());
            row.put(EnrichmentConstants.COLUMN_COUNTY_ASSESSED_VALUE, taxInfo == null ? null : taxInfo.netAssessedValue());
            row.put(EnrichmentConstants.COLUMN_TAX_DATA_YEAR, taxInfo == null ? null : taxInfo.year());
            return taxInfo != null;
        };
    }

    @Override
    public String message(int enrichedCount) {
        return "Added CA property tax data for %d records (CA callers only)".formatted(enrichedCount);
    }
}
