package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Row;
import com.calldash.calldash.enrich.boe.BoeReferenceCache;
import com.calldash.calldash.enrich.boe.BoeReferenceData;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Adds a Zillow search link for rows with an address and a county assessor link for California callers.
 * Counties already on the row are used first; BOE data is fetched only for California rows without one.
 */
@Component
public class PropertyLinksEnrichmentPass implements EnrichmentPass {

    private final BoeReferenceCache boeReferenceCache;

    public PropertyLinksEnrichmentPass(BoeReferenceCache boeReferenceCache) {
        this.boeReferenceCache = boeReferenceCache;
    }

    @Override
    public String type() {
        return EnrichmentConstants.TYPE_PROPERTY_LINKS;
    }

    @Override
    public List<String> ownedColumns() {
        return List.of(EnrichmentConstants.COLUMN_ZILLOW_LINK, EnrichmentConstants.COLUMN_COUNTY_ASSESSOR_LINK);
    }

    @Override
    public RowEnricher begin(List<Row> rows) {
        boolean needsBoe = rows.stream()
                .map(Row::asMap)
                .anyMatch(row -> RowValues.isCalifornia(row)
                        && RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_COUNTY) == null);
        BoeReferenceData boe = needsBoe ? boeReferenceCache.get() : null;

        return row -> {
            boolean hasAddress = false;
            String zillowLink = zillowLink(row);
            if (zillowLink != null) {
                row.put(EnrichmentConstants.COLUMN_ZILLOW_LINK, zillowLink);
                hasAddress = true;
            }

            if (RowValues.isCalifornia(row)) {
                String county = RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_COUNTY);
                if (county == null && boe != null) {
                    county = boe.countyForCity(RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_CITY));
                }
                String assessorUrl = ReferenceTables.assessorUrlForCounty(county);
                if (assessorUrl != null) {
                    row.put(EnrichmentConstants.COLUMN_CALLER_COUNTY, county);
                    row.put(EnrichmentConstants.COLUMN_COUNTY_ASSESSOR_LINK, assessorUrl);
                }
            }
            return hasAddress;
        };
    }

    @Override
    public String message(int enrichedCount) {
        return "Added property links for %d records with addresses".formatted(enrichedCount);
    }

    static String zillowLink(Map<String, Object> row) {
        String address = RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_ADDRESS);
        if (!RowValues.isResolved(address)) {
            return null;
        }
        String query = "%s, %s, %s %s".formatted(
                address,
                nullToEmpty(RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_CITY)),
                nullToEmpty(RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_STATE)),
                nullToEmpty(RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_ZIP))
        ).trim();
        return EnrichmentConstants.ZILLOW_SEARCH_URL.formatted(UriUtils.encode(query, StandardCharsets.UTF_8));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
