package com.calldash.calldash.enrich.boe;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * One snapshot of BOE reference maps. Keys are upper-cased city or county names.
 */
public record BoeReferenceData(
        Map<String, String> cityToCounty,
        Map<String, Number> cityAssessedValues,
        Map<String, CountyTaxInfo> countyTaxRates,
        Instant fetchedAt
) {

    public BoeReferenceData {
        cityToCounty = Map.copyOf(cityToCounty);
        cityAssessedValues = Map.copyOf(cityAssessedValues);
        countyTaxRates = Map.copyOf(countyTaxRates);
    }

    public String countyForCity(String city) {
        return city == null ? null : cityToCounty.get(key(city));
    }

    public CountyTaxInfo taxInfoForCounty(String county) {
        return county == null ? null : countyTaxRates.get(key(county));
    }

    static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
