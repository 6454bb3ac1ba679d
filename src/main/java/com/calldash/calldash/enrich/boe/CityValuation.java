package com.calldash.calldash.enrich.boe;

/**
 * One row of the assessed-property-values-by-city feed.
 */
public record CityValuation(String city, String county, Number locallyAssessedValue) {
}
