package com.calldash.calldash.enrich.boe;

import java.time.Duration;

/**
 * Defaults and field names for the California Board of Equalization open-data feeds.
 */
public final class BoeConstants {

    private BoeConstants() {
    }

    public static final String DEFAULT_CITY_URL =
            "https://boe.ca.gov/DataPortal/api/odata/Assessed_Property_Values_by_City";
    public static final String DEFAULT_TAX_URL =
            "https://boe.ca.gov/DataPortal/api/odata/Property_Tax_Allocations";
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final int DEFAULT_CITY_MAX_RECORDS = 5000;
    public static final int DEFAULT_COUNTY_MAX_RECORDS = 200;

    public static final String PARAM_ORDER_BY = "$orderby";
    public static final String PARAM_TOP = "$top";
    public static final String PARAM_SKIP = "$skip";
    public static final String ORDER_LATEST_YEAR_FIRST = "AssessmentYearTo desc";

    public static final String FIELD_VALUE = "value";
    public static final String FIELD_CITY = "City";
    public static final String FIELD_COUNTY = "County";
    public static final String FIELD_LOCALLY_ASSESSED_VALUE = "LocallyAssessedValue";
    public static final String FIELD_AVERAGE_TAX_RATE = "AverageTaxRate";
    public static final String FIELD_NET_TAXABLE_ASSESSED_VALUE = "NetTaxableAssessedValue";
    public static final String FIELD_TOTAL_LEVIES = "TotalPropertyTaxAllocationsandLevies";
    public static final String FIELD_YEAR_FROM = "AssessmentYearFrom";
    public static final String FIELD_YEAR_TO = "AssessmentYearTo";

    public static final String MSG_FETCH_FAILED = "Failed to fetch BOE data from %s";
    public static final String MSG_BAD_PAYLOAD = "Unexpected BOE response from %s: missing '" + FIELD_VALUE + "' array";
}
