package com.calldash.calldash.enrich;

/**
 * Column names read and written by the enrichment passes.
 */
public final class EnrichmentConstants {

    private EnrichmentConstants() {
    }

    public static final String COLUMN_CALLER_ID = "CallerID";
    public static final String COLUMN_CALLER_STATE = "CallerState";
    public static final String COLUMN_CALLER_CITY = "CallerCity";
    public static final String COLUMN_CALLER_ZIP = "CallerZip";
    public static final String COLUMN_CALLER_ADDRESS = "CallerAddress";
    public static final String COLUMN_CALLER_CARRIER = "CallerCarrier";
    public static final String COLUMN_CALLER_COUNTY = "CallerCounty";
    public static final String COLUMN_CALLER_TIMEZONE = "CallerTimezone";
    public static final String COLUMN_LATITUDE = "Latitude";
    public static final String COLUMN_LONGITUDE = "Longitude";
    public static final String COLUMN_PROPERTY_TAX_RATE = "PropertyTaxRate";
    public static final String COLUMN_COUNTY_ASSESSED_VALUE = "CountyAssessedValue";
    public static final String COLUMN_TAX_DATA_YEAR = "TaxDataYear";
    public static final String COLUMN_ZILLOW_LINK = "ZillowLink";
    public static final String COLUMN_COUNTY_ASSESSOR_LINK = "CountyAssessorLink";

    public static final String NOT_FOUND = "Not Found";
    public static final String UNKNOWN_CARRIER = "Unknown Carrier";
    public static final String STATE_CALIFORNIA = "CA";
    public static final String ZILLOW_SEARCH_URL = "https://www.zillow.com/homes/%s_rb/";

    public static final String TYPE_CARRIER = "carrier";
    public static final String TYPE_GEOCODE = "geocode";
    public static final String TYPE_TIMEZONE = "timezone";
    public static final String TYPE_PROPERTY_TAX = "property-tax";
    public static final String TYPE_PROPERTY_LINKS = "property-links";
}
