package com.calldash.calldash.enrich.boe;

import java.util.List;

/**
 * Source of California Board of Equalization reference records, newest assessment year first.
 */
public interface BoeDataClient {

    /**
     * @throws ExternalFetchException when the feed cannot be read
     */
    List<CityValuation> fetchCityValuations();

    /**
     * @throws ExternalFetchException when the feed cannot be read
     */
    List<CountyTaxAllocation> fetchCountyTaxAllocations();
}
