package com.calldash.calldash.enrich.boe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide BOE snapshot, refetched once it is older than {@code boe.cache-ttl}.
 * Concurrent refreshes may race; the last one to finish wins.
 */
@Component
public class BoeReferenceCache {

    private static final Logger log = LoggerFactory.getLogger(BoeReferenceCache.class);

    private final BoeDataClient boeDataClient;
    private final BoeProperties boeProperties;
    private final Clock clock;
    private final AtomicReference<BoeReferenceData> current = new AtomicReference<>();

    public BoeReferenceCache(BoeDataClient boeDataClient, BoeProperties boeProperties, Clock clock) {
        this.boeDataClient = boeDataClient;
        this.boeProperties = boeProperties;
        this.clock = clock;
    }

    /**
     * Returns a fresh snapshot, fetching both feeds when the cached one has expired.
     *
     * @throws ExternalFetchException when the fetch fails and no usable older snapshot exists
     */
    public BoeReferenceData get() {
        BoeReferenceData cached = current.get();
        Instant now = clock.instant();
        if (cached != null && isFresh(cached, now)) {
            return cached;
        }

        try {
            BoeReferenceData refreshed = fetch(now);
            current.set(refreshed);
            log.info("Cached BOE data for {} cities, {} counties",
                    refreshed.cityToCounty().size(), refreshed.countyTaxRates().size());
            return refreshed;
        } catch (ExternalFetchException ex) {
            if (cached != null && boeProperties.isServeStaleOnFailure()) {
                log.warn("BOE refresh failed, serving data fetched at {}: {}", cached.fetchedAt(), ex.getMessage());
                return cached;
            }
            throw ex;
        }
    }

    public void invalidate() {
        current.set(null);
    }

    private boolean isFresh(BoeReferenceData data, Instant now) {
        Duration age = Duration.between(data.fetchedAt(), now);
        return age.compareTo(boeProperties.getCacheTtl()) < 0;
    }

    private BoeReferenceData fetch(Instant now) {
        log.info("Fetching CA BOE reference data");
        List<CityValuation> cities = boeDataClient.fetchCityValuations();
        List<CountyTaxAllocation> counties = boeDataClient.fetchCountyTaxAllocations();

        Map<String, String> cityToCounty = new HashMap<>();
        Map<String, Number> cityValues = new HashMap<>();
        for (CityValuation city : cities) {
            if (city.city() == null || city.county() == null) {
                continue;
            }
            String key = BoeReferenceData.key(city.city());
            if (cityToCounty.putIfAbsent(key, city.county()) == null && city.locallyAssessedValue() != null) {
                cityValues.put(key, city.locallyAssessedValue());
            }
        }

        Map<String, CountyTaxInfo> taxRates = new HashMap<>();
        for (CountyTaxAllocation county : counties) {
            if (county.county() == null) {
                continue;
            }
            taxRates.putIfAbsent(BoeReferenceData.key(county.county()), new CountyTaxInfo(
                    county.averageTaxRate(),
                    county.netTaxableAssessedValue(),
                    county.totalLevies(),
                    county.assessmentYearFrom() + "-" + county.assessmentYearTo()
            ));
        }

        return new BoeReferenceData(cityToCounty, cityValues, taxRates, now);
    }
}
