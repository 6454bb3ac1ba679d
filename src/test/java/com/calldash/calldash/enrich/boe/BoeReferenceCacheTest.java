package com.calldash.calldash.enrich.boe;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BoeReferenceCacheTest {

    private StubBoeDataClient client;
    private BoeProperties properties;
    private MutableClock clock;
    private BoeReferenceCache cache;

    @BeforeEach
    void setUp() {
        client = new StubBoeDataClient()
                .withCity("Fresno", "Fresno", 500)
                .withCity("FRESNO", "Madera", 400)
                .withCounty("Fresno", 1.1, 100, "2023", "2024")
                .withCounty("Fresno", 1.0, 90, "2022", "2023");
        properties = new BoeProperties();
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        cache = new BoeReferenceCache(client, properties, clock);
    }

    @Test
    void shouldKeepFirstRecordPerUppercasedKey() {
        BoeReferenceData data = cache.get();

        assertEquals("Fresno", data.countyForCity("fresno"));
        assertEquals(500, data.cityAssessedValues().get("FRESNO"));
        CountyTaxInfo taxInfo = data.taxInfoForCounty("FRESNO");
        assertEquals(1.1, taxInfo.averageTaxRate());
        assertEquals("2023-2024", taxInfo.year());
    }

    @Test
    void shouldServeCachedDataWithinTtlAndRefetchAfterIt() {
        BoeReferenceData first = cache.get();
        clock.advance(Duration.ofHours(23));
        assertSame(first, cache.get());
        assertEquals(1, client.fetchCount());

        clock.advance(Duration.ofHours(2));
        cache.get();
        assertEquals(2, client.fetchCount());
    }

    @Test
    void shouldPropagateFailureWhenNothingIsCached() {
        client.failing(true);

        assertThrows(ExternalFetchException.class, () -> cache.get());
    }

    @Test
    void shouldServeStaleDataWhenRefreshFails() {
        BoeReferenceData first = cache.get();
        clock.advance(Duration.ofDays(2));
        client.failing(true);

        assertSame(first, cache.get());
    }

    @Test
    void shouldFailRefreshWhenStaleServingIsDisabled() {
        properties.setServeStaleOnFailure(false);
        cache.get();
        clock.advance(Duration.ofDays(2));
        client.failing(true);

        assertThrows(ExternalFetchException.class, () -> cache.get());
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
