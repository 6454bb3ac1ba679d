package com.calldash.calldash;

import com.calldash.calldash.enrich.boe.StubBoeDataClient;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Replaces the outbound BOE client so integration tests never reach the network.
 */
@TestConfiguration
public class CallDashTestConfig {

    @Bean
    @Primary
    StubBoeDataClient stubBoeDataClient() {
        return new StubBoeDataClient()
                .withCity("Fresno", "Fresno", 1_000_000)
                .withCity("Los Angeles", "Los Angeles", 9_000_000)
                .withCounty("Fresno", 1.1, 90_000_000L, "2023", "2024")
                .withCounty("Los Angeles", 1.2, 2_000_000_000L, "2023", "2024");
    }
}
