package com.calldash.calldash.enrich.boe;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Enables BOE configuration and provides the bounded HTTP client used to reach it.
 */
@Configuration
@EnableConfigurationProperties(BoeProperties.class)
public class BoeConfig {

    @Bean
    public RestTemplate boeRestTemplate(RestTemplateBuilder builder, BoeProperties boeProperties) {
        return builder
                .setConnectTimeout(boeProperties.getConnectTimeout())
                .setReadTimeout(boeProperties.getReadTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
