package com.calldash.calldash.data;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of call-data configuration properties.
 */
@Configuration
@EnableConfigurationProperties(CallDataProperties.class)
public class CallDataConfig {
}
