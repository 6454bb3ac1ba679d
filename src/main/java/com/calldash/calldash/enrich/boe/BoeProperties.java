package com.calldash.calldash.enrich.boe;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * BOE fetch and cache settings bound from {@code boe.*}.
 */
@ConfigurationProperties(prefix = "boe")
public class BoeProperties {

    private String cityUrl = BoeConstants.DEFAULT_CITY_URL;
    private String taxUrl = BoeConstants.DEFAULT_TAX_URL;
    private Duration cacheTtl = BoeConstants.DEFAULT_CACHE_TTL;
    private Duration connectTimeout = BoeConstants.DEFAULT_CONNECT_TIMEOUT;
    private Duration readTimeout = BoeConstants.DEFAULT_READ_TIMEOUT;
    private int pageSize = BoeConstants.DEFAULT_PAGE_SIZE;
    private int cityMaxRecords = BoeConstants.DEFAULT_CITY_MAX_RECORDS;
    private int countyMaxRecords = BoeConstants.DEFAULT_COUNTY_MAX_RECORDS;
    private boolean serveStaleOnFailure = true;

    public String getCityUrl() {
        return cityUrl;
    }

    public void setCityUrl(String cityUrl) {
        this.cityUrl = cityUrl;
    }

    public String getTaxUrl() {
        return taxUrl;
    }

    public void setTaxUrl(String taxUrl) {
        this.taxUrl = taxUrl;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getCityMaxRecords() {
        return cityMaxRecords;
    }

    public void setCityMaxRecords(int cityMaxRecords) {
        this.cityMaxRecords = cityMaxRecords;
    }

    public int getCountyMaxRecords() {
        return countyMaxRecords;
    }

    public void setCountyMaxRecords(int countyMaxRecords) {
        this.countyMaxRecords = countyMaxRecords;
    }

    /**
     * When a refresh fails and an older snapshot exists, serve the older snapshot instead of failing.
     */
    public boolean isServeStaleOnFailure() {
        return serveStaleOnFailure;
    }

    public void setServeStaleOnFailure(boolean serveStaleOnFailure) {
        this.serveStaleOnFailure = serveStaleOnFailure;
    }
}
