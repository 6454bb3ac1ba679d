package com.calldash.calldash.enrich.boe;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the BOE OData feeds page by page, newest assessment year first, up to the configured record caps.
 */
@Component
public class HttpBoeDataClient implements BoeDataClient {

    private static final Logger log = LoggerFactory.getLogger(HttpBoeDataClient.class);

    private final RestTemplate restTemplate;
    private final BoeProperties boeProperties;

    public HttpBoeDataClient(RestTemplate restTemplate, BoeProperties boeProperties) {
        this.restTemplate = restTemplate;
        this.boeProperties = boeProperties;
    }

    @Override
    public List<CityValuation> fetchCityValuations() {
        List<JsonNode> records = fetchPaged(boeProperties.getCityUrl(), boeProperties.getCityMaxRecords());
        List<CityValuation> valuations = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            String city = text(record, BoeConstants.FIELD_CITY);
            if (city == null || city.isBlank()) {
                continue;
            }
            valuations.add(new CityValuation(
                    city,
                    text(record, BoeConstants.FIELD_COUNTY),
                    number(record, BoeConstants.FIELD_LOCALLY_ASSESSED_VALUE)
            ));
        }
        return valuations;
    }

    @Override
    public List<CountyTaxAllocation> fetchCountyTaxAllocations() {
        List<JsonNode> records = fetchPaged(boeProperties.getTaxUrl(), boeProperties.getCountyMaxRecords());
        List<CountyTaxAllocation> allocations = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            String county = text(record, BoeConstants.FIELD_COUNTY);
            if (county == null || county.isBlank()) {
                continue;
            }
            allocations.add(new CountyTaxAllocation(
                    county,
                    number(record, BoeConstants.FIELD_AVERAGE_TAX_RATE),
                    number(record, BoeConstants.FIELD_NET_TAXABLE_ASSESSED_VALUE),
                    number(record, BoeConstants.FIELD_TOTAL_LEVIES),
                    text(record, BoeConstants.FIELD_YEAR_FROM),
                    text(record, BoeConstants.FIELD_YEAR_TO)
            ));
        }
        return allocations;
    }

    private List<JsonNode> fetchPaged(String url, int maxRecords) {
        int pageSize = Math.max(1, boeProperties.getPageSize());
        List<JsonNode> records = new ArrayList<>();
        while (records.size() < maxRecords) {
            int top = Math.min(pageSize, maxRecords - records.size());
            URI uri = UriComponentsBuilder.fromHttpUrl(url)
                    .queryParam(BoeConstants.PARAM_ORDER_BY, BoeConstants.ORDER_LATEST_YEAR_FIRST)
                    .queryParam(BoeConstants.PARAM_TOP, top)
                    .queryParam(BoeConstants.PARAM_SKIP, records.size())
                    .encode()
                    .build()
                    .toUri();

            JsonNode body;
            try {
                body = restTemplate.getForObject(uri, JsonNode.class);
            } catch (RestClientException ex) {
                throw new ExternalFetchException(BoeConstants.MSG_FETCH_FAILED.formatted(url), ex);
            }

            JsonNode page = body == null ? null : body.get(BoeConstants.FIELD_VALUE);
            if (page == null || !page.isArray()) {
                throw new ExternalFetchException(BoeConstants.MSG_BAD_PAYLOAD.formatted(url));
            }
            page.forEach(records::add);
            log.debug("Fetched {} BOE records from {} (skip={})", page.size(), url, records.size() - page.size());
            if (page.size() < top) {
                break;
            }
        }
        return records;
    }

    private String text(JsonNode record, String field) {
        JsonNode node = record.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private Number number(JsonNode record, String field) {
        JsonNode node = record.get(field);
        return node != null && node.isNumber() ? node.numberValue() : null;
    }
}
