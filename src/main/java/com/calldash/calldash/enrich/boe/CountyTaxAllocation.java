package com.calldash.calldash.enrich.boe;

/**
 * One row of the property-tax-allocations feed.
 */
public record CountyTaxAllocation(
        String county,
        Number averageTaxRate,
        Number netTaxableAssessedValue,
        Number totalLevies,
        String assessmentYearFrom,
        String assessmentYearTo
) {
}
