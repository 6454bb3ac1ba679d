package com.calldash.calldash.enrich.boe;

/**
 * Latest-year tax figures for one county; {@code year} reads {@code from-to}.
 */
public record CountyTaxInfo(Number averageTaxRate, Number netAssessedValue, Number totalLevies, String year) {
}
