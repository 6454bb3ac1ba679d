package com.calldash.calldash.enrich.boe;

/**
 * An outbound reference-data source could not be reached or returned an unusable payload.
 */
public class ExternalFetchException extends RuntimeException {

    public ExternalFetchException(String message) {
        super(message);
    }

    public ExternalFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
