package com.calldash.calldash.data;

/**
 * Raised when the merged dataset cannot be built at all, for example when the registry is unreachable.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
