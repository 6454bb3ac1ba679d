package com.calldash.calldash.data;

/**
 * Raised when stored call-log bytes cannot be written, read or removed.
 */
public class DataFileStoreException extends RuntimeException {

    public DataFileStoreException(String message) {
        super(message);
    }

    public DataFileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
