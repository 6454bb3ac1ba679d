package com.calldash.calldash.data;

/**
 * Raised when a call-log file cannot be decoded or parsed as delimited text.
 */
public class TabularParseException extends RuntimeException {

    public TabularParseException(String message) {
        super(message);
    }

    public TabularParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
