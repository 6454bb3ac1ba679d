package com.calldash.calldash.query;

/**
 * A query specification that cannot be executed against the current dataset.
 */
public class QueryValidationException extends IllegalArgumentException {

    public QueryValidationException(String message) {
        super(message);
    }
}
