package com.calldash.calldash.query;

import java.util.List;

/**
 * Turns a free-text question into a structured query over the given columns.
 */
public interface QueryTranslator {

    QueryModels.QuerySpecification translate(String message, List<String> availableColumns);
}
