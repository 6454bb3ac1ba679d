package com.calldash.calldash.data;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes column unions and schema drift between call-log files.
 */
@Component
public class SchemaReconciler {

    /**
     * Compares an incoming column list against the existing union.
     */
    public SchemaDiff diff(List<String> existing, List<String> incoming) {
        Set<String> existingSet = new LinkedHashSet<>(existing);
        Set<String> incomingSet = new LinkedHashSet<>(incoming);

        List<String> added = new ArrayList<>();
        for (String column : incomingSet) {
            if (!existingSet.contains(column)) {
                added.add(column);
            }
        }

        List<String> missing = new ArrayList<>();
        for (String column : existingSet) {
            if (!incomingSet.contains(column)) {
                missing.add(column);
            }
        }

        return new SchemaDiff(added, missing, !added.isEmpty() || !missing.isEmpty());
    }

    /**
     * Returns {@code existing} followed by every unseen incoming column, in first-seen order.
     */
    public List<String> union(List<String> existing, Collection<String> incoming) {
        Set<String> merged = new LinkedHashSet<>(existing);
        merged.addAll(incoming);
        return new ArrayList<>(merged);
    }
}
