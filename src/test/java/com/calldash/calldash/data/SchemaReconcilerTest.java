package com.calldash.calldash.data;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaReconcilerTest {

    private final SchemaReconciler reconciler = new SchemaReconciler();

    @Test
    void shouldReportAddedAndMissingColumns() {
        SchemaDiff diff = reconciler.diff(List.of("x", "y"), List.of("y", "z"));

        assertEquals(List.of("z"), diff.newColumns());
        assertEquals(List.of("x"), diff.missingColumns());
        assertTrue(diff.hasChanges());
    }

    @Test
    void shouldReportNoChangesForSameColumnsInDifferentOrder() {
        SchemaDiff diff = reconciler.diff(List.of("a", "b", "c"), List.of("c", "a", "b"));

        assertFalse(diff.hasChanges());
        assertTrue(diff.newColumns().isEmpty());
        assertTrue(diff.missingColumns().isEmpty());
    }

    @Test
    void shouldAppendNewColumnsWithoutReorderingExistingOnes() {
        List<String> union = reconciler.union(List.of("CallerID", "CallerState"), List.of("CallerCity", "CallerID", "Duration"));

        assertEquals(List.of("CallerID", "CallerState", "CallerCity", "Duration"), union);
    }
}
