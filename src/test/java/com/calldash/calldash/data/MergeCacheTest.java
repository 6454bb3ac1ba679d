package com.calldash.calldash.data;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class MergeCacheTest {

    private final MergeCache mergeCache = new MergeCache();

    @Test
    void shouldInstallRebuiltDataset() {
        Dataset dataset = Dataset.fromMaps(List.of(Map.of("a", "1")));

        assertSame(dataset, mergeCache.getOrRebuild(() -> dataset));
        assertSame(dataset, mergeCache.get());
    }

    @Test
    void shouldReturnButNotInstallRebuildOverlappingInvalidation() {
        Dataset stale = Dataset.fromMaps(List.of(Map.of("a", "1")));

        Dataset returned = mergeCache.rebuild(() -> {
            mergeCache.invalidate();
            return stale;
        });

        assertSame(stale, returned);
        assertNull(mergeCache.get());
    }

    @Test
    void shouldKeepNewerInstallOverSlowerRebuild() {
        Dataset newer = Dataset.fromMaps(List.of(Map.of("a", "2")));
        Dataset slower = Dataset.fromMaps(List.of(Map.of("a", "1")));

        mergeCache.rebuild(() -> {
            mergeCache.invalidate();
            mergeCache.rebuild(() -> newer);
            return slower;
        });

        assertSame(newer, mergeCache.get());
    }
}
