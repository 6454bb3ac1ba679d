package com.calldash.calldash.data;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionServiceTest {

    private FileRegistry fileRegistry;
    private DataFileStore dataFileStore;
    private MergeCache mergeCache;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        fileRegistry = mock(FileRegistry.class);
        dataFileStore = mock(DataFileStore.class);
        mergeCache = new MergeCache();
        ingestionService = new IngestionService(
                fileRegistry,
                dataFileStore,
                new TabularParser(),
                new SchemaReconciler(),
                mergeCache
        );
    }

    @Test
    void shouldMergeFilesIntoColumnUnionWithNullsForAbsentColumns() {
        DataFile fileA = file(1L, "a.csv", 100L);
        DataFile fileB = file(2L, "b.csv", 200L);
        when(fileRegistry.listActive()).thenReturn(List.of(fileA, fileB));
        stored(fileA, "x,y\n1,2\n3,4\n");
        stored(fileB, "y,z\n5,6\n");

        Dataset merged = ingestionService.loadAll(false);

        assertEquals(List.of("x", "y", "z", CallDataConstants.COLUMN_SOURCE_FILE, CallDataConstants.COLUMN_SOURCE_FILE_ID),
                merged.columns());
        assertEquals(3, merged.rows().size());
        for (Row row : merged.rows()) {
            assertEquals(merged.columns(), new ArrayList<>(row.columns()));
        }
        assertNull(merged.rows().get(0).get("z"));
        assertEquals("a.csv", merged.rows().get(0).get(CallDataConstants.COLUMN_SOURCE_FILE));
        assertEquals(1L, merged.rows().get(0).get(CallDataConstants.COLUMN_SOURCE_FILE_ID));
        assertNull(merged.rows().get(2).get("x"));
        assertEquals("6", merged.rows().get(2).get("z"));
        assertEquals(2L, merged.rows().get(2).get(CallDataConstants.COLUMN_SOURCE_FILE_ID));
        assertEquals(List.of(fileA, fileB), merged.sourceFiles());
    }

    @Test
    void shouldReparseOnlyOncePerCacheEpoch() {
        DataFile fileA = file(1L, "a.csv", 100L);
        when(fileRegistry.listActive()).thenReturn(List.of(fileA));
        stored(fileA, "x\n1\n");

        Dataset first = ingestionService.loadAll(false);
        Dataset second = ingestionService.loadAll(false);
        assertSame(first, second);
        verify(dataFileStore, times(1)).read("stored-1");

        mergeCache.invalidate();
        ingestionService.loadAll(false);
        verify(dataFileStore, times(2)).read("stored-1");

        ingestionService.loadAll(true);
        verify(dataFileStore, times(3)).read("stored-1");
    }

    @Test
    void shouldKeepColumnOrderAcrossRebuilds() {
        DataFile fileA = file(1L, "a.csv", 100L);
        DataFile fileB = file(2L, "b.csv", 200L);
        when(fileRegistry.listActive()).thenReturn(List.of(fileA, fileB));
        stored(fileA, "CallerID,CallerState\n1,CA\n");
        stored(fileB, "CallerCity,CallerID\nFresno,2\n");

        List<String> first = ingestionService.loadAll(true).columns();
        List<String> second = ingestionService.loadAll(true).columns();

        assertEquals(first, second);
        assertEquals(List.of("CallerID", "CallerState", "CallerCity"), first.subList(0, 3));
    }

    @Test
    void shouldSkipUnreadableFileAndKeepTheRest() {
        DataFile broken = file(1L, "broken.csv", 100L);
        DataFile good = file(2L, "good.csv", 200L);
        when(fileRegistry.listActive()).thenReturn(List.of(broken, good));
        when(dataFileStore.read("stored-1")).thenReturn(new byte[] {(byte) 0xC3, (byte) 0x28});
        stored(good, "CallerID\n42\n");

        Dataset merged = ingestionService.loadAll(false);

        assertEquals(1, merged.rows().size());
        assertEquals("42", merged.rows().get(0).get("CallerID"));
        assertEquals(List.of(good), merged.sourceFiles());
    }

    @Test
    void shouldSkipFileWhoseStoredBytesAreGone() {
        DataFile missing = file(1L, "missing.csv", 100L);
        when(fileRegistry.listActive()).thenReturn(List.of(missing));
        when(dataFileStore.read("stored-1")).thenThrow(new DataFileStoreException("gone"));

        Dataset merged = ingestionService.loadAll(false);

        assertTrue(merged.rows().isEmpty());
    }

    @Test
    void shouldRestoreIdenticalDatasetAfterSoftDeleteAndRestore() {
        DataFile fileA = file(1L, "a.csv", 100L);
        DataFile fileB = file(2L, "b.csv", 200L);
        stored(fileA, "x,y\n1,2\n");
        stored(fileB, "y,z\n3,4\n");

        when(fileRegistry.listActive()).thenReturn(List.of(fileA, fileB));
        Dataset before = ingestionService.loadAll(true);

        when(fileRegistry.listActive()).thenReturn(List.of(fileB));
        Dataset withoutA = ingestionService.loadAll(true);
        assertEquals(1, withoutA.rows().size());

        when(fileRegistry.listActive()).thenReturn(List.of(fileA, fileB));
        Dataset after = ingestionService.loadAll(true);

        assertEquals(before.columns(), after.columns());
        assertEquals(new HashSet<>(before.rows()), new HashSet<>(after.rows()));
    }

    @Test
    void shouldFallBackToDefaultFileWhenNoFilesAreActive() {
        when(fileRegistry.listActive()).thenReturn(List.of());
        when(dataFileStore.readDefaultFile()).thenReturn(Optional.of(
                new DataFileStore.StoredContent("default.csv", "CallerID\n7\n".getBytes(StandardCharsets.UTF_8))
        ));

        Dataset merged = ingestionService.loadAll(false);

        assertEquals(1, merged.rows().size());
        assertEquals("default.csv", merged.rows().get(0).get(CallDataConstants.COLUMN_SOURCE_FILE));
        assertNull(merged.rows().get(0).get(CallDataConstants.COLUMN_SOURCE_FILE_ID));
    }

    @Test
    void shouldReturnEmptyDatasetWhenNothingIsRegistered() {
        when(fileRegistry.listActive()).thenReturn(List.of());

        Dataset merged = ingestionService.loadAll(false);

        assertTrue(merged.isEmpty());
    }

    @Test
    void shouldSurfaceRegistryFailureAsIngestionError() {
        when(fileRegistry.listActive()).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(IngestionException.class, () -> ingestionService.loadAll(false));
    }

    private DataFile file(long id, String name, long createdAt) {
        return new DataFile(id, "stored-" + id, name, 10, 1, List.of(), null, null, null, null, createdAt, true);
    }

    private void stored(DataFile file, String content) {
        when(dataFileStore.read(file.storedPath())).thenReturn(content.getBytes(StandardCharsets.UTF_8));
    }
}
