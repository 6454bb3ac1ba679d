package com.calldash.calldash.data;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DataFileServiceTest {

    private FileRegistry fileRegistry;
    private DataFileStore dataFileStore;
    private IngestionService ingestionService;
    private MergeCache mergeCache;
    private WorkingViewCache workingViewCache;
    private DataFileService dataFileService;

    @BeforeEach
    void setUp() {
        fileRegistry = mock(FileRegistry.class);
        dataFileStore = mock(DataFileStore.class);
        ingestionService = mock(IngestionService.class);
        mergeCache = new MergeCache();
        workingViewCache = new WorkingViewCache();
        dataFileService = new DataFileService(
                fileRegistry,
                dataFileStore,
                new TabularParser(),
                new SchemaReconciler(),
                ingestionService,
                mergeCache,
                workingViewCache,
                new CallDataProperties()
        );
    }

    @Test
    void shouldInvalidateCachesWhenStoredContentDeleteFails() {
        DataFile file = new DataFile(7L, "stored-7", "calls.csv", 10L, 1, List.of("a"),
                null, null, null, null, 100L, true);
        when(fileRegistry.findById(7L)).thenReturn(Optional.of(file));
        doThrow(new DataFileStoreException("disk unavailable")).when(dataFileStore).delete("stored-7");
        Dataset cached = Dataset.fromMaps(List.of(Map.of("a", "1")));
        mergeCache.rebuild(() -> cached);
        workingViewCache.put(1L, cached);

        assertThrows(DataFileStoreException.class, () -> dataFileService.remove(7L, true));

        verify(fileRegistry).deactivate(7L);
        assertNull(mergeCache.get());
        assertTrue(workingViewCache.get(1L).isEmpty());
    }

    @Test
    void shouldDiscardStoredContentWhenRegistryInsertFails() {
        byte[] content = "CallerID,CallerState\n5551234567,CA\n".getBytes(StandardCharsets.UTF_8);
        when(ingestionService.loadAll(false)).thenReturn(Dataset.empty());
        when(dataFileStore.store("calls.csv", content)).thenReturn("stored-1");
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("database unavailable");
        when(fileRegistry.insert(any())).thenThrow(failure);

        DataAccessResourceFailureException thrown = assertThrows(DataAccessResourceFailureException.class,
                () -> dataFileService.upload("calls.csv", content, 1L));

        assertEquals(failure, thrown);
        verify(dataFileStore).delete("stored-1");
    }
}
