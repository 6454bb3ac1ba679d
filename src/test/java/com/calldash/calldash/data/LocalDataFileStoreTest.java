package com.calldash.calldash.data;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalDataFileStoreTest {

    @TempDir
    Path tempDir;

    private CallDataProperties properties;
    private LocalDataFileStore store;

    @BeforeEach
    void setUp() {
        properties = new CallDataProperties();
        properties.setDataDirectory(tempDir.resolve("uploads").toString());
        store = new LocalDataFileStore(properties);
    }

    @Test
    void shouldStoreUnderRandomNameKeepingExtension() {
        byte[] content = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);

        String first = store.store("calls.CSV", content);
        String second = store.store("calls.CSV", content);

        assertNotEquals(first, second);
        assertTrue(first.endsWith(".csv"));
        assertFalse(Path.of(first).getFileName().toString().contains("calls"));
        assertArrayEquals(content, store.read(first));
    }

    @Test
    void shouldDeleteStoredBytes() {
        String path = store.store("calls.csv", new byte[] {1});

        store.delete(path);

        assertFalse(store.exists(path));
        assertThrows(DataFileStoreException.class, () -> store.read(path));
    }

    @Test
    void shouldReadConfiguredDefaultFile() throws Exception {
        Path fallback = tempDir.resolve("default.csv");
        Files.writeString(fallback, "CallerID\n1\n");
        properties.setDefaultFile(fallback.toString());

        DataFileStore.StoredContent content = store.readDefaultFile().orElseThrow();

        assertEquals("default.csv", content.fileName());
    }

    @Test
    void shouldIgnoreMissingDefaultFile() {
        properties.setDefaultFile(tempDir.resolve("absent.csv").toString());

        assertTrue(store.readDefaultFile().isEmpty());
    }
}
