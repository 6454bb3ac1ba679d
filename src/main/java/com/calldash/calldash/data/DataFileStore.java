package com.calldash.calldash.data;

import java.util.Optional;

/**
 * Abstraction over the backing store holding uploaded call-log bytes.
 */
public interface DataFileStore {

    /**
     * Persists upload bytes under a collision-resistant name and returns the stored path.
     */
    String store(String originalName, byte[] content);

    byte[] read(String storedPath);

    boolean exists(String storedPath);

    void delete(String storedPath);

    /**
     * Reads the configured fallback dataset, if one is configured and present.
     * Stores without a fallback return empty.
     */
    default Optional<StoredContent> readDefaultFile() {
        return Optional.empty();
    }

    /**
     * File name plus raw byte content.
     */
    record StoredContent(String fileName, byte[] content) {
    }
}
