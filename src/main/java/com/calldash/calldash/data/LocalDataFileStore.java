package com.calldash.calldash.data;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps uploaded files on local disk under {@code calldata.data-directory}.
 */
@Component
public class LocalDataFileStore implements DataFileStore {

    private final CallDataProperties callDataProperties;

    public LocalDataFileStore(CallDataProperties callDataProperties) {
        this.callDataProperties = callDataProperties;
    }

    @Override
    public String store(String originalName, byte[] content) {
        Path directory = Paths.get(callDataProperties.getDataDirectory());
        Path target = directory.resolve(UUID.randomUUID() + extensionOf(originalName));
        try {
            Files.createDirectories(directory);
            Files.write(target, content);
            return target.toString();
        } catch (IOException ex) {
            throw new DataFileStoreException(CallDataConstants.MSG_STORE_WRITE_FAILED.formatted(originalName), ex);
        }
    }

    @Override
    public byte[] read(String storedPath) {
        try {
            return Files.readAllBytes(Paths.get(storedPath));
        } catch (IOException ex) {
            throw new DataFileStoreException(CallDataConstants.MSG_STORE_READ_FAILED.formatted(storedPath), ex);
        }
    }

    @Override
    public boolean exists(String storedPath) {
        return storedPath != null && Files.isRegularFile(Paths.get(storedPath));
    }

    @Override
    public void delete(String storedPath) {
        try {
            Files.deleteIfExists(Paths.get(storedPath));
        } catch (IOException ex) {
            throw new DataFileStoreException(CallDataConstants.MSG_STORE_DELETE_FAILED.formatted(storedPath), ex);
        }
    }

    @Override
    public Optional<StoredContent> readDefaultFile() {
        String configured = callDataProperties.getDefaultFile();
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        Path path = Paths.get(configured);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(new StoredContent(path.getFileName().toString(), read(path.toString())));
    }

    private String extensionOf(String originalName) {
        if (originalName == null) {
            return "";
        }
        int dot = originalName.lastIndexOf('.');
        if (dot < 0 || dot == originalName.length() - 1) {
            return "";
        }
        return "." + originalName.substring(dot + 1).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
