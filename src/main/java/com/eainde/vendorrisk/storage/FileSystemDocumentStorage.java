package com.eainde.vendorrisk.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes document bodies under {@code <basePath>/documents/}. Keys are sanitized to a flat file name.
 */
@Slf4j
public class FileSystemDocumentStorage implements DocumentStorage {

    private final Path root;

    public FileSystemDocumentStorage(Path basePath) {
        this.root = basePath.resolve("documents").toAbsolutePath().normalize();
    }

    @Override
    public String save(String key, byte[] content) throws IOException {
        Path target = resolve(sanitize(key));
        Files.createDirectories(root);
        Files.write(target, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        log.debug("Archived {} bytes to {}", content.length, target);
        return target.toString();
    }

    @Override
    public byte[] read(String location) throws IOException {
        Path path = Path.of(location).toAbsolutePath().normalize();
        if (!path.startsWith(root)) {
            throw new IOException("Location outside of storage root: " + location);
        }
        return Files.readAllBytes(path);
    }

    private Path resolve(String fileName) throws IOException {
        Path target = root.resolve(fileName).normalize();
        if (!target.startsWith(root)) {
            throw new IOException("Key escapes storage root: " + fileName);
        }
        return target;
    }

    static String sanitize(String key) {
        String cleaned = key.replaceAll("[^A-Za-z0-9._-]", "_");
        while (cleaned.startsWith(".")) {
            cleaned = cleaned.substring(1);
        }
        return cleaned.isEmpty() ? "document" : cleaned;
    }
}
