package com.eainde.vendorrisk.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemDocumentStorageTest {

    @TempDir
    Path base;

    @Test
    @DisplayName("should write under the documents directory and read it back")
    void roundTrip() throws IOException {
        FileSystemDocumentStorage storage = new FileSystemDocumentStorage(base);

        String location = storage.save("acme_0123456789ab.html", "<html/>".getBytes(StandardCharsets.UTF_8));

        assertThat(Path.of(location)).startsWith(base.resolve("documents").toAbsolutePath());
        assertThat(new String(storage.read(location), StandardCharsets.UTF_8)).isEqualTo("<html/>");
    }

    @Test
    @DisplayName("should flatten keys that try to leave the storage root")
    void sanitizesKeys() throws IOException {
        FileSystemDocumentStorage storage = new FileSystemDocumentStorage(base);

        String location = storage.save("../../etc/passwd", new byte[]{1});

        assertThat(Path.of(location).getParent()).isEqualTo(base.resolve("documents").toAbsolutePath().normalize());
        assertThat(FileSystemDocumentStorage.sanitize("../x")).isEqualTo("_x");
    }

    @Test
    @DisplayName("should refuse to read outside the storage root")
    void readOutsideRoot() throws IOException {
        Path outside = Files.writeString(base.resolve("secret.txt"), "secret");
        FileSystemDocumentStorage storage = new FileSystemDocumentStorage(base);

        assertThatThrownBy(() -> storage.read(outside.toString())).isInstanceOf(IOException.class);
    }
}
