package com.eainde.vendorrisk.storage;

import java.io.IOException;

/**
 * Storage that keeps nothing. Used when archiving is disabled.
 */
public class NoOpDocumentStorage implements DocumentStorage {

    private static final String SCHEME = "noop:";

    @Override
    public String save(String key, byte[] content) {
        return SCHEME + key;
    }

    @Override
    public byte[] read(String location) throws IOException {
        throw new IOException("Nothing is archived by the no-op storage: " + location);
    }
}
