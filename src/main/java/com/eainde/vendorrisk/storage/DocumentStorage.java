package com.eainde.vendorrisk.storage;

import java.io.IOException;

/**
 * Blob storage for downloaded document bodies.
 */
public interface DocumentStorage {

    /**
     * @return an opaque location that {@link #read(String)} accepts
     */
    String save(String key, byte[] content) throws IOException;

    byte[] read(String location) throws IOException;
}
