package com.eainde.vendorrisk.model;

import java.io.Serializable;

/**
 * A candidate whose content was fetched and converted to plain text.
 *
 * @param candidate       the candidate this document was retrieved for
 * @param title           extracted page or document title
 * @param text            extracted plain text
 * @param contentHash     SHA-256 of the raw bytes, lower-case hex
 * @param byteLength      size of the raw body
 * @param contentType     media type reported by the server or sniffed from the body
 * @param storageLocation where the raw bytes were archived, {@code null} when archiving failed or is disabled
 */
public record RetrievedDocument(
        DocumentCandidate candidate,
        String title,
        String text,
        String contentHash,
        long byteLength,
        String contentType,
        String storageLocation
) implements Serializable {

    public DocumentType type() {
        return candidate.type();
    }

    public String url() {
        return candidate.url();
    }
}
