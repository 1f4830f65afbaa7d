package com.eainde.vendorrisk.model;

import java.io.Serializable;

/**
 * Per-document outcome reported alongside the assessment.
 *
 * @param url               source URL
 * @param type              document type
 * @param title             extracted title
 * @param contentHash       SHA-256 of the body
 * @param byteLength        body size
 * @param storageLocation   archive location or {@code null}
 * @param findingCount      findings produced from this document
 * @param documentRiskScore 0-100, 50 when nothing was found
 */
public record DocumentSummary(
        String url,
        DocumentType type,
        String title,
        String contentHash,
        long byteLength,
        String storageLocation,
        int findingCount,
        double documentRiskScore
) implements Serializable {
}
