package com.eainde.vendorrisk.model;

import java.io.Serializable;
import java.util.Locale;

/**
 * A document or page that discovery believes is worth retrieving.
 *
 * @param type   classified document type
 * @param title  link text or page title
 * @param url    absolute source URL
 * @param method how the candidate was found
 */
public record DocumentCandidate(DocumentType type, String title, String url, DiscoveryMethod method)
        implements Serializable {

    public DocumentCandidate {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Candidate url must not be empty");
        }
        if (type == null) type = DocumentType.OTHER;
        if (title == null || title.isBlank()) title = type.label();
    }

    /**
     * Identity used for deduplication: lower-cased with trailing slashes removed.
     */
    public String normalizedUrl() {
        return normalize(url);
    }

    public static String normalize(String url) {
        String n = url.strip().toLowerCase(Locale.ROOT);
        int fragment = n.indexOf('#');
        if (fragment >= 0) {
            n = n.substring(0, fragment);
        }
        while (n.endsWith("/")) {
            n = n.substring(0, n.length() - 1);
        }
        return n;
    }
}
