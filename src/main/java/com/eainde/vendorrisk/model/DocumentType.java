package com.eainde.vendorrisk.model;

import java.util.Locale;

/**
 * Kinds of compliance material the pipeline looks for.
 */
public enum DocumentType {
    ATTESTATION_REPORT("Attestation Report"),
    PRIVACY_POLICY("Privacy Policy"),
    DATA_PROCESSING_AGREEMENT("Data Processing Agreement"),
    SECURITY_POLICY("Security Policy"),
    INCIDENT_RESPONSE("Incident Response"),
    OTHER("Other");

    private final String label;

    DocumentType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Lenient parse for model output: accepts {@code privacy_policy}, {@code privacy-policy} or
     * {@code PRIVACY POLICY}. Unknown values become {@link #OTHER}.
     */
    public static DocumentType parse(String raw) {
        if (raw == null) return OTHER;
        String key = raw.strip().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (DocumentType t : values()) {
            if (t.name().equals(key)) return t;
        }
        return OTHER;
    }
}
