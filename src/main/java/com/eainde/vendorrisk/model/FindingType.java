package com.eainde.vendorrisk.model;

import java.util.Locale;

public enum FindingType {
    COMPLIANT,
    NON_COMPLIANT,
    MISSING,
    UNCLEAR;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for model output; anything unrecognised is {@link #UNCLEAR}.
     */
    public static FindingType parse(String raw) {
        if (raw == null) return UNCLEAR;
        String key = raw.strip().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (FindingType t : values()) {
            if (t.name().equals(key)) return t;
        }
        return UNCLEAR;
    }
}
