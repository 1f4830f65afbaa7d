package com.eainde.vendorrisk.model;

import java.util.Locale;

/**
 * Severity scale shared by findings and by the overall risk category.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean atLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    public static RiskLevel parse(String raw, RiskLevel fallback) {
        if (raw == null) return fallback;
        String key = raw.strip().toUpperCase(Locale.ROOT);
        for (RiskLevel l : values()) {
            if (l.name().equals(key)) return l;
        }
        return fallback;
    }
}
