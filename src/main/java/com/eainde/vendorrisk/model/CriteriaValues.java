package com.eainde.vendorrisk.model;

import java.util.Locale;

final class CriteriaValues {

    private CriteriaValues() {
    }

    static <E extends Enum<E>> E parse(Class<E> type, String raw, String label) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing " + label);
        }
        String key = raw.strip().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        try {
            return Enum.valueOf(type, key);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + label + ": '" + raw + "'", e);
        }
    }
}
