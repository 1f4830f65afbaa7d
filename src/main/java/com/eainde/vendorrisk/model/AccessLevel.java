package com.eainde.vendorrisk.model;

import java.util.Locale;

public enum AccessLevel {
    READ_ONLY,
    LIMITED,
    FULL,
    ADMIN;

    public static AccessLevel fromValue(String raw) {
        return CriteriaValues.parse(AccessLevel.class, raw, "access level");
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
