package com.eainde.vendorrisk.model;

import java.util.Locale;

public enum BusinessCriticality {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static BusinessCriticality fromValue(String raw) {
        return CriteriaValues.parse(BusinessCriticality.class, raw, "business criticality");
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
