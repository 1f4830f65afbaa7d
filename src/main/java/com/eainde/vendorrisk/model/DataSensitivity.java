package com.eainde.vendorrisk.model;

import java.util.Locale;

public enum DataSensitivity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }

    public static DataSensitivity fromValue(String raw) {
        return CriteriaValues.parse(DataSensitivity.class, raw, "data sensitivity");
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
