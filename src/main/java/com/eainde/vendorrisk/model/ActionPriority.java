package com.eainde.vendorrisk.model;

import java.util.Locale;

public enum ActionPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
