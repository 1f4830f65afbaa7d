package com.eainde.vendorrisk.model;

import java.util.Locale;

public enum ActionType {
    DOCUMENT_REQUEST,
    CLARIFICATION,
    URGENT_CLARIFICATION,
    RISK_REVIEW,
    INTERNAL_REVIEW;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isInternal() {
        return this == INTERNAL_REVIEW;
    }
}
