package com.eainde.vendorrisk.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Append-only record of something the pipeline did on the vendor's behalf.
 */
public record AuditLogEntry(
        String eventType,
        String entityType,
        String entityId,
        String actor,
        String description,
        Map<String, String> metadata,
        Instant timestamp
) implements Serializable {

    public static final String SYSTEM_ACTOR = "system";

    public AuditLogEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static AuditLogEntry system(String eventType, String entityType, String entityId,
                                       String description, Map<String, String> metadata, Instant at) {
        return new AuditLogEntry(eventType, entityType, entityId, SYSTEM_ACTOR, description, metadata, at);
    }
}
