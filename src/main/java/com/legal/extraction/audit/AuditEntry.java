package com.legal.extraction.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One immutable audit event.
 *
 * @param subjectId record id, candidate id or adapter name the event concerns
 * @param actor     "system" for pipeline events, the reviewer for review decisions
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String documentId,
        String subjectId,
        String actor,
        Map<String, Object> details,
        Instant timestamp
) {
    public static final String SYSTEM_ACTOR = "system";

    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        actor = actor != null ? actor : SYSTEM_ACTOR;
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry of(AuditAction action, String documentId, String subjectId, String actor,
                                Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, documentId, subjectId, actor,
                details, Instant.now());
    }
}
