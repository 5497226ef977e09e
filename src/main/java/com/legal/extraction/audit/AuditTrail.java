package com.legal.extraction.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, thread-safe log of audit events. Entries are never modified or removed.
 */
public class AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} documentId={} subject={} actor={}",
                entry.action(), entry.documentId(), entry.subjectId(), entry.actor());
        return entry;
    }

    public AuditEntry record(AuditAction action, String documentId, String subjectId, Map<String, Object> details) {
        return record(AuditEntry.of(action, documentId, subjectId, AuditEntry.SYSTEM_ACTOR, details));
    }

    public AuditEntry recordBy(String actor, AuditAction action, String documentId, String subjectId,
                               Map<String, Object> details) {
        return record(AuditEntry.of(action, documentId, subjectId, actor, details));
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> getEntriesFor(String subjectId) {
        return entries.stream().filter(e -> subjectId.equals(e.subjectId())).toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream().filter(e -> e.action() == action).toList();
    }

    public List<AuditEntry> getEntriesForDocument(String documentId) {
        return entries.stream().filter(e -> documentId.equals(e.documentId())).toList();
    }

    public int size() {
        return entries.size();
    }
}
