package io.civicledger.core.state;

import io.civicledger.core.protocol.ReportStatus;
import io.civicledger.core.protocol.Urgency;

import java.util.List;
import java.util.Optional;

/**
 * Report metadata and audit trail, kept next to the ledger.
 */
public interface ReportStore {

    /** Store a new record; ids are unique. */
    void insert(ReportRecord record);

    Optional<ReportRecord> findById(String id);

    /**
     * Newest first. {@code status}/{@code urgency} are optional filters (null = any).
     */
    List<ReportRecord> list(ReportStatus status, Urgency urgency, int limit, int offset);

    /** Replace the live status; returns the updated record. */
    ReportRecord updateStatus(String id, ReportStatus status, long at);

    void logAudit(AuditEvent event);

    /** Audit entries for one report, oldest first. */
    List<AuditEvent> auditLog(String reportId);

    /** Ledger-wide and per-report audit entries, oldest first. */
    List<AuditEvent> auditLog();

    long size();
}
