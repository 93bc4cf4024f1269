package io.civicledger.core.state;

/** One audit trail entry. {@code reportId} is null for ledger-wide events. */
public record AuditEvent(String eventType, String reportId, String actor, String details, long timestamp) {

    public static final String REPORT_SUBMITTED = "REPORT_SUBMITTED";
    public static final String STATUS_UPDATED = "STATUS_UPDATED";
    public static final String SNAPSHOT_FAILED = "SNAPSHOT_FAILED";
    public static final String BLOCKCHAIN_RESTORE_FAILED = "BLOCKCHAIN_RESTORE_FAILED";
    public static final String BLOCKCHAIN_INTEGRITY_FAILED = "BLOCKCHAIN_INTEGRITY_FAILED";
}
