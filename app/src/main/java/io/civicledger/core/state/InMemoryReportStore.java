package io.civicledger.core.state;

import io.civicledger.core.protocol.ReportStatus;
import io.civicledger.core.protocol.Urgency;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of ReportStore.
 * Not persistent; resets every process run.
 */
public final class InMemoryReportStore implements ReportStore {

    private final Map<String, ReportRecord> reports = new LinkedHashMap<>();
    private final List<AuditEvent> audit = new ArrayList<>();

    @Override
    public synchronized void insert(ReportRecord record) {
        if (record == null) throw new IllegalArgumentException("record must not be null");
        if (reports.containsKey(record.id())) {
            throw new IllegalArgumentException("Duplicate report id: " + record.id());
        }
        reports.put(record.id(), record);
    }

    @Override
    public synchronized Optional<ReportRecord> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(reports.get(id));
    }

    @Override
    public synchronized List<ReportRecord> list(ReportStatus status, Urgency urgency, int limit, int offset) {
        if (limit < 0 || offset < 0) throw new IllegalArgumentException("limit and offset must be >= 0");
        List<ReportRecord> matches = new ArrayList<>();
        for (ReportRecord r : reports.values()) {
            if (status != null && r.status() != status) continue;
            if (urgency != null && r.urgency() != urgency) continue;
            matches.add(r);
        }
        matches.sort(Comparator.comparingLong(ReportRecord::createdAt)
                .thenComparingLong(ReportRecord::blockIndex)
                .reversed());
        if (offset >= matches.size()) return List.of();
        int end = (int) Math.min(matches.size(), (long) offset + limit);
        return List.copyOf(matches.subList(offset, end));
    }

    @Override
    public synchronized ReportRecord updateStatus(String id, ReportStatus status, long at) {
        ReportRecord current = reports.get(id);
        if (current == null) throw new IllegalArgumentException("Unknown report id: " + id);
        ReportRecord updated = current.withStatus(status, at);
        reports.put(id, updated);
        return updated;
    }

    @Override
    public synchronized void logAudit(AuditEvent event) {
        if (event == null) return;
        audit.add(event);
    }

    @Override
    public synchronized List<AuditEvent> auditLog(String reportId) {
        List<AuditEvent> out = new ArrayList<>();
        for (AuditEvent e : audit) {
            if (reportId != null && reportId.equals(e.reportId())) out.add(e);
        }
        return out;
    }

    @Override
    public synchronized List<AuditEvent> auditLog() {
        return List.copyOf(audit);
    }

    @Override
    public synchronized long size() {
        return reports.size();
    }
}
