package io.civicledger.core.service;

import io.civicledger.core.intake.ReportSubmission;
import io.civicledger.core.intake.ReportValidator;
import io.civicledger.core.ledger.ReportLedger;
import io.civicledger.core.metrics.LedgerMetrics;
import io.civicledger.core.protocol.Block;
import io.civicledger.core.protocol.BlockPayload;
import io.civicledger.core.protocol.Digest;
import io.civicledger.core.protocol.Hashes;
import io.civicledger.core.protocol.Identity;
import io.civicledger.core.protocol.ReportStatus;
import io.civicledger.core.protocol.Urgency;
import io.civicledger.core.protocol.ValidationResult;
import io.civicledger.core.state.AuditEvent;
import io.civicledger.core.state.ReportRecord;
import io.civicledger.core.state.ReportStore;
import io.civicledger.core.storage.SnapshotStore;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the ledger, its snapshot store and the report metadata store.
 * Call {@link #start()} once, then submit reports.
 *
 * Submissions are serialized: append, snapshot and metadata insert run as one step.
 */
public final class ReportService {
    private static final Logger LOG = Logger.getLogger(ReportService.class.getName());
    private static final String SYSTEM_ACTOR = "SYSTEM";

    private final ReportLedger ledger;
    private final SnapshotStore snapshots;
    private final ReportStore reports;
    private final ReportValidator validator;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ReportService(ReportLedger ledger, SnapshotStore snapshots, ReportStore reports,
                         ReportValidator validator, Clock clock) {
        this.ledger = ledger;
        this.snapshots = snapshots;
        this.reports = reports;
        this.validator = validator;
        this.clock = clock;
    }

    public ReportService(ReportLedger ledger, SnapshotStore snapshots, ReportStore reports) {
        this(ledger, snapshots, reports, new ReportValidator(), Clock.systemUTC());
    }

    /**
     * Restore the ledger from the snapshot store, then run an integrity check.
     * A snapshot that fails validation is not adopted; the ledger keeps its genesis-only chain.
     */
    public ValidationResult start() {
        Optional<List<Block>> saved;
        try {
            saved = snapshots.load();
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Failed to read ledger snapshot, starting fresh", e);
            audit(AuditEvent.BLOCKCHAIN_RESTORE_FAILED, null, "Snapshot unreadable: " + e.getMessage());
            saved = Optional.empty();
        }

        if (saved.isPresent()) {
            List<Block> chain = saved.get();
            if (ledger.loadAndValidate(chain)) {
                LOG.info("Ledger restored: " + chain.size() + " blocks");
            } else {
                LOG.severe("Ledger restore failed, snapshot rejected; starting from genesis");
                audit(AuditEvent.BLOCKCHAIN_RESTORE_FAILED, null,
                        "Snapshot of " + chain.size() + " blocks failed validation");
            }
        } else {
            LOG.info("Ledger initialized with genesis block");
        }

        ValidationResult result = ledger.validate();
        if (result.ok) {
            LOG.info("Ledger integrity verified (" + ledger.length() + " blocks)");
        } else {
            audit(AuditEvent.BLOCKCHAIN_INTEGRITY_FAILED, null, result.toString());
        }
        return result;
    }

    /**
     * Validate, hash, seal and record a report.
     *
     * @throws IllegalArgumentException when the submission breaks an input rule
     */
    public synchronized SubmissionReceipt submit(ReportSubmission submission) {
        validator.validate(submission);

        String reportId = UUID.randomUUID().toString();
        String referenceId = newReferenceId();
        long now = clock.millis();

        // raw text stops here
        Digest descriptionHash = Hashes.digest(submission.description());
        List<Digest> evidenceHashes = submission.evidence().stream().map(Hashes::digest).toList();

        Identity identity = Identity.fromLabel(submission.identity());
        String citizenId = identity == Identity.NAMED ? submission.citizenId() : null;
        Urgency urgency = Urgency.fromLabel(submission.urgency());

        BlockPayload payload = BlockPayload.builder()
                .reportId(reportId)
                .category(submission.category())
                .urgency(urgency)
                .location(submission.location())
                .descriptionHash(descriptionHash)
                .evidenceHashes(evidenceHashes)
                .identity(identity, citizenId)
                .timestamp(now)
                .authorityRouted(submission.authorities())
                .status(ReportStatus.PENDING)
                .build();

        Block block = ledger.append(payload);
        persistSnapshot(reportId);

        reports.insert(new ReportRecord(
                reportId,
                referenceId,
                block.index(),
                block.hash(),
                payload.category(),
                urgency,
                descriptionHash,
                identity,
                citizenId,
                ReportStatus.PENDING,
                payload.location(),
                submission.emergency(),
                evidenceHashes,
                payload.authorityRouted(),
                now,
                now
        ));
        reports.logAudit(new AuditEvent(
                AuditEvent.REPORT_SUBMITTED,
                reportId,
                identity == Identity.ANONYMOUS ? "ANONYMOUS" : citizenId,
                "New " + urgency.label() + " urgency report in category: " + payload.category(),
                now));

        LOG.info("Report " + referenceId + " sealed in block " + block.index());
        return new SubmissionReceipt(
                reportId,
                referenceId,
                block.index(),
                block.hash(),
                ReportStatus.PENDING,
                ledger.length(),
                Instant.ofEpochMilli(block.timestamp()));
    }

    /**
     * Look up a report's block and check the whole chain.
     * Empty when the report id is not on the ledger.
     */
    public Optional<VerificationReport> verify(String reportId) {
        Optional<Block> found = ledger.findByReportId(reportId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Block block = found.get();
        boolean intact = ledger.isValid();
        return Optional.of(new VerificationReport(
                reportId,
                block.index(),
                block.hash(),
                block.previousHash(),
                Instant.ofEpochMilli(block.timestamp()),
                block.nonce(),
                Hashes.digest(block.data().serialize()),
                intact));
    }

    public ChainHealth health() {
        ValidationResult result = ledger.validate();
        Block latest = ledger.latest();
        return new ChainHealth(
                result.ok ? ChainHealth.Status.HEALTHY : ChainHealth.Status.COMPROMISED,
                ledger.length(),
                latest.index(),
                latest.hash(),
                Instant.ofEpochMilli(latest.timestamp()),
                result.ok ? null : result.toString());
    }

    /**
     * Move a report along its lifecycle. The sealed block is never touched.
     *
     * @return the updated record, or empty when the report id is unknown
     * @throws IllegalStateException when the transition is not allowed
     */
    public synchronized Optional<ReportRecord> updateStatus(String reportId, ReportStatus next, String actor) {
        Optional<ReportRecord> current = reports.findById(reportId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        ReportStatus from = current.get().status();
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status transition " + from + " -> " + next);
        }
        long now = clock.millis();
        ReportRecord updated = reports.updateStatus(reportId, next, now);
        reports.logAudit(new AuditEvent(
                AuditEvent.STATUS_UPDATED,
                reportId,
                actor == null || actor.isBlank() ? "ADMIN" : actor,
                "Status changed from " + from + " to " + next,
                now));
        return Optional.of(updated);
    }

    public Optional<ReportRecord> getReport(String reportId) {
        return reports.findById(reportId);
    }

    public List<ReportRecord> listReports(ReportStatus status, Urgency urgency, int limit, int offset) {
        return reports.list(status, urgency, limit, offset);
    }

    public List<AuditEvent> auditLog(String reportId) {
        return reports.auditLog(reportId);
    }

    public ReportLedger ledger() { return ledger; }

    // The block is already appended; the next successful save covers it.
    private void persistSnapshot(String reportId) {
        try {
            snapshots.save(ledger.exportSnapshot());
        } catch (RuntimeException e) {
            LedgerMetrics.incrementSnapshotFailures();
            LOG.log(Level.WARNING, "Snapshot save failed after appending report " + reportId, e);
            audit(AuditEvent.SNAPSHOT_FAILED, reportId, String.valueOf(e.getMessage()));
        }
    }

    private void audit(String type, String reportId, String details) {
        reports.logAudit(new AuditEvent(type, reportId, SYSTEM_ACTOR, details, clock.millis()));
    }

    private String newReferenceId() {
        return "#IND-" + (10_000 + random.nextInt(90_000)) + "-X";
    }
}
