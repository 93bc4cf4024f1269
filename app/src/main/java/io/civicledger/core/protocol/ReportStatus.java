package io.civicledger.core.protocol;

/**
 * Report lifecycle. A block records the status at submission time only;
 * later transitions are tracked by the metadata store.
 *
 * PENDING -> UNDER_REVIEW -> RESOLVED | DISMISSED
 */
public enum ReportStatus {
    PENDING,
    UNDER_REVIEW,
    RESOLVED,
    DISMISSED;

    public boolean canTransitionTo(ReportStatus next) {
        if (next == null) return false;
        switch (this) {
            case PENDING:
                return next == UNDER_REVIEW;
            case UNDER_REVIEW:
                return next == RESOLVED || next == DISMISSED;
            default:
                return false;
        }
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED;
    }
}
