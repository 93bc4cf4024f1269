package io.civicledger.core.protocol;

public final class ValidationResult {
    public final boolean ok;
    public final IntegrityError error;
    public final long blockIndex;
    public final String message;

    private ValidationResult(boolean ok, IntegrityError error, long blockIndex, String message) {
        this.ok = ok; this.error = error; this.blockIndex = blockIndex; this.message = message;
    }
    public static ValidationResult ok() { return new ValidationResult(true, null, -1L, null); }
    public static ValidationResult error(IntegrityError e, long blockIndex, String msg) {
        return new ValidationResult(false, e, blockIndex, msg);
    }

    @Override public String toString() {
        return ok ? "OK" : ("ERR[" + error + "@" + blockIndex + "]: " + message);
    }
}
