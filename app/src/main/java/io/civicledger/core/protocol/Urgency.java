package io.civicledger.core.protocol;

/** Report urgency as recorded in a block. {@link #NONE} is reserved for genesis. */
public enum Urgency {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low"),
    NONE("NONE");

    private final String label;

    Urgency(String label) { this.label = label; }

    public String label() { return label; }

    public boolean isReportable() { return this != NONE; }

    public static Urgency fromLabel(String label) {
        for (Urgency u : values()) {
            if (u.label.equals(label)) return u;
        }
        throw new IllegalArgumentException("Unknown urgency: " + label);
    }
}
