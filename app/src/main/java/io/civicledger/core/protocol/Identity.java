package io.civicledger.core.protocol;

public enum Identity {
    NAMED("name"),
    ANONYMOUS("anonymous");

    private final String label;

    Identity(String label) { this.label = label; }

    public String label() { return label; }

    public static Identity fromLabel(String label) {
        for (Identity i : values()) {
            if (i.label.equals(label)) return i;
        }
        throw new IllegalArgumentException("Unknown identity: " + label);
    }
}
