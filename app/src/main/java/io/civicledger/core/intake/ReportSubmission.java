package io.civicledger.core.intake;

import io.civicledger.core.protocol.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Untrusted report input as received from a citizen, before hashing.
 * Holds the raw description and evidence references; none of it goes on the ledger as-is.
 */
public final class ReportSubmission {

    private final String category;
    private final String urgency;
    private final String description;
    private final String identity;
    private final String citizenId;
    private final Location location;
    private final List<String> evidence;
    private final List<String> authorities;
    private final boolean emergency;

    private ReportSubmission(Builder b) {
        this.category = b.category;
        this.urgency = b.urgency;
        this.description = b.description;
        this.identity = b.identity;
        this.citizenId = b.citizenId;
        this.location = b.location;
        this.evidence = copyOf(b.evidence);
        this.authorities = copyOf(b.authorities);
        this.emergency = b.emergency;
    }

    public static Builder builder() { return new Builder(); }

    // keeps null entries so the validator can report them
    private static List<String> copyOf(List<String> in) {
        return in == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(in));
    }

    public static final class Builder {
        private String category;
        private String urgency;
        private String description;
        private String identity = "anonymous";
        private String citizenId;
        private Location location;
        private List<String> evidence = List.of();
        private List<String> authorities = List.of();
        private boolean emergency;

        public Builder category(String c) { this.category = c; return this; }
        public Builder urgency(String u) { this.urgency = u; return this; }
        public Builder description(String d) { this.description = d; return this; }
        public Builder identity(String i) { this.identity = i; return this; }
        public Builder citizenId(String id) { this.citizenId = id; return this; }
        public Builder location(Location l) { this.location = l; return this; }
        public Builder evidence(List<String> e) { this.evidence = e; return this; }
        public Builder authorities(List<String> a) { this.authorities = a; return this; }
        public Builder emergency(boolean e) { this.emergency = e; return this; }

        public ReportSubmission build() { return new ReportSubmission(this); }
    }

    public String category() { return category; }
    public String urgency() { return urgency; }
    public String description() { return description; }
    public String identity() { return identity; }
    public String citizenId() { return citizenId; }
    public Location location() { return location; }
    public List<String> evidence() { return evidence; }
    public List<String> authorities() { return authorities; }
    public boolean emergency() { return emergency; }
}
