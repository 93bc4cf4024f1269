package io.civicledger.core.protocol;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One civic report as sealed into a block.
 *
 * Free text and evidence never appear here, only their {@link Digest}s.
 * A citizen id exists only on {@link Identity#NAMED} payloads: building an anonymous payload
 * with a citizen id drops the id.
 */
public final class BlockPayload {

    private final String reportId;
    private final String category;
    private final Urgency urgency;
    private final Location location;
    private final Digest descriptionHash;
    private final List<Digest> evidenceHashes;
    private final Identity identity;
    private final String citizenId;     // null unless NAMED
    private final long timestamp;
    private final List<String> authorityRouted;
    private final ReportStatus status;

    private BlockPayload(Builder b) {
        this.reportId = b.reportId;
        this.category = b.category;
        this.urgency = b.urgency;
        this.location = b.location;
        this.descriptionHash = b.descriptionHash;
        this.evidenceHashes = List.copyOf(b.evidenceHashes);
        this.identity = b.identity;
        this.citizenId = b.identity == Identity.NAMED ? b.citizenId : null;
        this.timestamp = b.timestamp;
        this.authorityRouted = List.copyOf(b.authorityRouted);
        this.status = b.status;
        basicValidate();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .reportId(reportId)
                .category(category)
                .urgency(urgency)
                .location(location)
                .descriptionHash(descriptionHash)
                .evidenceHashes(evidenceHashes)
                .identity(identity, citizenId)
                .timestamp(timestamp)
                .authorityRouted(authorityRouted)
                .status(status);
    }

    public static final class Builder {
        private String reportId;
        private String category;
        private Urgency urgency;
        private Location location;
        private Digest descriptionHash;
        private List<Digest> evidenceHashes = List.of();
        private Identity identity = Identity.ANONYMOUS;
        private String citizenId;
        private long timestamp = System.currentTimeMillis();
        private List<String> authorityRouted = List.of();
        private ReportStatus status = ReportStatus.PENDING;

        public Builder reportId(String id) { this.reportId = id; return this; }
        public Builder category(String c) { this.category = c; return this; }
        public Builder urgency(Urgency u) { this.urgency = u; return this; }
        public Builder location(Location l) { this.location = l; return this; }
        public Builder descriptionHash(Digest d) { this.descriptionHash = d; return this; }
        public Builder evidenceHashes(List<Digest> e) { this.evidenceHashes = e != null ? e : List.of(); return this; }
        public Builder named(String citizenId) { return identity(Identity.NAMED, citizenId); }
        public Builder anonymous() { return identity(Identity.ANONYMOUS, null); }
        public Builder identity(Identity i, String citizenId) { this.identity = i; this.citizenId = citizenId; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }
        public Builder authorityRouted(List<String> a) { this.authorityRouted = a != null ? a : List.of(); return this; }
        public Builder status(ReportStatus s) { this.status = s; return this; }

        public BlockPayload build() { return new BlockPayload(this); }
    }

    // -------------------- getters --------------------
    public String reportId() { return reportId; }
    public String category() { return category; }
    public Urgency urgency() { return urgency; }
    public Location location() { return location; }
    public Digest descriptionHash() { return descriptionHash; }
    public List<Digest> evidenceHashes() { return evidenceHashes; }
    public Identity identity() { return identity; }
    public Optional<String> citizenId() { return Optional.ofNullable(citizenId); }
    public long timestamp() { return timestamp; }
    public List<String> authorityRouted() { return authorityRouted; }
    public ReportStatus status() { return status; }

    /** Canonical bytes of this payload alone; see {@link SealEncoding}. */
    public byte[] serialize() {
        return SealEncoding.encodePayload(this);
    }

    public void basicValidate() {
        if (reportId == null || reportId.isBlank()) throw new IllegalArgumentException("Missing reportId");
        if (category == null || category.isBlank()) throw new IllegalArgumentException("Missing category");
        if (urgency == null) throw new IllegalArgumentException("Missing urgency");
        if (location == null) throw new IllegalArgumentException("Missing location");
        if (descriptionHash == null) throw new IllegalArgumentException("Missing descriptionHash");
        if (identity == null) throw new IllegalArgumentException("Missing identity");
        if (identity == Identity.NAMED && (citizenId == null || citizenId.isBlank())) {
            throw new IllegalArgumentException("Named report requires citizenId");
        }
        if (status == null) throw new IllegalArgumentException("Missing status");
        if (timestamp < 0) throw new IllegalArgumentException("timestamp must be >= 0");
        for (String a : authorityRouted) {
            if (a == null) throw new IllegalArgumentException("authority must not be null");
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockPayload)) return false;
        BlockPayload p = (BlockPayload) o;
        return timestamp == p.timestamp
                && reportId.equals(p.reportId)
                && category.equals(p.category)
                && urgency == p.urgency
                && location.equals(p.location)
                && descriptionHash.equals(p.descriptionHash)
                && evidenceHashes.equals(p.evidenceHashes)
                && identity == p.identity
                && Objects.equals(citizenId, p.citizenId)
                && authorityRouted.equals(p.authorityRouted)
                && status == p.status;
    }

    @Override public int hashCode() {
        return Objects.hash(reportId, category, urgency, location, descriptionHash, evidenceHashes,
                identity, citizenId, timestamp, authorityRouted, status);
    }

    @Override public String toString() {
        return "BlockPayload{reportId=" + reportId + ", category=" + category + ", urgency=" + urgency.label() + "}";
    }
}
