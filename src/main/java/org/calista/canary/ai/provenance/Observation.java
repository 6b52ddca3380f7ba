package org.calista.canary.ai.provenance;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Observation — an atomic, timestamped piece of world state from an authoritative source.
 *
 * <p>Rules:
 * <ul>
 *     <li>immutable after construction; appended once to a registry, never removed</li>
 *     <li>confidence is clamped to [0,1]; unset confidence takes the source-type default
 *     (USER_INPUT → 0.8, otherwise 1.0)</li>
 *     <li>{@code ttlSeconds == null} means the observation never expires</li>
 *     <li>the timestamp is required and comes from the caller's clock (usually {@link ProvenanceRegistry#now()})</li>
 * </ul>
 */
public final class Observation {

    /** Max characters of content shown in a prompt digest. */
    public static final int CONTEXT_EXCERPT_CHARS = 200;

    public final String id;
    public final String content;
    public final ObservationType sourceType;

    /** Tool name / user id / rule id. */
    public final String sourceId;

    public final Instant timestamp;
    public final double confidence;
    public final String scope;
    public final Long ttlSeconds;
    public final Map<String, Object> metadata;

    private Observation(Builder b) {
        this.id = (b.id == null || b.id.isBlank()) ? Ids.next() : b.id;
        this.content = b.content == null ? "" : b.content;
        this.sourceType = b.sourceType == null ? ObservationType.TOOL_RETURN : b.sourceType;
        this.sourceId = b.sourceId == null ? "" : b.sourceId;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp");
        this.confidence = resolveConfidence(b.confidence, this.sourceType);
        this.scope = b.scope == null ? "" : b.scope;
        this.ttlSeconds = (b.ttlSeconds != null && b.ttlSeconds < 0) ? Long.valueOf(0L) : b.ttlSeconds;
        this.metadata = b.metadata == null || b.metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Observation toolReturn(String sourceId, String content, double confidence, Instant at) {
        return builder().sourceType(ObservationType.TOOL_RETURN).sourceId(sourceId).content(content)
                .confidence(confidence).timestamp(at).build();
    }

    public static Observation userInput(String content, Instant at) {
        return builder().sourceType(ObservationType.USER_INPUT).sourceId("user").content(content).timestamp(at).build();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /** True once the age strictly exceeds the TTL. Monotonic in {@code now}. */
    public boolean isExpired(Instant now) {
        if (ttlSeconds == null) return false;
        long ageMs = Duration.between(timestamp, Objects.requireNonNull(now, "now")).toMillis();
        return ageMs > ttlSeconds * 1000L;
    }

    /** Remaining whole seconds (never negative), or empty when the observation never expires. */
    public OptionalLong remainingTtl(Instant now) {
        if (ttlSeconds == null) return OptionalLong.empty();
        long ageSeconds = Duration.between(timestamp, Objects.requireNonNull(now, "now")).getSeconds();
        return OptionalLong.of(Math.max(0L, ttlSeconds - ageSeconds));
    }

    /** Prompt digest for one observation. */
    public String toContext(Instant now) {
        StringBuilder sb = new StringBuilder(256);
        sb.append('[').append(id).append("] source: ").append(sourceType.label())
                .append(" (").append(sourceId).append(')');
        sb.append("\n    content: ").append(excerpt(content, CONTEXT_EXCERPT_CHARS));
        sb.append("\n    confidence: ").append(Math.round(confidence * 100)).append('%');
        OptionalLong remaining = remainingTtl(now);
        if (remaining.isPresent() && ttlSeconds != null && ttlSeconds > 0) {
            sb.append("\n    expires in: ").append(remaining.getAsLong()).append('s');
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Map form
    // ---------------------------------------------------------------------

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("content", content);
        m.put("source_type", sourceType.name());
        m.put("source_id", sourceId);
        m.put("timestamp", timestamp.toString());
        m.put("confidence", confidence);
        m.put("scope", scope);
        m.put("ttl_seconds", ttlSeconds);
        m.put("metadata", new LinkedHashMap<>(metadata));
        return m;
    }

    /** @param fallbackTimestamp used when the row carries no parseable timestamp */
    public static Observation fromMap(Map<String, ?> m, Instant fallbackTimestamp) {
        ObservationType type;
        try {
            type = ObservationType.valueOf(WireMaps.str(m, "source_type", "TOOL_RETURN"));
        } catch (IllegalArgumentException e) {
            type = ObservationType.TOOL_RETURN;
        }
        return builder()
                .id(WireMaps.str(m, "id", null))
                .content(WireMaps.str(m, "content", ""))
                .sourceType(type)
                .sourceId(WireMaps.str(m, "source_id", ""))
                .timestamp(WireMaps.instant(m, "timestamp", Objects.requireNonNull(fallbackTimestamp, "fallbackTimestamp")))
                .confidence(WireMaps.dbl(m, "confidence"))
                .scope(WireMaps.str(m, "scope", ""))
                .ttlSeconds(WireMaps.lng(m, "ttl_seconds"))
                .metadata(WireMaps.map(m, "metadata"))
                .build();
    }

    // ---------------------------------------------------------------------

    private static double resolveConfidence(Double requested, ObservationType type) {
        if (requested == null || !Double.isFinite(requested)) return type.defaultConfidence();
        double c = requested;
        if (c < 0.0) return 0.0;
        if (c > 1.0) return 1.0;
        return c;
    }

    static String excerpt(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Observation other)) return false;
        return id.equals(other.id)
                && Double.compare(confidence, other.confidence) == 0
                && content.equals(other.content)
                && sourceType == other.sourceType
                && sourceId.equals(other.sourceId)
                && timestamp.equals(other.timestamp)
                && scope.equals(other.scope)
                && Objects.equals(ttlSeconds, other.ttlSeconds)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, content, sourceType, sourceId, timestamp, confidence, scope, ttlSeconds, metadata);
    }

    @Override
    public String toString() {
        return "Observation{"
                + "id='" + id + '\''
                + ", type=" + sourceType
                + ", source='" + sourceId + '\''
                + ", conf=" + confidence
                + ", ttl=" + ttlSeconds
                + '}';
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private String id;
        private String content;
        private ObservationType sourceType = ObservationType.TOOL_RETURN;
        private String sourceId;
        private Instant timestamp;
        private Double confidence;
        private String scope;
        private Long ttlSeconds;
        private Map<String, Object> metadata;

        private Builder() {}

        public Builder id(String v) { this.id = v; return this; }

        public Builder content(String v) { this.content = v; return this; }

        public Builder sourceType(ObservationType v) { this.sourceType = v; return this; }

        public Builder sourceId(String v) { this.sourceId = v; return this; }

        public Builder timestamp(Instant v) { this.timestamp = v; return this; }

        /** {@code null} leaves confidence unset (source-type default applies). */
        public Builder confidence(Double v) { this.confidence = v; return this; }

        public Builder confidence(double v) { this.confidence = v; return this; }

        public Builder scope(String v) { this.scope = v; return this; }

        public Builder ttlSeconds(Long v) { this.ttlSeconds = v; return this; }

        public Builder ttl(Duration v) {
            this.ttlSeconds = v == null ? null : v.getSeconds();
            return this;
        }

        public Builder metadata(Map<String, Object> v) { this.metadata = v; return this; }

        public Builder meta(String key, Object value) {
            if (key == null || key.isBlank()) return this;
            if (metadata == null) metadata = new LinkedHashMap<>();
            metadata.put(key, value);
            return this;
        }

        public Observation build() {
            return new Observation(this);
        }
    }
}
