package org.calista.canary.ai.provenance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ProvenanceRegistry — the session's audit ledger of observations and claims.
 *
 * <p>
 * Contracts:
 * - one registry per problem-solving session; not thread-safe, never shared between sessions
 * - the only mutator of both maps; observations are appended, never removed (expiry filters at read time)
 * - every time-based query takes one {@code now} snapshot from the injected clock
 * - no operation throws for domain input: empty evidence is a normal REFUSE outcome
 * </p>
 */
public final class ProvenanceRegistry {

    private static final Logger log = LogManager.getLogger(ProvenanceRegistry.class);

    private final Clock clock;
    private final ProvenancePolicy policy;

    private final LinkedHashMap<String, Observation> observations = new LinkedHashMap<>();
    private final LinkedHashMap<String, Claim> claims = new LinkedHashMap<>();

    public ProvenanceRegistry() {
        this(Clock.systemUTC(), ProvenancePolicy.defaults());
    }

    public ProvenanceRegistry(Clock clock) {
        this(clock, ProvenancePolicy.defaults());
    }

    public ProvenanceRegistry(Clock clock, ProvenancePolicy policy) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Clock clock() {
        return clock;
    }

    public ProvenancePolicy policy() {
        return policy;
    }

    public Instant now() {
        return clock.instant();
    }

    // =========================
    // Writes
    // =========================

    /** Stores the observation unconditionally (no dedup, never rejected). */
    public String addObservation(Observation observation) {
        Objects.requireNonNull(observation, "observation");
        observations.put(observation.id, observation);
        if (log.isDebugEnabled()) {
            log.debug("observation added id={} source={} conf={} ttl={}",
                    observation.id, observation.sourceId, observation.confidence, observation.ttlSeconds);
        }
        return observation.id;
    }

    /** Recomputes the claim's confidence against the current ledger before storing it. */
    public String addClaim(Claim claim) {
        Objects.requireNonNull(claim, "claim");
        claim.updateConfidence(observations, now());
        claims.put(claim.id, claim);
        return claim.id;
    }

    public void clear() {
        int o = observations.size();
        int c = claims.size();
        observations.clear();
        claims.clear();
        log.debug("registry cleared observations={} claims={}", o, c);
    }

    // =========================
    // Reads
    // =========================

    public Optional<Observation> getObservation(String id) {
        return Optional.ofNullable(id == null ? null : observations.get(id));
    }

    public Optional<Claim> getClaim(String id) {
        return Optional.ofNullable(id == null ? null : claims.get(id));
    }

    /** Read-only view of every observation, expired ones included (insertion order). */
    public Map<String, Observation> observations() {
        return Collections.unmodifiableMap(observations);
    }

    public Map<String, Claim> claims() {
        return Collections.unmodifiableMap(claims);
    }

    public int observationCount() {
        return observations.size();
    }

    public int claimCount() {
        return claims.size();
    }

    public List<Observation> getValidObservations() {
        return getValidObservations(0.0, now());
    }

    public List<Observation> getValidObservations(double minConfidence) {
        return getValidObservations(minConfidence, now());
    }

    /** Unexpired observations with {@code confidence >= minConfidence}, judged against one instant. */
    public List<Observation> getValidObservations(double minConfidence, Instant now) {
        Objects.requireNonNull(now, "now");
        ArrayList<Observation> out = new ArrayList<>(observations.size());
        for (Observation o : observations.values()) {
            if (!o.isExpired(now) && o.confidence >= minConfidence) out.add(o);
        }
        return out;
    }

    /** Refreshes each claim's confidence, then filters; {@code type == null} keeps all types. */
    public List<Claim> getValidClaims(double minConfidence, ClaimType type) {
        Instant now = now();
        ArrayList<Claim> out = new ArrayList<>();
        for (Claim c : claims.values()) {
            c.updateConfidence(observations, now);
            if (c.confidence() < minConfidence) continue;
            if (type != null && c.claimType != type) continue;
            out.add(c);
        }
        return out;
    }

    /**
     * Ids of observations that are expired right now.
     * A query, not a delete: expired entries stay in the ledger for audit.
     */
    public List<String> invalidateExpired() {
        return expiredIds(now());
    }

    public List<String> expiredIds(Instant now) {
        ArrayList<String> out = new ArrayList<>();
        for (Map.Entry<String, Observation> e : observations.entrySet()) {
            if (e.getValue().isExpired(now)) out.add(e.getKey());
        }
        return out;
    }

    public List<Observation> observationsBySource(String sourceId) {
        ArrayList<Observation> out = new ArrayList<>();
        for (Observation o : observations.values()) {
            if (o.sourceId.equals(sourceId)) out.add(o);
        }
        return out;
    }

    public List<Observation> observationsByType(ObservationType type) {
        ArrayList<Observation> out = new ArrayList<>();
        for (Observation o : observations.values()) {
            if (o.sourceType == type) out.add(o);
        }
        return out;
    }

    // =========================
    // Degradation
    // =========================

    public DegradationLevel determineDegradationLevel() {
        return determineDegradationLevel(policy.minObservationsForAnswer, policy.partialConfidence);
    }

    /**
     * no valid observations → REFUSE;
     * avg >= full threshold and enough observations → FULL_ANSWER;
     * avg >= minConfidence → PARTIAL_WITH_UNCERTAINTY;
     * otherwise → REQUEST_MORE_INFO.
     */
    public DegradationLevel determineDegradationLevel(int requiredObservations, double minConfidence) {
        return determineDegradationLevel(requiredObservations, minConfidence, policy.fullConfidence);
    }

    public DegradationLevel determineDegradationLevel(int requiredObservations, double minConfidence, double fullConfidence) {
        List<Observation> valid = getValidObservations(0.0, now());
        if (valid.isEmpty()) return DegradationLevel.REFUSE;

        double sum = 0.0;
        for (Observation o : valid) sum += o.confidence;
        double avg = sum / valid.size();
        int n = valid.size();

        DegradationLevel level;
        if (avg >= fullConfidence && n >= requiredObservations) {
            level = DegradationLevel.FULL_ANSWER;
        } else if (avg >= minConfidence) {
            level = DegradationLevel.PARTIAL_WITH_UNCERTAINTY;
        } else {
            level = DegradationLevel.REQUEST_MORE_INFO;
        }
        log.debug("degradation level={} valid={} avg={} required={} min={}", level, n, avg, requiredObservations, minConfidence);
        return level;
    }

    // =========================
    // Prompt context
    // =========================

    /** The {@code maxObservations} most recent valid observations plus an expired-count line. */
    public String toContext(int maxObservations) {
        Instant now = now();
        List<Observation> valid = getValidObservations(0.0, now);
        int expired = expiredIds(now).size();

        StringBuilder sb = new StringBuilder(512);
        if (valid.isEmpty()) {
            sb.append("[no valid observations]");
        } else {
            valid.sort(Comparator.comparing((Observation o) -> o.timestamp).reversed());
            int limit = Math.max(0, maxObservations);
            sb.append("[current observations]");
            for (int i = 0; i < Math.min(limit, valid.size()); i++) {
                sb.append('\n').append(valid.get(i).toContext(now));
            }
        }
        if (expired > 0) {
            sb.append("\n\n(expired observations: ").append(expired).append(')');
        }
        return sb.toString();
    }

    public String toContext() {
        return toContext(policy.contextObservations);
    }

    // =========================
    // Map form
    // =========================

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> obs = new LinkedHashMap<>();
        for (Map.Entry<String, Observation> e : observations.entrySet()) obs.put(e.getKey(), e.getValue().toMap());

        LinkedHashMap<String, Object> cl = new LinkedHashMap<>();
        for (Map.Entry<String, Claim> e : claims.entrySet()) cl.put(e.getKey(), e.getValue().toMap());

        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("observations", obs);
        m.put("claims", cl);
        return m;
    }

    /** Restores entries as stored; claim confidences are not recomputed until consulted. */
    @SuppressWarnings("unchecked")
    public static ProvenanceRegistry fromMap(Map<String, ?> m, Clock clock, ProvenancePolicy policy) {
        ProvenanceRegistry registry = new ProvenanceRegistry(clock, policy);
        Instant loadedAt = registry.now();
        for (Object v : WireMaps.map(m, "observations").values()) {
            if (v instanceof Map<?, ?> om) {
                Observation o = Observation.fromMap((Map<String, Object>) om, loadedAt);
                registry.observations.put(o.id, o);
            }
        }
        for (Object v : WireMaps.map(m, "claims").values()) {
            if (v instanceof Map<?, ?> cm) {
                Claim c = Claim.fromMap((Map<String, Object>) cm, loadedAt);
                registry.claims.put(c.id, c);
            }
        }
        return registry;
    }

    @Override
    public String toString() {
        return "ProvenanceRegistry{observations=" + observations.size() + ", claims=" + claims.size() + '}';
    }
}
