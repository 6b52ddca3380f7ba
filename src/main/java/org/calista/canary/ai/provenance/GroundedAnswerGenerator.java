package org.calista.canary.ai.provenance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * GroundedAnswerGenerator — applies the degradation contract to a raw model answer.
 *
 * <ul>
 *     <li>FULL_ANSWER: content passes through unchanged</li>
 *     <li>PARTIAL_WITH_UNCERTAINTY: an uncertainty disclaimer is appended</li>
 *     <li>REQUEST_MORE_INFO: wrapped in a limited-information preamble/postamble</li>
 *     <li>REFUSE: the raw answer is discarded and replaced by a fixed refusal; claim excerpts are dropped too</li>
 * </ul>
 *
 * Stateless apart from its configuration; safe to share across sessions.
 */
public final class GroundedAnswerGenerator {

    private static final Logger log = LogManager.getLogger(GroundedAnswerGenerator.class);

    private final ProvenancePolicy policy;
    private final AnswerTemplates templates;

    public GroundedAnswerGenerator() {
        this(ProvenancePolicy.defaults(), AnswerTemplates.english());
    }

    public GroundedAnswerGenerator(ProvenancePolicy policy, AnswerTemplates templates) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.templates = templates == null ? AnswerTemplates.english() : templates;
    }

    public double confidenceThresholdFull() {
        return policy.fullConfidence;
    }

    public double confidenceThresholdPartial() {
        return policy.partialConfidence;
    }

    public int minObservationsForAnswer() {
        return policy.minObservationsForAnswer;
    }

    public DegradationLevel determineDegradation(ProvenanceRegistry registry) {
        return registry.determineDegradationLevel(
                policy.minObservationsForAnswer, policy.partialConfidence, policy.fullConfidence);
    }

    public GroundedAnswer generate(String rawAnswer, ProvenanceRegistry registry) {
        return generate(rawAnswer, registry, List.of());
    }

    public GroundedAnswer generate(String rawAnswer, ProvenanceRegistry registry, List<Claim> claims) {
        Objects.requireNonNull(registry, "registry");
        List<Claim> cs = claims == null ? List.of() : claims;

        Instant now = registry.now();
        DegradationLevel level = determineDegradation(registry);

        List<Observation> valid = registry.getValidObservations(0.0, now);
        ArrayList<String> used = new ArrayList<>(valid.size());
        for (Observation o : valid) used.add(o.id);

        ArrayList<String> high = new ArrayList<>();
        ArrayList<String> medium = new ArrayList<>();
        ArrayList<String> low = new ArrayList<>();
        for (Claim c : cs) {
            double conf = c.updateConfidence(registry.observations(), now);
            // A refused answer contributes no text to the output, excerpts included.
            if (level == DegradationLevel.REFUSE) continue;
            String part = excerpt(c.statement, policy.excerptChars);
            if (conf >= policy.highClaimConfidence) high.add(part);
            else if (conf >= policy.mediumClaimConfidence) medium.add(part);
            else low.add(part);
        }

        List<String> limitations = limitations(registry, valid, now);
        List<String> suggestions = suggestions(level, valid.size());
        String content = processContent(rawAnswer == null ? "" : rawAnswer, level);

        if (level == DegradationLevel.REFUSE) {
            log.warn("answer refused: no valid observations (expired={})", registry.expiredIds(now).size());
        } else {
            log.debug("answer level={} observations={} claims={}", level, used.size(), cs.size());
        }

        return new GroundedAnswer(content, level, used, cs, high, medium, low, limitations, suggestions, templates);
    }

    // ---------------------------------------------------------------------

    String processContent(String rawAnswer, DegradationLevel level) {
        switch (level) {
            case FULL_ANSWER:
                return rawAnswer;
            case PARTIAL_WITH_UNCERTAINTY:
                return rawAnswer + templates.partialDisclaimer;
            case REQUEST_MORE_INFO:
                return templates.limitedPreamble + rawAnswer + templates.limitedPostamble;
            default:
                return templates.refusal;
        }
    }

    private List<String> limitations(ProvenanceRegistry registry, List<Observation> valid, Instant now) {
        ArrayList<String> out = new ArrayList<>(3);

        for (Observation o : valid) {
            if (o.ttlSeconds == null || o.ttlSeconds == 0L) continue;
            OptionalLong remaining = o.remainingTtl(now);
            if (remaining.isPresent() && remaining.getAsLong() < policy.nearExpirySeconds) {
                out.add(String.format(Locale.ROOT, templates.limitNearExpiry, o.sourceId));
                break;
            }
        }

        int expired = registry.expiredIds(now).size();
        if (expired > 0) {
            out.add(String.format(Locale.ROOT, templates.limitExpired, expired));
        }

        Set<String> sources = new HashSet<>();
        for (Observation o : valid) sources.add(o.sourceId);
        if (sources.size() == 1) {
            out.add(templates.limitSingleSource);
        }
        return out;
    }

    private List<String> suggestions(DegradationLevel level, int validCount) {
        ArrayList<String> out = new ArrayList<>(2);
        switch (level) {
            case REQUEST_MORE_INFO:
                out.add(templates.suggestSearch);
                out.add(templates.suggestUserContext);
                break;
            case REFUSE:
                out.add(templates.suggestSpecifics);
                out.add(templates.suggestDecompose);
                break;
            case PARTIAL_WITH_UNCERTAINTY:
                if (validCount < policy.crossValidationObservations) out.add(templates.suggestMoreData);
                break;
            default:
                break;
        }
        return out;
    }

    /** Short listing of valid observations (first five) and the expired count. */
    public String formatProvenanceSummary(ProvenanceRegistry registry) {
        Instant now = registry.now();
        List<Observation> valid = registry.getValidObservations(0.0, now);
        int expired = registry.expiredIds(now).size();

        StringBuilder sb = new StringBuilder(256);
        sb.append(templates.summaryTitle);
        if (valid.isEmpty()) {
            sb.append('\n').append(templates.summaryNone);
        } else {
            sb.append('\n').append(String.format(Locale.ROOT, templates.summaryValid, valid.size()));
            for (int i = 0; i < Math.min(5, valid.size()); i++) {
                Observation o = valid.get(i);
                sb.append("\n  - [").append(o.id).append("] ").append(o.sourceId)
                        .append(" (").append(Math.round(o.confidence * 100)).append("%)");
            }
        }
        if (expired > 0) {
            sb.append('\n').append(String.format(Locale.ROOT, templates.summaryExpired, expired));
        }
        return sb.toString();
    }

    private static String excerpt(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }
}
