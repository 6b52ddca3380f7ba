package org.calista.canary.ai.cognitive;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.canary.ai.provenance.Observation;
import org.calista.canary.ai.provenance.ProvenanceRegistry;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * StrategyGate — rule-based choice of the next control action.
 *
 * <p>
 * Pure function over {@code (CognitiveState, ProvenanceRegistry?)}: nothing is remembered between
 * calls. Rules are checked in a fixed order and the first match wins:
 * </p>
 * <ol>
 *     <li>confident with no open uncertainties: conclude, unless the ledger is ungrounded</li>
 *     <li>ledger checks: stale data, weak evidence needing cross-validation</li>
 *     <li>stalled: degrade when confidence is at the floor, otherwise pivot</li>
 *     <li>goal/requirement uncertainty: ask the user</li>
 *     <li>data/information uncertainty: deepen</li>
 *     <li>too many uncertainties: degrade</li>
 *     <li>otherwise continue</li>
 * </ol>
 */
public final class StrategyGate {

    private static final Logger log = LogManager.getLogger(StrategyGate.class);

    public static final class Config {
        public double confidenceThreshold = 0.7;
        public int stallThreshold = 3;
        public int uncertaintyLimit = 5;
        public int minObservationsForAnswer = 1;

        /** Below this, a stalled loop degrades instead of pivoting. */
        public double degradeConfidenceFloor = 0.3;

        /** Observations below this confidence do not count as grounding. */
        public double groundingMinConfidence = 0.5;

        /** Fewer weak observations than this ask for cross-validation. */
        public int crossValidationMinCount = 3;

        /** Case-insensitive substrings marking goal/requirement uncertainty. */
        public List<String> goalMarkers = List.of("goal", "requirement", "目标", "需求");

        /** Case-insensitive substrings marking data/information uncertainty. */
        public List<String> dataMarkers = List.of("data", "information", "数据", "信息");

        public Config validate() {
            if (!Double.isFinite(confidenceThreshold)) confidenceThreshold = 0.7;
            confidenceThreshold = clamp01(confidenceThreshold);
            if (stallThreshold < 1) stallThreshold = 1;
            if (uncertaintyLimit < 1) uncertaintyLimit = 1;
            if (minObservationsForAnswer < 0) minObservationsForAnswer = 0;
            if (!Double.isFinite(degradeConfidenceFloor)) degradeConfidenceFloor = 0.3;
            degradeConfidenceFloor = clamp01(degradeConfidenceFloor);
            if (!Double.isFinite(groundingMinConfidence)) groundingMinConfidence = 0.5;
            groundingMinConfidence = clamp01(groundingMinConfidence);
            if (crossValidationMinCount < 1) crossValidationMinCount = 1;
            if (goalMarkers == null) goalMarkers = List.of();
            if (dataMarkers == null) dataMarkers = List.of();
            return this;
        }
    }

    private final Config cfg;
    private final List<String> goalMarkers;
    private final List<String> dataMarkers;

    public StrategyGate() {
        this(new Config());
    }

    public StrategyGate(Config cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg").validate();
        this.goalMarkers = lowered(cfg.goalMarkers);
        this.dataMarkers = lowered(cfg.dataMarkers);
    }

    public Config config() {
        return cfg;
    }

    public StrategyPath evaluate(CognitiveState state) {
        return evaluate(state, null);
    }

    /**
     * @param registry nullable; without it the ledger rules (1's grounding check and 2) are skipped
     */
    public StrategyPath evaluate(CognitiveState state, ProvenanceRegistry registry) {
        Objects.requireNonNull(state, "state");
        StrategyPath path = decide(state, registry);

        if (path.decision == StrategyDecision.DEGRADE) {
            log.warn("strategy DEGRADE: {} ({})", path.reason, state);
        } else if (log.isDebugEnabled()) {
            log.debug("strategy {}: {} ({})", path.decision, path.reason, state);
        }
        return path;
    }

    private StrategyPath decide(CognitiveState state, ProvenanceRegistry registry) {
        List<String> uncertainties = state.uncertainties();

        // One "now" for every ledger query in this evaluation.
        Instant now = registry == null ? null : registry.now();
        List<Observation> grounded = registry == null
                ? List.of()
                : registry.getValidObservations(cfg.groundingMinConfidence, now);

        // 1) confident and nothing open
        if (state.confidence() >= cfg.confidenceThreshold && uncertainties.isEmpty()) {
            if (registry != null && grounded.size() < cfg.minObservationsForAnswer) {
                return StrategyPath.of(StrategyDecision.REQUEST_MORE_INFO,
                        "confident but ungrounded: " + grounded.size() + " valid observation(s)",
                        "gather observations with a tool before answering");
            }
            return StrategyPath.of(StrategyDecision.CONCLUDE,
                    "confidence " + fmt(state.confidence()) + " reached with no open uncertainties");
        }

        // 2) ledger health, judged over every unexpired observation
        if (registry != null) {
            List<Observation> valid = registry.getValidObservations(0.0, now);
            int expired = registry.expiredIds(now).size();
            if (expired > 0 && valid.size() < cfg.minObservationsForAnswer) {
                return StrategyPath.of(StrategyDecision.REQUEST_MORE_INFO,
                        "stale data: " + expired + " observation(s) expired",
                        "refresh the expired observations");
            }
            if (!valid.isEmpty()) {
                double mean = mean(valid);
                if (mean < cfg.groundingMinConfidence && valid.size() < cfg.crossValidationMinCount) {
                    return StrategyPath.of(StrategyDecision.REQUEST_MORE_INFO,
                            "weak evidence: mean confidence " + fmt(mean),
                            "cross-validate with more sources");
                }
            }
        }

        // 3) stalled
        if (state.hasStalled(cfg.stallThreshold)) {
            if (state.confidence() < cfg.degradeConfidenceFloor) {
                return StrategyPath.of(StrategyDecision.DEGRADE,
                        "stalled for " + state.stallCount() + " iterations with low confidence",
                        "answer with the uncertainty stated");
            }
            return StrategyPath.of(StrategyDecision.PIVOT,
                    "stalled for " + state.stallCount() + " iterations",
                    "try a different method");
        }

        // 4) goal unclear
        String goal = firstMatching(uncertainties, goalMarkers);
        if (goal != null) {
            return StrategyPath.of(StrategyDecision.ASK_USER,
                    "goal or requirement unclear: " + goal,
                    "ask the user to clarify: " + goal);
        }

        // 5) not enough data
        String data = firstMatching(uncertainties, dataMarkers);
        if (data != null) {
            return StrategyPath.of(StrategyDecision.DEEPEN,
                    "information gap: " + data,
                    "collect more information on: " + data);
        }

        // 6) too many open questions
        if (uncertainties.size() >= cfg.uncertaintyLimit) {
            return StrategyPath.of(StrategyDecision.DEGRADE,
                    uncertainties.size() + " open uncertainties (limit " + cfg.uncertaintyLimit + ")",
                    "answer with the uncertainty stated");
        }

        return StrategyPath.of(StrategyDecision.CONTINUE, "no rule triggered");
    }

    // ---------------------------------------------------------------------

    private static String firstMatching(List<String> uncertainties, List<String> markers) {
        if (markers.isEmpty()) return null;
        for (String u : uncertainties) {
            String lu = u.toLowerCase(Locale.ROOT);
            for (String m : markers) {
                if (lu.contains(m)) return u;
            }
        }
        return null;
    }

    private static double mean(List<Observation> xs) {
        double sum = 0.0;
        for (Observation o : xs) sum += o.confidence;
        return sum / xs.size();
    }

    private static List<String> lowered(List<String> xs) {
        if (xs == null || xs.isEmpty()) return List.of();
        return xs.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private static double clamp01(double x) {
        if (x < 0.0) return 0.0;
        if (x > 1.0) return 1.0;
        return x;
    }
}
