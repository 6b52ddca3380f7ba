package org.calista.canary.ai.provenance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ClaimExtractor — turns generated text into auditable candidate claims.
 *
 * <p>Pattern/keyword matching only. Classification priority:
 * FACT (refs + fact phrase) → INFERENCE → HYPOTHESIS → FACT (refs only) → HYPOTHESIS.
 * An unsupported, unmarked sentence always lands in HYPOTHESIS, never FACT.</p>
 *
 * <p>Phrase sets ship in English and Chinese and are configurable via {@link Config}.</p>
 */
public final class ClaimExtractor {

    private static final Logger log = LogManager.getLogger(ClaimExtractor.class);

    /** Sentence terminals (CJK + newline) or ASCII terminals followed by whitespace. */
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[。！？\\n]|(?<=[.!?])\\s+");

    /** {@code [xxxxxxxx]} — an 8-character ledger id. */
    private static final Pattern OBSERVATION_REF = Pattern.compile("\\[(\\w{" + Ids.LENGTH + "})]");

    public static final class Config {
        public int minSentenceLength = 15;

        public List<String> factPatterns = List.of(
                "according to",
                "search results show",
                "results show",
                "data (?:indicates|shows)",
                "\\[(?:obs|observation)[\\w-]*]",
                "根据.*?[,，]",
                "搜索结果显示",
                "\\[观测\\w+]",
                "数据表明",
                "结果显示"
        );

        public List<String> inferencePatterns = List.of(
                "\\btherefore\\b",
                "\\bthus\\b",
                "\\bhence\\b",
                "\\bi infer\\b",
                "it follows that",
                "we can conclude",
                "我推断",
                "由此可见",
                "基于.*?推测",
                "因此",
                "可以得出"
        );

        public List<String> hypothesisPatterns = List.of(
                "\\bif\\b.*?\\bthen\\b",
                "\\bassuming\\b",
                "\\bsuppose\\b",
                "\\bpossibly\\b",
                "\\bperhaps\\b",
                "\\bmaybe\\b",
                "如果.*?那么",
                "假设",
                "可能",
                "或许",
                "推测"
        );

        /** Substrings marking formatting/structure rather than content. */
        public List<String> structuralMarkers = List.of("【", "】", "---", "===", "输出格式", "output format");
    }

    private final Config cfg;
    private final ProvenancePolicy policy;

    private final Pattern factRe;
    private final Pattern inferenceRe;
    private final Pattern hypothesisRe;

    public ClaimExtractor() {
        this(new Config(), ProvenancePolicy.defaults());
    }

    public ClaimExtractor(Config cfg, ProvenancePolicy policy) {
        this.cfg = cfg == null ? new Config() : cfg;
        this.policy = policy == null ? ProvenancePolicy.defaults() : policy;
        this.factRe = union(this.cfg.factPatterns);
        this.inferenceRe = union(this.cfg.inferencePatterns);
        this.hypothesisRe = union(this.cfg.hypothesisPatterns);
    }

    // ---------------------------------------------------------------------
    // Extraction
    // ---------------------------------------------------------------------

    public List<ExtractedClaim> extractClaims(String text) {
        if (text == null || text.isBlank()) return List.of();

        ArrayList<ExtractedClaim> out = new ArrayList<>();
        for (String raw : SENTENCE_SPLIT.split(text)) {
            String sentence = raw.strip();
            if (!isMeaningfulClaim(sentence)) continue;
            out.add(analyze(sentence));
        }
        log.debug("extracted {} claim(s) from {} chars", out.size(), text.length());
        return out;
    }

    private ExtractedClaim analyze(String sentence) {
        List<String> refs = observationRefs(sentence);
        ClaimType type = classify(sentence, refs);
        return new ExtractedClaim(sentence, type, refs, "", hintFor(type, refs));
    }

    ClaimType classify(String sentence, List<String> refs) {
        boolean hasRefs = !refs.isEmpty();
        if (hasRefs && matches(factRe, sentence)) return ClaimType.FACT;
        if (matches(inferenceRe, sentence)) return ClaimType.INFERENCE;
        if (matches(hypothesisRe, sentence)) return ClaimType.HYPOTHESIS;
        if (hasRefs) return ClaimType.FACT;
        return ClaimType.HYPOTHESIS;
    }

    private static ConfidenceHint hintFor(ClaimType type, List<String> refs) {
        if (refs.isEmpty()) return ConfidenceHint.LOW;
        if (type == ClaimType.FACT) return ConfidenceHint.HIGH;
        if (type == ClaimType.INFERENCE) return ConfidenceHint.MEDIUM;
        return ConfidenceHint.LOW;
    }

    boolean isMeaningfulClaim(String sentence) {
        if (sentence == null || sentence.isEmpty()) return false;
        if (sentence.length() < cfg.minSentenceLength) return false;
        if (sentence.endsWith("?") || sentence.endsWith("？")) return false;
        if (sentence.startsWith("#")) return false;

        String lower = sentence.toLowerCase(Locale.ROOT);
        for (String marker : cfg.structuralMarkers) {
            if (marker != null && !marker.isEmpty() && lower.contains(marker.toLowerCase(Locale.ROOT))) return false;
        }
        return true;
    }

    /** Distinct cited ids in order of first appearance. */
    public static List<String> observationRefs(String sentence) {
        if (sentence == null || sentence.isEmpty()) return List.of();
        LinkedHashSet<String> refs = new LinkedHashSet<>();
        Matcher m = OBSERVATION_REF.matcher(sentence);
        while (m.find()) refs.add(m.group(1));
        return refs.isEmpty() ? List.of() : new ArrayList<>(refs);
    }

    // ---------------------------------------------------------------------
    // Binding
    // ---------------------------------------------------------------------

    /**
     * Binds an extracted claim to the ledger: an {@code extract} step over the cited ids, then an
     * {@code infer} step carrying the inference/hypothesis decay, then weakest-link confidence.
     */
    public Claim buildClaim(ExtractedClaim extracted, Map<String, Observation> observations, Instant now) {
        Objects.requireNonNull(extracted, "extracted");

        ArrayList<TransformStep> chain = new ArrayList<>(2);
        chain.add(TransformStep.extract("extracted from observation data", extracted.observationRefs));

        if (extracted.claimType == ClaimType.INFERENCE) {
            chain.add(TransformStep.infer("logical inference from observations", extracted.observationRefs, policy.inferenceDelta));
        } else if (extracted.claimType == ClaimType.HYPOTHESIS) {
            chain.add(TransformStep.infer("speculative hypothesis", extracted.observationRefs, policy.hypothesisDelta));
        }

        Claim claim = Claim.builder()
                .statement(extracted.statement)
                .claimType(extracted.claimType)
                .sourceObservations(extracted.observationRefs)
                .transformChain(chain)
                .createdAt(now)
                .build();
        claim.updateConfidence(observations, now);
        return claim;
    }

    public Claim buildClaim(ExtractedClaim extracted, ProvenanceRegistry registry) {
        return buildClaim(extracted, registry.observations(), registry.now());
    }

    /** Extracts, binds and records every claim found in {@code text}. */
    public List<Claim> extractAndRecord(String text, ProvenanceRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        List<ExtractedClaim> extracted = extractClaims(text);
        ArrayList<Claim> out = new ArrayList<>(extracted.size());
        for (ExtractedClaim e : extracted) {
            Claim c = buildClaim(e, registry);
            registry.addClaim(c);
            out.add(c);
        }
        return out;
    }

    // ---------------------------------------------------------------------

    private static boolean matches(Pattern p, String s) {
        return p != null && p.matcher(s).find();
    }

    private static Pattern union(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) return null;
        StringBuilder sb = new StringBuilder();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;
            if (sb.length() > 0) sb.append('|');
            sb.append("(?:").append(p).append(')');
        }
        if (sb.length() == 0) return null;
        return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
