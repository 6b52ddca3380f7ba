package org.calista.canary.ai.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.canary.ai.cognitive.StrategyGate;
import org.calista.canary.ai.provenance.AnswerTemplates;
import org.calista.canary.ai.provenance.ClaimExtractor;
import org.calista.canary.ai.provenance.ProvenancePolicy;
import org.calista.canary.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * CanaryConfig — plain POJO config:
 * - defaults live in the fields
 * - loadOrCreate() writes the defaults when the file is missing or blank
 * - validate() clamps and normalizes every knob
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CanaryConfig {

    private static final Logger log = LoggerFactory.getLogger(CanaryConfig.class);

    public String baseDir = "data";
    public Sessions sessions = new Sessions();
    public Provenance provenance = new Provenance();
    public Extractor extractor = new Extractor();
    public Strategy strategy = new Strategy();
    public Answer answer = new Answer();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Sessions {
        public boolean eventLogEnabled = true;
        public String eventLogFile = "events.jsonl";

        /** Export the ledger when a session closes. Off: ledgers are session-scoped. */
        public boolean snapshotOnClose = false;
        public String snapshotDir = "snapshots";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Provenance {
        public double fullConfidence = ProvenancePolicy.DEFAULT_FULL_CONFIDENCE;
        public double partialConfidence = ProvenancePolicy.DEFAULT_PARTIAL_CONFIDENCE;
        public int minObservationsForAnswer = ProvenancePolicy.DEFAULT_MIN_OBSERVATIONS;

        // per-hop confidence adjustments
        public double inferenceDelta = ProvenancePolicy.DEFAULT_INFERENCE_DELTA;
        public double hypothesisDelta = ProvenancePolicy.DEFAULT_HYPOTHESIS_DELTA;

        // answer breakdown buckets
        public double highClaimConfidence = ProvenancePolicy.DEFAULT_HIGH_CLAIM_CONFIDENCE;
        public double mediumClaimConfidence = ProvenancePolicy.DEFAULT_MEDIUM_CLAIM_CONFIDENCE;

        public long nearExpirySeconds = ProvenancePolicy.DEFAULT_NEAR_EXPIRY_SECONDS;
        public int crossValidationObservations = ProvenancePolicy.DEFAULT_CROSS_VALIDATION_OBSERVATIONS;
        public int excerptChars = ProvenancePolicy.DEFAULT_EXCERPT_CHARS;
        public int contextObservations = ProvenancePolicy.DEFAULT_CONTEXT_OBSERVATIONS;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Extractor {
        public int minSentenceLength = 15;
        public List<String> factPatterns = new ClaimExtractor.Config().factPatterns;
        public List<String> inferencePatterns = new ClaimExtractor.Config().inferencePatterns;
        public List<String> hypothesisPatterns = new ClaimExtractor.Config().hypothesisPatterns;
        public List<String> structuralMarkers = new ClaimExtractor.Config().structuralMarkers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Strategy {
        public double confidenceThreshold = 0.7;
        public int stallThreshold = 3;
        public int uncertaintyLimit = 5;
        public int minObservationsForAnswer = 1;
        public double degradeConfidenceFloor = 0.3;
        public double groundingMinConfidence = 0.5;
        public int crossValidationMinCount = 3;
        public List<String> goalMarkers = new StrategyGate.Config().goalMarkers;
        public List<String> dataMarkers = new StrategyGate.Config().dataMarkers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Answer {
        /** "en" or "zh". */
        public String locale = "en";
    }

    // -------------------- Load / Create --------------------

    public static CanaryConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            CanaryConfig created = new CanaryConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            CanaryConfig created = new CanaryConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        CanaryConfig cfg = mapper.readValue(json, CanaryConfig.class);
        if (cfg == null) cfg = new CanaryConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, CanaryConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, CanaryConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (sessions == null) sessions = new Sessions();
        if (sessions.eventLogFile == null || sessions.eventLogFile.isBlank()) sessions.eventLogFile = "events.jsonl";
        if (sessions.snapshotDir == null || sessions.snapshotDir.isBlank()) sessions.snapshotDir = "snapshots";

        if (provenance == null) provenance = new Provenance();
        provenance.fullConfidence = unit(provenance.fullConfidence, ProvenancePolicy.DEFAULT_FULL_CONFIDENCE);
        provenance.partialConfidence = unit(provenance.partialConfidence, ProvenancePolicy.DEFAULT_PARTIAL_CONFIDENCE);
        if (provenance.partialConfidence > provenance.fullConfidence) provenance.partialConfidence = provenance.fullConfidence;
        if (provenance.minObservationsForAnswer < 0) provenance.minObservationsForAnswer = 0;
        provenance.inferenceDelta = delta(provenance.inferenceDelta, ProvenancePolicy.DEFAULT_INFERENCE_DELTA);
        provenance.hypothesisDelta = delta(provenance.hypothesisDelta, ProvenancePolicy.DEFAULT_HYPOTHESIS_DELTA);
        provenance.highClaimConfidence = unit(provenance.highClaimConfidence, ProvenancePolicy.DEFAULT_HIGH_CLAIM_CONFIDENCE);
        provenance.mediumClaimConfidence = unit(provenance.mediumClaimConfidence, ProvenancePolicy.DEFAULT_MEDIUM_CLAIM_CONFIDENCE);
        if (provenance.mediumClaimConfidence > provenance.highClaimConfidence)
            provenance.mediumClaimConfidence = provenance.highClaimConfidence;
        if (provenance.nearExpirySeconds < 0) provenance.nearExpirySeconds = 0;
        if (provenance.crossValidationObservations < 1) provenance.crossValidationObservations = 1;
        if (provenance.excerptChars < ProvenancePolicy.MIN_EXCERPT_CHARS)
            provenance.excerptChars = ProvenancePolicy.MIN_EXCERPT_CHARS;
        if (provenance.contextObservations < 1) provenance.contextObservations = 1;

        if (extractor == null) extractor = new Extractor();
        if (extractor.minSentenceLength < 1) extractor.minSentenceLength = 1;
        ClaimExtractor.Config ed = new ClaimExtractor.Config();
        if (extractor.factPatterns == null) extractor.factPatterns = ed.factPatterns;
        if (extractor.inferencePatterns == null) extractor.inferencePatterns = ed.inferencePatterns;
        if (extractor.hypothesisPatterns == null) extractor.hypothesisPatterns = ed.hypothesisPatterns;
        if (extractor.structuralMarkers == null) extractor.structuralMarkers = ed.structuralMarkers;

        if (strategy == null) strategy = new Strategy();
        strategy.confidenceThreshold = unit(strategy.confidenceThreshold, 0.7);
        if (strategy.stallThreshold < 1) strategy.stallThreshold = 1;
        if (strategy.uncertaintyLimit < 1) strategy.uncertaintyLimit = 1;
        if (strategy.minObservationsForAnswer < 0) strategy.minObservationsForAnswer = 0;
        strategy.degradeConfidenceFloor = unit(strategy.degradeConfidenceFloor, 0.3);
        strategy.groundingMinConfidence = unit(strategy.groundingMinConfidence, 0.5);
        if (strategy.crossValidationMinCount < 1) strategy.crossValidationMinCount = 1;
        StrategyGate.Config gd = new StrategyGate.Config();
        if (strategy.goalMarkers == null) strategy.goalMarkers = gd.goalMarkers;
        if (strategy.dataMarkers == null) strategy.dataMarkers = gd.dataMarkers;

        if (answer == null) answer = new Answer();
        if (answer.locale == null || answer.locale.isBlank()) answer.locale = "en";
        answer.locale = answer.locale.trim();
    }

    private static double unit(double v, double def) {
        if (!Double.isFinite(v)) return def;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double delta(double v, double def) {
        if (!Double.isFinite(v)) return def;
        return Math.max(-1.0, Math.min(1.0, v));
    }

    private static List<String> clean(List<String> xs) {
        return xs.stream().filter(x -> x != null && !x.isBlank()).toList();
    }

    // -------------------- Wiring --------------------

    public ProvenancePolicy toPolicy() {
        return ProvenancePolicy.builder()
                .fullConfidence(provenance.fullConfidence)
                .partialConfidence(provenance.partialConfidence)
                .minObservationsForAnswer(provenance.minObservationsForAnswer)
                .inferenceDelta(provenance.inferenceDelta)
                .hypothesisDelta(provenance.hypothesisDelta)
                .highClaimConfidence(provenance.highClaimConfidence)
                .mediumClaimConfidence(provenance.mediumClaimConfidence)
                .nearExpirySeconds(provenance.nearExpirySeconds)
                .crossValidationObservations(provenance.crossValidationObservations)
                .excerptChars(provenance.excerptChars)
                .contextObservations(provenance.contextObservations)
                .build();
    }

    public ClaimExtractor.Config toExtractorConfig() {
        ClaimExtractor.Config c = new ClaimExtractor.Config();
        c.minSentenceLength = extractor.minSentenceLength;
        c.factPatterns = clean(extractor.factPatterns);
        c.inferencePatterns = clean(extractor.inferencePatterns);
        c.hypothesisPatterns = clean(extractor.hypothesisPatterns);
        c.structuralMarkers = clean(extractor.structuralMarkers);
        return c;
    }

    public StrategyGate.Config toGateConfig() {
        StrategyGate.Config c = new StrategyGate.Config();
        c.confidenceThreshold = strategy.confidenceThreshold;
        c.stallThreshold = strategy.stallThreshold;
        c.uncertaintyLimit = strategy.uncertaintyLimit;
        c.minObservationsForAnswer = strategy.minObservationsForAnswer;
        c.degradeConfidenceFloor = strategy.degradeConfidenceFloor;
        c.groundingMinConfidence = strategy.groundingMinConfidence;
        c.crossValidationMinCount = strategy.crossValidationMinCount;
        c.goalMarkers = clean(strategy.goalMarkers);
        c.dataMarkers = clean(strategy.dataMarkers);
        return c;
    }

    public AnswerTemplates toTemplates() {
        return AnswerTemplates.forLocale(answer.locale);
    }
}
