package org.calista.canary.ai.provenance;

import org.calista.canary.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GroundedAnswerGeneratorTest {

    private final AnswerTemplates en = AnswerTemplates.english();

    private MutableClock clock;
    private ProvenanceRegistry registry;
    private GroundedAnswerGenerator generator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new ProvenanceRegistry(clock);
        generator = new GroundedAnswerGenerator();
    }

    private String add(String id, String source, double confidence, Long ttl) {
        return registry.addObservation(Observation.builder()
                .id(id)
                .sourceId(source)
                .content(source + " output")
                .timestamp(clock.instant())
                .confidence(confidence)
                .ttlSeconds(ttl)
                .build());
    }

    @Test
    void defaultsAreExposed() {
        assertEquals(0.8, generator.confidenceThresholdFull(), 1e-9);
        assertEquals(0.5, generator.confidenceThresholdPartial(), 1e-9);
        assertEquals(1, generator.minObservationsForAnswer());
    }

    @Test
    void wellGroundedAnswerPassesThroughUnchanged() {
        add("aaaaaaaa", "web_search", 1.0, 86_400L);
        add("bbbbbbbb", "read_url", 1.0, 86_400L);
        add("cccccccc", "python_exec", 1.0, null);

        GroundedAnswer a = generator.generate("X", registry);

        assertEquals(DegradationLevel.FULL_ANSWER, a.degradationLevel);
        assertEquals("X", a.content);
        assertEquals(List.of("aaaaaaaa", "bbbbbbbb", "cccccccc"), a.observationsUsed);
        assertTrue(a.limitations.isEmpty());
        assertTrue(a.suggestedActions.isEmpty());
    }

    @Test
    void emptyLedgerReplacesAnswerWithRefusal() {
        GroundedAnswer a = generator.generate("X", registry);

        assertEquals(DegradationLevel.REFUSE, a.degradationLevel);
        assertEquals(en.refusal, a.content);
        assertFalse(a.content.contains("X"));
        assertEquals(List.of(en.suggestSpecifics, en.suggestDecompose), a.suggestedActions);
    }

    @Test
    void refusedAnswerKeepsClaimTextOutOfFormattedOutput() {
        add("aaaaaaaa", "web_search", 1.0, 60L);
        clock.advance(Duration.ofMinutes(5));
        String raw = "The capital of Atlantis is Poseidonia [aaaaaaaa], with five million residents.";
        List<Claim> claims = new ClaimExtractor().extractAndRecord(raw, registry);
        assertFalse(claims.isEmpty());

        GroundedAnswer a = generator.generate(raw, registry, claims);

        assertEquals(DegradationLevel.REFUSE, a.degradationLevel);
        assertTrue(a.highConfidenceParts.isEmpty());
        assertTrue(a.mediumConfidenceParts.isEmpty());
        assertTrue(a.lowConfidenceParts.isEmpty());
        assertEquals(claims, a.claims);
        assertFalse(a.toFormattedOutput().contains("Poseidonia"));
    }

    @Test
    void onlyExpiredEvidenceStillRefuses() {
        add("aaaaaaaa", "web_search", 1.0, 60L);
        clock.advance(Duration.ofMinutes(5));

        GroundedAnswer a = generator.generate("X", registry);
        assertEquals(DegradationLevel.REFUSE, a.degradationLevel);
        assertEquals(en.refusal, a.content);
        assertTrue(a.limitations.contains(String.format(en.limitExpired, 1)));
    }

    @Test
    void moderateEvidenceAppendsDisclaimer() {
        add("aaaaaaaa", "web_search", 0.6, null);

        GroundedAnswer a = generator.generate("X", registry);

        assertEquals(DegradationLevel.PARTIAL_WITH_UNCERTAINTY, a.degradationLevel);
        assertEquals("X" + en.partialDisclaimer, a.content);
        assertEquals(List.of(en.suggestMoreData), a.suggestedActions);
        assertTrue(a.limitations.contains(en.limitSingleSource));
    }

    @Test
    void partialWithEnoughObservationsSuggestsNothing() {
        add("aaaaaaaa", "web_search", 0.6, null);
        add("bbbbbbbb", "read_url", 0.6, null);
        add("cccccccc", "Bash", 0.6, null);

        GroundedAnswer a = generator.generate("X", registry);
        assertEquals(DegradationLevel.PARTIAL_WITH_UNCERTAINTY, a.degradationLevel);
        assertTrue(a.suggestedActions.isEmpty());
    }

    @Test
    void weakEvidenceWrapsAnswer() {
        add("aaaaaaaa", "web_search", 0.3, null);

        GroundedAnswer a = generator.generate("X", registry);

        assertEquals(DegradationLevel.REQUEST_MORE_INFO, a.degradationLevel);
        assertEquals(en.limitedPreamble + "X" + en.limitedPostamble, a.content);
        assertEquals(List.of(en.suggestSearch, en.suggestUserContext), a.suggestedActions);
    }

    @Test
    void claimsAreBucketedByRecomputedConfidence() {
        add("aaaaaaaa", "web_search", 1.0, null);
        add("bbbbbbbb", "read_url", 1.0, null);
        add("cccccccc", "Bash", 1.0, null);

        ClaimExtractor extractor = new ClaimExtractor();
        List<Claim> claims = extractor.extractAndRecord(
                "The value [aaaaaaaa] was recorded at noon today. "
                        + "Therefore the trend in [bbbbbbbb] points to steady growth. "
                        + "Perhaps the figure in [cccccccc] is going to rise. "
                        + "Perhaps the market will recover next quarter.",
                registry);
        assertEquals(4, claims.size());

        GroundedAnswer a = generator.generate("X", registry, claims);

        assertEquals(2, a.highConfidenceParts.size());
        assertEquals(1, a.mediumConfidenceParts.size());
        assertEquals(1, a.lowConfidenceParts.size());
        assertEquals("Perhaps the market will recover next quarter.", a.lowConfidenceParts.get(0));
        assertEquals(4, a.claims.size());
    }

    @Test
    void longClaimsAreExcerpted() {
        add("aaaaaaaa", "web_search", 1.0, null);
        Claim c = Claim.builder().createdAt(clock.instant()).statement("y".repeat(250)).sourceObservations(List.of("aaaaaaaa")).build();

        GroundedAnswer a = generator.generate("X", registry, List.of(c));
        assertEquals(100, a.highConfidenceParts.get(0).length());
    }

    @Test
    void nearExpiryAndExpiredAreReportedAsLimitations() {
        add("aaaaaaaa", "web_search", 1.0, 60L);
        clock.advance(Duration.ofSeconds(61));
        add("bbbbbbbb", "read_url", 1.0, 1_000L);
        add("cccccccc", "read_url", 1.0, 1_000L);

        GroundedAnswer a = generator.generate("X", registry);

        assertEquals(List.of(
                String.format(en.limitNearExpiry, "read_url"),
                String.format(en.limitExpired, 1),
                en.limitSingleSource), a.limitations);
    }

    @Test
    void formattedOutputKeepsSectionOrder() {
        add("aaaaaaaa", "web_search", 0.6, null);
        Claim c = Claim.builder().createdAt(clock.instant()).statement("the claim text").sourceObservations(List.of("aaaaaaaa")).build();

        String out = generator.generate("BODY", registry, List.of(c)).toFormattedOutput();

        int header = out.indexOf(en.headerPartial);
        int body = out.indexOf("BODY");
        int confidence = out.indexOf(en.sectionConfidence);
        int medium = out.indexOf(en.bucketMedium);
        int limitations = out.indexOf(en.sectionLimitations);
        int suggestions = out.indexOf(en.sectionSuggestions);

        assertEquals(0, header);
        assertTrue(header < body && body < confidence && confidence < medium
                && medium < limitations && limitations < suggestions, out);
        assertFalse(out.contains(en.bucketHigh));
        assertFalse(out.contains(en.bucketLow));
    }

    @Test
    void fullAnswerOmitsConfidenceBreakdown() {
        add("aaaaaaaa", "web_search", 1.0, null);
        Claim c = Claim.builder().createdAt(clock.instant()).statement("the claim text").sourceObservations(List.of("aaaaaaaa")).build();

        String out = generator.generate("BODY", registry, List.of(c)).toFormattedOutput();
        assertTrue(out.startsWith(en.headerFull + "BODY"));
        assertFalse(out.contains(en.sectionConfidence));
    }

    @Test
    void chineseRendition() {
        GroundedAnswerGenerator zh = new GroundedAnswerGenerator(ProvenancePolicy.defaults(), AnswerTemplates.forLocale("zh-CN"));
        GroundedAnswer a = zh.generate("X", registry);
        assertEquals(AnswerTemplates.chinese().refusal, a.content);
        assertTrue(a.toFormattedOutput().startsWith(AnswerTemplates.chinese().headerRefuse));
    }

    @Test
    void customThresholdsChangeTheLevel() {
        add("aaaaaaaa", "web_search", 0.6, null);
        ProvenancePolicy lenient = ProvenancePolicy.builder().fullConfidence(0.5).build();
        GroundedAnswer a = new GroundedAnswerGenerator(lenient, null).generate("X", registry);
        assertEquals(DegradationLevel.FULL_ANSWER, a.degradationLevel);
    }

    @Test
    void provenanceSummaryListsValidAndExpired() {
        add("aaaaaaaa", "web_search", 0.9, 10L);
        clock.advance(Duration.ofSeconds(11));
        add("bbbbbbbb", "read_url", 0.75, null);

        String s = generator.formatProvenanceSummary(registry);
        assertTrue(s.startsWith(en.summaryTitle));
        assertTrue(s.contains(String.format(en.summaryValid, 1)));
        assertTrue(s.contains("[bbbbbbbb] read_url (75%)"));
        assertTrue(s.endsWith(String.format(en.summaryExpired, 1)));

        assertTrue(generator.formatProvenanceSummary(new ProvenanceRegistry(clock)).contains(en.summaryNone));
    }
}
