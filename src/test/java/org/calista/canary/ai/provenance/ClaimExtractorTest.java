package org.calista.canary.ai.provenance;

import org.calista.canary.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaimExtractorTest {

    private final ClaimExtractor extractor = new ClaimExtractor();

    private ExtractedClaim single(String text) {
        List<ExtractedClaim> xs = extractor.extractClaims(text);
        assertEquals(1, xs.size(), () -> "claims: " + xs);
        return xs.get(0);
    }

    @Test
    void citedFactPhraseIsHighConfidenceFact() {
        ExtractedClaim c = single("According to the search results [a1b2c3d4], the population is 2.1 million");
        assertEquals(ClaimType.FACT, c.claimType);
        assertEquals(ConfidenceHint.HIGH, c.confidenceHint);
        assertEquals(List.of("a1b2c3d4"), c.observationRefs);
    }

    @Test
    void uncitedHypothesisIsLow() {
        ExtractedClaim c = single("Perhaps the market will recover next quarter");
        assertEquals(ClaimType.HYPOTHESIS, c.claimType);
        assertEquals(ConfidenceHint.LOW, c.confidenceHint);
        assertFalse(c.hasRefs());
    }

    @Test
    void citedInferenceIsMedium() {
        ExtractedClaim c = single("Therefore the trend in [a1b2c3d4] points to steady growth");
        assertEquals(ClaimType.INFERENCE, c.claimType);
        assertEquals(ConfidenceHint.MEDIUM, c.confidenceHint);
    }

    @Test
    void citationAloneMakesAFact() {
        ExtractedClaim c = single("The value [a1b2c3d4] was recorded at noon today");
        assertEquals(ClaimType.FACT, c.claimType);
        assertEquals(ConfidenceHint.HIGH, c.confidenceHint);
    }

    @Test
    void uncitedPlainStatementDegradesToHypothesis() {
        ExtractedClaim c = single("The bridge opened to traffic in the spring");
        assertEquals(ClaimType.HYPOTHESIS, c.claimType);
        assertEquals(ConfidenceHint.LOW, c.confidenceHint);
    }

    @Test
    void chinesePhrasesAreRecognized() {
        ExtractedClaim c = single("根据搜索结果[a1b2c3d4]，人口大约为两百万左右的规模");
        assertEquals(ClaimType.FACT, c.claimType);

        ExtractedClaim h = single("如果明天下雨那么比赛很可能会被推迟举行");
        assertEquals(ClaimType.HYPOTHESIS, h.claimType);
    }

    @Test
    void splitsOnSentenceTerminals() {
        List<ExtractedClaim> xs = extractor.extractClaims(
                "The first statement is long enough. The second statement is long enough too!\n"
                        + "第三个陈述的长度也已经足够长了吧。");
        assertEquals(3, xs.size());
    }

    @Test
    void skipsNoise() {
        assertTrue(extractor.extractClaims("").isEmpty());
        assertTrue(extractor.extractClaims(null).isEmpty());
        assertTrue(extractor.extractClaims("Too short.").isEmpty());
        assertTrue(extractor.extractClaims("Is this really a statement of fact?").isEmpty());
        assertTrue(extractor.extractClaims("## Results of the search so far").isEmpty());
        assertTrue(extractor.extractClaims("--- separator between sections ---").isEmpty());
        assertTrue(extractor.extractClaims("【结论】这里是格式化的标题内容").isEmpty());
    }

    @Test
    void referencesAreDistinctInOrder() {
        assertEquals(List.of("bbbbbbbb", "aaaaaaaa"),
                ClaimExtractor.observationRefs("see [bbbbbbbb] and [aaaaaaaa] and again [bbbbbbbb]"));
        assertTrue(ClaimExtractor.observationRefs("[short] [waytoolong123]").isEmpty());
    }

    @Test
    void builtClaimsCarryTheConfiguredDecay() {
        ProvenanceRegistry registry = new ProvenanceRegistry(new MutableClock());
        registry.addObservation(Observation.builder().id("a1b2c3d4").sourceId("web_search")
                .timestamp(registry.now()).confidence(1.0).build());

        Claim fact = extractor.buildClaim(single("The value [a1b2c3d4] was recorded at noon today"), registry);
        Claim inference = extractor.buildClaim(single("Therefore the trend in [a1b2c3d4] points to steady growth"), registry);
        Claim hypothesis = extractor.buildClaim(single("Perhaps the value [a1b2c3d4] is going to rise"), registry);

        assertEquals(1.0, fact.confidence(), 1e-9);
        assertEquals(0.9, inference.confidence(), 1e-9);
        assertEquals(0.7, hypothesis.confidence(), 1e-9);

        assertEquals(1, fact.transformChain.size());
        assertEquals(TransformOperation.EXTRACT, inference.transformChain.get(0).operation);
        assertEquals(TransformOperation.INFER, inference.transformChain.get(1).operation);
    }

    @Test
    void uncitedClaimHasNoConfidence() {
        ProvenanceRegistry registry = new ProvenanceRegistry(new MutableClock());
        Claim c = extractor.buildClaim(single("Perhaps the market will recover next quarter"), registry);
        assertEquals(0.0, c.confidence(), 1e-9);
        assertEquals(TransformOperation.EXTRACT, c.transformChain.get(0).operation);
    }

    @Test
    void extractAndRecordStoresEveryClaim() {
        ProvenanceRegistry registry = new ProvenanceRegistry(new MutableClock());
        List<Claim> claims = extractor.extractAndRecord(
                "The first statement is long enough. Perhaps the second one is a guess.", registry);
        assertEquals(2, claims.size());
        assertEquals(2, registry.claimCount());
    }

    @Test
    void customPhrasesAndLength() {
        ClaimExtractor.Config cfg = new ClaimExtractor.Config();
        cfg.minSentenceLength = 5;
        cfg.hypothesisPatterns = List.of("\\bmight\\b");
        ClaimExtractor custom = new ClaimExtractor(cfg, ProvenancePolicy.defaults());

        List<ExtractedClaim> xs = custom.extractClaims("It might rain");
        assertEquals(1, xs.size());
        assertEquals(ClaimType.HYPOTHESIS, xs.get(0).claimType);
    }
}
