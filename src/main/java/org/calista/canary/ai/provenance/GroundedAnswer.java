package org.calista.canary.ai.provenance;

import java.util.List;
import java.util.Objects;

/**
 * Final user-facing answer with its degradation level and provenance breakdown.
 *
 * <p>{@link #content} is already degraded: callers may show it verbatim.</p>
 */
public final class GroundedAnswer {

    public final String content;
    public final DegradationLevel degradationLevel;
    public final List<String> observationsUsed;
    public final List<Claim> claims;
    public final List<String> highConfidenceParts;
    public final List<String> mediumConfidenceParts;
    public final List<String> lowConfidenceParts;
    public final List<String> limitations;
    public final List<String> suggestedActions;

    private final AnswerTemplates templates;

    public GroundedAnswer(String content,
                          DegradationLevel degradationLevel,
                          List<String> observationsUsed,
                          List<Claim> claims,
                          List<String> highConfidenceParts,
                          List<String> mediumConfidenceParts,
                          List<String> lowConfidenceParts,
                          List<String> limitations,
                          List<String> suggestedActions,
                          AnswerTemplates templates) {
        this.content = content == null ? "" : content;
        this.degradationLevel = Objects.requireNonNull(degradationLevel, "degradationLevel");
        this.observationsUsed = copy(observationsUsed);
        this.claims = claims == null ? List.of() : List.copyOf(claims);
        this.highConfidenceParts = copy(highConfidenceParts);
        this.mediumConfidenceParts = copy(mediumConfidenceParts);
        this.lowConfidenceParts = copy(lowConfidenceParts);
        this.limitations = copy(limitations);
        this.suggestedActions = copy(suggestedActions);
        this.templates = templates == null ? AnswerTemplates.english() : templates;
    }

    /**
     * Header, content, confidence breakdown (skipped for FULL_ANSWER), limitations, suggestions.
     * Empty sections are omitted.
     */
    public String toFormattedOutput() {
        StringBuilder sb = new StringBuilder(content.length() + 512);

        sb.append(templates.header(degradationLevel));
        sb.append(content);

        if (degradationLevel != DegradationLevel.FULL_ANSWER) {
            sb.append(templates.sectionConfidence);
            appendBucket(sb, templates.bucketHigh, highConfidenceParts);
            appendBucket(sb, templates.bucketMedium, mediumConfidenceParts);
            appendBucket(sb, templates.bucketLow, lowConfidenceParts);
        }

        if (!limitations.isEmpty()) {
            sb.append(templates.sectionLimitations);
            for (String l : limitations) sb.append("\n- ").append(l);
        }

        if (!suggestedActions.isEmpty()) {
            sb.append(templates.sectionSuggestions);
            for (String a : suggestedActions) sb.append("\n- ").append(a);
        }

        return sb.toString();
    }

    private static void appendBucket(StringBuilder sb, String title, List<String> parts) {
        if (parts.isEmpty()) return;
        sb.append(title);
        for (String p : parts) sb.append("\n  - ").append(p);
    }

    private static List<String> copy(List<String> xs) {
        return xs == null ? List.of() : List.copyOf(xs);
    }

    @Override
    public String toString() {
        return "GroundedAnswer{level=" + degradationLevel
                + ", len=" + content.length()
                + ", observations=" + observationsUsed.size()
                + ", claims=" + claims.size()
                + '}';
    }
}
