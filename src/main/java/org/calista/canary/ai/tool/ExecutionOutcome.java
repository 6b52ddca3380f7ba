package org.calista.canary.ai.tool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.canary.ai.provenance.Observation;
import org.calista.canary.ai.provenance.ObservationType;

import java.time.Instant;
import java.util.Objects;

/**
 * What a tool executor hands back: either bare text or a result that carries its own provenance.
 * Resolved once, by {@link ToolObservationRecorder}, through {@link #toObservation}.
 */
public sealed interface ExecutionOutcome permits ExecutionOutcome.Plain, ExecutionOutcome.WithProvenance {

    /** Text the model sees next. */
    String text();

    /**
     * The single observation this outcome contributes to the ledger.
     *
     * @param now ledger time, used when the outcome does not carry its own timestamp
     */
    Observation toObservation(String toolName, ToolCatalog catalog, Instant now);

    static ExecutionOutcome plain(String text) {
        return new Plain(text);
    }

    static ExecutionOutcome withProvenance(ToolResult result) {
        return new WithProvenance(result);
    }

    /** Bare text, wrapped using the tool's catalog entry; unknown tools get a TOOL_RETURN at the type default. */
    final class Plain implements ExecutionOutcome {

        private static final Logger log = LogManager.getLogger(Plain.class);

        public final String text;

        public Plain(String text) {
            this.text = text == null ? "" : text;
        }

        @Override
        public String text() {
            return text;
        }

        @Override
        public Observation toObservation(String toolName, ToolCatalog catalog, Instant now) {
            Objects.requireNonNull(catalog, "catalog");
            ToolSpec spec = catalog.find(toolName).orElse(null);
            if (spec == null) {
                log.debug("tool {} not in catalog, using TOOL_RETURN defaults", toolName);
                return Observation.builder()
                        .content(ToolResult.ledgerExcerpt(text))
                        .sourceType(ObservationType.TOOL_RETURN)
                        .sourceId(toolName)
                        .timestamp(now)
                        .build();
            }

            return Observation.builder()
                    .content(ToolResult.ledgerExcerpt(text))
                    .sourceType(spec.observationType)
                    .sourceId(spec.observationType == ObservationType.USER_INPUT ? "user" : spec.name)
                    .timestamp(now)
                    .confidence(spec.defaultConfidence)
                    .ttlSeconds(spec.ttlSeconds)
                    .meta("tool", spec.name)
                    .build();
        }

        @Override
        public String toString() {
            return "Plain{" + text.length() + " chars}";
        }
    }

    /** Carries a {@link ToolResult} whose observation is stored as is. */
    final class WithProvenance implements ExecutionOutcome {
        public final ToolResult result;

        public WithProvenance(ToolResult result) {
            this.result = Objects.requireNonNull(result, "result");
        }

        @Override
        public String text() {
            return result.content;
        }

        @Override
        public Observation toObservation(String toolName, ToolCatalog catalog, Instant now) {
            return result.observation;
        }

        @Override
        public String toString() {
            return "WithProvenance{" + result + '}';
        }
    }
}
