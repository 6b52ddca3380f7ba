package org.calista.canary.ai.tool;

import org.calista.canary.ai.provenance.Observation;
import org.calista.canary.ai.provenance.ObservationType;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Tool output together with the observation it contributes to the ledger.
 *
 * <p>Failures are values, not exceptions: {@link #fromError} yields a zero-confidence
 * observation scoped {@code "error"}.</p>
 */
public final class ToolResult {

    /** Observation content is capped; the full text stays in {@link #content}. */
    public static final int OBSERVATION_CONTENT_CHARS = 500;

    public static final String ERROR_SCOPE = "error";

    public final String content;
    public final Observation observation;
    public final boolean success;

    /** Null on success. */
    public final String errorMessage;

    public ToolResult(String content, Observation observation, boolean success, String errorMessage) {
        this.content = content == null ? "" : content;
        this.observation = Objects.requireNonNull(observation, "observation");
        this.success = success;
        this.errorMessage = errorMessage;
    }

    /** @param at ledger time, normally {@code registry.now()} */
    public static ToolResult fromSuccess(String content, String toolName, double confidence, Instant at) {
        return fromSuccess(content, toolName, confidence, null, "", Map.of(), at);
    }

    public static ToolResult fromSuccess(String content,
                                         String toolName,
                                         double confidence,
                                         Long ttlSeconds,
                                         String scope,
                                         Map<String, Object> metadata,
                                         Instant at) {
        String text = content == null ? "" : content;
        Observation obs = Observation.builder()
                .content(ledgerExcerpt(text))
                .sourceType(ObservationType.TOOL_RETURN)
                .sourceId(toolName)
                .timestamp(at)
                .confidence(confidence)
                .scope(scope)
                .ttlSeconds(ttlSeconds)
                .metadata(metadata)
                .build();
        return new ToolResult(text, obs, true, null);
    }

    public static ToolResult fromError(String errorMessage, String toolName, Instant at) {
        String msg = errorMessage == null ? "" : errorMessage;
        Observation obs = Observation.builder()
                .content("tool execution failed: " + msg)
                .sourceType(ObservationType.TOOL_RETURN)
                .sourceId(toolName)
                .timestamp(at)
                .confidence(0.0)
                .scope(ERROR_SCOPE)
                .meta("error", msg)
                .build();
        return new ToolResult(msg, obs, false, msg);
    }

    /** First {@link #OBSERVATION_CONTENT_CHARS} characters. */
    static String ledgerExcerpt(String s) {
        return s.length() <= OBSERVATION_CONTENT_CHARS ? s : s.substring(0, OBSERVATION_CONTENT_CHARS);
    }

    @Override
    public String toString() {
        return "ToolResult{" + (success ? "ok" : "error=" + errorMessage)
                + ", obs=" + observation.id + '}';
    }
}
