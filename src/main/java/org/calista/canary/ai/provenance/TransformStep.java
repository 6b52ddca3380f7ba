package org.calista.canary.ai.provenance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One recorded reasoning hop from inputs (observations or claims) to a conclusion.
 */
public final class TransformStep {

    public final TransformOperation operation;
    public final String description;
    public final List<String> inputIds;

    /** Confidence adjustment in [-1, 1]. */
    public final double confidenceDelta;

    public TransformStep(TransformOperation operation, String description, List<String> inputIds, double confidenceDelta) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.description = description == null ? "" : description;
        this.inputIds = inputIds == null ? List.of() : List.copyOf(inputIds);
        this.confidenceDelta = clampDelta(confidenceDelta);
    }

    public static TransformStep extract(String description, List<String> inputIds) {
        return new TransformStep(TransformOperation.EXTRACT, description, inputIds, 0.0);
    }

    public static TransformStep infer(String description, List<String> inputIds, double delta) {
        return new TransformStep(TransformOperation.INFER, description, inputIds, delta);
    }

    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("operation", operation.wire());
        m.put("description", description);
        m.put("input_ids", inputIds);
        m.put("confidence_delta", confidenceDelta);
        return m;
    }

    public static TransformStep fromMap(Map<String, ?> m) {
        Double d = WireMaps.dbl(m, "confidence_delta");
        return new TransformStep(
                TransformOperation.fromWire(WireMaps.str(m, "operation", null)),
                WireMaps.str(m, "description", ""),
                WireMaps.strings(m, "input_ids"),
                d == null ? 0.0 : d
        );
    }

    private static double clampDelta(double d) {
        if (!Double.isFinite(d)) return 0.0;
        if (d < -1.0) return -1.0;
        if (d > 1.0) return 1.0;
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransformStep t)) return false;
        return operation == t.operation
                && Double.compare(confidenceDelta, t.confidenceDelta) == 0
                && description.equals(t.description)
                && inputIds.equals(t.inputIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, description, inputIds, confidenceDelta);
    }

    @Override
    public String toString() {
        return "TransformStep{" + operation.wire() + ", delta=" + confidenceDelta + ", inputs=" + inputIds + '}';
    }
}
