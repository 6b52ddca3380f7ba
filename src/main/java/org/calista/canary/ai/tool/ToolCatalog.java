package org.calista.canary.ai.tool;

import org.calista.canary.ai.cognitive.ToolCandidate;
import org.calista.canary.ai.cognitive.ToolRisk;
import org.calista.canary.ai.provenance.ObservationType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of known tools, built explicitly per kernel. Registration order is kept.
 */
public final class ToolCatalog {

    private final Map<String, ToolSpec> specs;

    private ToolCatalog(Map<String, ToolSpec> specs) {
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ToolCatalog defaults() {
        return builder().withDefaults().build();
    }

    public Optional<ToolSpec> find(String name) {
        return Optional.ofNullable(name == null ? null : specs.get(name));
    }

    public boolean contains(String name) {
        return name != null && specs.containsKey(name);
    }

    public Collection<ToolSpec> specs() {
        return specs.values();
    }

    public int size() {
        return specs.size();
    }

    /** Input for {@code MinimalCommitmentPolicy.rankTools}, in registration order. */
    public List<ToolCandidate> candidates() {
        ArrayList<ToolCandidate> out = new ArrayList<>(specs.size());
        for (ToolSpec s : specs.values()) out.add(s.candidate());
        return out;
    }

    public static final class Builder {
        private final LinkedHashMap<String, ToolSpec> specs = new LinkedHashMap<>();

        private Builder() {}

        /** Re-registering a name replaces the earlier entry in place. */
        public Builder register(ToolSpec spec) {
            Objects.requireNonNull(spec, "spec");
            specs.put(spec.name, spec);
            return this;
        }

        public Builder withDefaults() {
            register(ToolSpec.builder("web_search").category("web").risk(ToolRisk.SAFE)
                    .defaultConfidence(1.0).ttlSeconds(3600).build());
            register(ToolSpec.builder("read_url").category("web").risk(ToolRisk.SAFE)
                    .defaultConfidence(1.0).ttlSeconds(7200).build());
            register(ToolSpec.builder("python_exec").category("compute").risk(ToolRisk.MEDIUM)
                    .defaultConfidence(1.0).build());
            register(ToolSpec.builder("Bash").category("shell").risk(ToolRisk.MEDIUM)
                    .defaultConfidence(0.9).build());
            register(ToolSpec.builder("Read").category("filesystem").risk(ToolRisk.SAFE)
                    .defaultConfidence(1.0).build());
            register(ToolSpec.builder("Glob").category("filesystem").risk(ToolRisk.SAFE)
                    .defaultConfidence(1.0).build());
            register(ToolSpec.builder("ask_user").category("interaction").risk(ToolRisk.SAFE)
                    .observationType(ObservationType.USER_INPUT).build());
            return this;
        }

        public ToolCatalog build() {
            return new ToolCatalog(specs);
        }
    }
}
