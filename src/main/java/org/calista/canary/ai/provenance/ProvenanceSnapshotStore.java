package org.calista.canary.ai.provenance;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.canary.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * ProvenanceSnapshotStore — optional JSONL export/import of a session ledger.
 *
 * <p>
 * Format: first line {"_schema":"provenance-jsonl-v1"}, then one entry per line with a
 * {@code "kind"} of {@code observation} or {@code claim} and the entry's map form.
 * Written atomically through {@link FileIO}. A broken row is skipped, not fatal.
 * </p>
 */
public final class ProvenanceSnapshotStore {

    private static final Logger log = LogManager.getLogger(ProvenanceSnapshotStore.class);

    private static final String SCHEMA_KEY = "_schema";
    private static final String SCHEMA_LINE = "{\"" + SCHEMA_KEY + "\":\"provenance-jsonl-v1\"}";
    private static final TypeReference<LinkedHashMap<String, Object>> ROW = new TypeReference<>() {};

    private final FileIO io;
    private final ObjectMapper mapper;

    public ProvenanceSnapshotStore(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void save(ProvenanceRegistry registry, Path file) throws IOException {
        Objects.requireNonNull(registry, "registry");

        FileIO.WriterHandle h = io.openWriter(file);
        try {
            h.writer.write(SCHEMA_LINE);
            h.writer.newLine();

            for (Observation o : registry.observations().values()) {
                writeRow(h, "observation", o.toMap());
            }
            for (Claim c : registry.claims().values()) {
                writeRow(h, "claim", c.toMap());
            }
            io.commit(h);
        } catch (IOException e) {
            io.rollback(h);
            throw e;
        } catch (RuntimeException e) {
            io.rollback(h);
            throw new IOException("Failed to save provenance snapshot: " + file, e);
        }
        log.info("provenance snapshot saved file={} observations={} claims={}",
                file, registry.observationCount(), registry.claimCount());
    }

    private void writeRow(FileIO.WriterHandle h, String kind, Map<String, Object> body) throws IOException {
        LinkedHashMap<String, Object> row = new LinkedHashMap<>();
        row.put("kind", kind);
        row.putAll(body);
        h.writer.write(mapper.writeValueAsString(row));
        h.writer.newLine();
    }

    /**
     * Rebuilds a registry from a snapshot file. Stored claim confidences are kept until consulted.
     */
    public ProvenanceRegistry load(Path file, Clock clock, ProvenancePolicy policy) throws IOException {
        LinkedHashMap<String, Object> observations = new LinkedHashMap<>();
        LinkedHashMap<String, Object> claims = new LinkedHashMap<>();
        int skipped = 0;

        try (Stream<String> lines = io.jsonlStream(file)) {
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                String line = it.next();
                try {
                    LinkedHashMap<String, Object> row = mapper.readValue(line, ROW);
                    if (row.containsKey(SCHEMA_KEY)) continue;
                    Object kind = row.remove("kind");
                    Object id = row.get("id");
                    if (id == null) {
                        skipped++;
                        continue;
                    }
                    if ("observation".equals(kind)) observations.put(String.valueOf(id), row);
                    else if ("claim".equals(kind)) claims.put(String.valueOf(id), row);
                    else skipped++;
                } catch (IOException rowErr) {
                    skipped++;
                    log.warn("provenance snapshot: skip broken row in {}: {}", file, rowErr.getMessage());
                }
            }
        }

        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("observations", observations);
        m.put("claims", claims);
        ProvenanceRegistry registry = ProvenanceRegistry.fromMap(m, clock, policy);
        log.info("provenance snapshot loaded file={} observations={} claims={} skipped={}",
                file, registry.observationCount(), registry.claimCount(), skipped);
        return registry;
    }
}
