package org.calista.canary.ai.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.canary.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Append-only JSONL audit log shared by the sessions of one kernel. */
public final class EventStore {

    private static final Logger log = LogManager.getLogger(EventStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public synchronized void append(SessionEvent e) throws IOException {
        String line = mapper.writeValueAsString(e);
        io.appendJsonl(file, line);
    }

    public List<String> readAllRawLines() throws IOException {
        if (!io.exists(file)) return List.of();
        return io.readJsonl(file);
    }

    /** Parsed events, optionally for one session only ({@code sessionId == null} keeps all). */
    public List<SessionEvent> readAll(String sessionId) throws IOException {
        ArrayList<SessionEvent> out = new ArrayList<>();
        for (String line : readAllRawLines()) {
            SessionEvent e;
            try {
                e = mapper.readValue(line, SessionEvent.class);
            } catch (IOException bad) {
                log.warn("event log: skip broken line in {}: {}", file, bad.getMessage());
                continue;
            }
            if (sessionId == null || sessionId.equals(e.sessionId)) out.add(e);
        }
        return out;
    }
}
