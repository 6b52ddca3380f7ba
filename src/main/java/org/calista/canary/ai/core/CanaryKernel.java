package org.calista.canary.ai.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.canary.ai.cognitive.MinimalCommitmentPolicy;
import org.calista.canary.ai.cognitive.StrategyGate;
import org.calista.canary.ai.events.EventStore;
import org.calista.canary.ai.provenance.AnswerTemplates;
import org.calista.canary.ai.provenance.ClaimExtractor;
import org.calista.canary.ai.provenance.GroundedAnswerGenerator;
import org.calista.canary.ai.provenance.ProvenancePolicy;
import org.calista.canary.ai.provenance.ProvenanceSnapshotStore;
import org.calista.canary.ai.tool.ToolCatalog;
import org.calista.canary.ai.tool.ToolObservationRecorder;
import org.calista.canary.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CanaryKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config, wire the stateless collaborators
 *   2) openSession(goal) -> one ledger + one cognitive state per problem
 *   3) close()           -> refuses new sessions
 *
 * Everything shared here is immutable or stateless; mutable state lives in {@link ProblemSession}.
 */
public final class CanaryKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CanaryKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final CanaryConfig cfg;
    private final Clock clock;

    private final ProvenancePolicy policy;
    private final ClaimExtractor extractor;
    private final GroundedAnswerGenerator generator;
    private final StrategyGate gate;
    private final MinimalCommitmentPolicy commitment;
    private final ToolObservationRecorder recorder;

    private final EventStore events; // nullable: audit log disabled
    private final ProvenanceSnapshotStore snapshots;

    private final AtomicInteger openSessions = new AtomicInteger();
    private volatile boolean closed = false;

    private CanaryKernel(FileIO io,
                         ObjectMapper mapper,
                         CanaryConfig cfg,
                         Clock clock,
                         ToolCatalog catalog,
                         MinimalCommitmentPolicy commitment,
                         EventStore events) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.policy = cfg.toPolicy();
        AnswerTemplates templates = cfg.toTemplates();
        this.extractor = new ClaimExtractor(cfg.toExtractorConfig(), policy);
        this.generator = new GroundedAnswerGenerator(policy, templates);
        this.gate = new StrategyGate(cfg.toGateConfig());
        this.commitment = Objects.requireNonNull(commitment, "commitment");
        this.recorder = new ToolObservationRecorder(Objects.requireNonNull(catalog, "catalog"));

        this.events = events;
        this.snapshots = new ProvenanceSnapshotStore(io, mapper);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private Clock clock = Clock.systemUTC();
        private ToolCatalog catalog;
        private MinimalCommitmentPolicy commitment;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder toolCatalog(ToolCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        public Builder commitmentPolicy(MinimalCommitmentPolicy commitment) {
            this.commitment = Objects.requireNonNull(commitment, "commitment");
            return this;
        }

        public CanaryKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            CanaryConfig cfg = CanaryConfig.loadOrCreate(external, cfgPath, om);

            // Runtime data dir; relative baseDir is taken against configRoot
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, charset, true);
            io.ensureBaseDir();

            EventStore events = cfg.sessions.eventLogEnabled
                    ? new EventStore(io, om, io.resolve(cfg.sessions.eventLogFile))
                    : null;

            CanaryKernel k = new CanaryKernel(io, om, cfg, clock,
                    catalog != null ? catalog : ToolCatalog.defaults(),
                    commitment != null ? commitment : new MinimalCommitmentPolicy(),
                    events);

            k.logCreated(cfgPath);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    /** A fresh, isolated problem session. Sessions never share a ledger. */
    public ProblemSession openSession(String goal) {
        if (closed) throw new IllegalStateException("CanaryKernel is closed");
        ProblemSession s = new ProblemSession(this, goal);
        int n = openSessions.incrementAndGet();
        log.debug("session {} opened (open={}): {}", s.id(), n, s.goal());
        return s;
    }

    void sessionClosed(ProblemSession s) {
        int n = openSessions.decrementAndGet();
        log.debug("session {} closed (open={})", s.id(), n);
    }

    public int openSessionCount() {
        return openSessions.get();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public CanaryConfig config() { return cfg; }
    public Clock clock() { return clock; }
    public ProvenancePolicy policy() { return policy; }
    public ClaimExtractor extractor() { return extractor; }
    public GroundedAnswerGenerator answerGenerator() { return generator; }
    public StrategyGate strategyGate() { return gate; }
    public MinimalCommitmentPolicy commitmentPolicy() { return commitment; }
    public ToolObservationRecorder recorder() { return recorder; }
    public ProvenanceSnapshotStore snapshotStore() { return snapshots; }

    /** Null when the audit log is disabled. */
    public EventStore eventStore() { return events; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        int open = openSessions.get();
        if (open > 0) log.warn("CanaryKernel closed with {} session(s) still open", open);
        else log.info("CanaryKernel closed");
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("CanaryKernel created: config={}, baseDir={}, events={}, locale={}, tools={}",
                cfgPath, io.baseDir(), events != null, cfg.answer.locale, recorder.catalog().size());
    }
}
