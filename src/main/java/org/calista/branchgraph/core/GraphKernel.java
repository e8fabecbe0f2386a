package org.calista.branchgraph.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.branchgraph.circular.CircularPattern;
import org.calista.branchgraph.embed.EmbeddingProvider;
import org.calista.branchgraph.embed.impl.HashingEmbeddingProvider;
import org.calista.branchgraph.error.ErrorCode;
import org.calista.branchgraph.error.GraphException;
import org.calista.branchgraph.error.Outcome;
import org.calista.branchgraph.evaluate.BranchReview;
import org.calista.branchgraph.evaluate.DifferentialEvaluator;
import org.calista.branchgraph.evaluate.EvaluationResult;
import org.calista.branchgraph.events.EventLogStore;
import org.calista.branchgraph.events.GraphEvent;
import org.calista.branchgraph.graph.AddThoughtResult;
import org.calista.branchgraph.graph.BranchAnalytics;
import org.calista.branchgraph.graph.BranchGraph;
import org.calista.branchgraph.graph.BranchState;
import org.calista.branchgraph.graph.GraphStatistics;
import org.calista.branchgraph.graph.ThoughtInput;
import org.calista.branchgraph.io.FileIO;
import org.calista.branchgraph.text.SimpleTokenizer;
import org.calista.branchgraph.text.TermExtractor;
import org.calista.branchgraph.text.TextAnalyzer;
import org.calista.branchgraph.text.impl.PatternTextAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * GraphKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile | config) -> config + IO + graph + evaluator (+ event log, restored if present)
 *   2) use                        -> Outcome-returning facade or direct graph()/evaluator()
 *   3) close()                    -> flush events not yet persisted
 *
 * With {@code events.persist} on, every mutation through the facade appends the new events to the
 * JSONL log before its Outcome is returned. A persist failure fails the Outcome (retryable); the
 * unwritten events stay pending and go out with the next mutation.
 */
public final class GraphKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GraphKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final EngineConfig cfg;
    private final EmbeddingProvider embeddingProvider;
    private final TextAnalyzer textAnalyzer;
    private final Clock clock;
    private final EventLogStore eventLog;

    private volatile BranchGraph graph;
    private volatile DifferentialEvaluator evaluator;
    private long persistedCursor;

    private GraphKernel(FileIO io, ObjectMapper mapper, EngineConfig cfg, EmbeddingProvider embeddingProvider,
                        TextAnalyzer textAnalyzer, Clock clock, EventLogStore eventLog) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.textAnalyzer = Objects.requireNonNull(textAnalyzer, "textAnalyzer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventLog = eventLog; // null when persistence is off

        this.graph = newGraphBuilder().build();
        this.evaluator = new DifferentialEvaluator(graph, cfg, embeddingProvider);
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
         * Root directory where config lives. A relative {@code baseDir} from the config is resolved against it.
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private EmbeddingProvider embeddingProvider;
        private TextAnalyzer textAnalyzer;
        private Clock clock = Clock.systemUTC();

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

        public Builder embeddingProvider(EmbeddingProvider provider) {
            this.embeddingProvider = Objects.requireNonNull(provider, "embeddingProvider");
            return this;
        }

        public Builder textAnalyzer(TextAnalyzer analyzer) {
            this.textAnalyzer = Objects.requireNonNull(analyzer, "textAnalyzer");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Loads the config (creating a default one if missing) and builds the kernel.
         */
        public GraphKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");
            ObjectMapper om = mapper != null ? mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, fileOptions());
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            EngineConfig cfg = EngineConfig.loadOrCreate(external, cfgPath, om);

            GraphKernel k = create(cfg, om);
            log.info("GraphKernel created: config={}, baseDir={}, persist={}", cfgPath, k.io.baseDir(), cfg.events.persist);
            return k;
        }

        public GraphKernel build(EngineConfig config) throws IOException {
            Objects.requireNonNull(config, "config");
            GraphKernel k = create(config.validate(), mapper != null ? mapper : defaultMapper());
            log.info("GraphKernel created: baseDir={}, persist={}", k.io.baseDir(), config.events.persist);
            return k;
        }

        private GraphKernel create(EngineConfig cfg, ObjectMapper om) throws IOException {
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, storeOptions(cfg.events));

            EmbeddingProvider provider = embeddingProvider != null
                    ? embeddingProvider
                    : new HashingEmbeddingProvider(new TermExtractor(SimpleTokenizer.INSTANCE, cfg.text.stopWords),
                    cfg.embedding.dimension);
            TextAnalyzer analyzer = textAnalyzer != null ? textAnalyzer : new PatternTextAnalyzer();

            EventLogStore events = cfg.events.persist ? new EventLogStore(io, om, io.resolve(cfg.events.logFile)) : null;

            GraphKernel k = new GraphKernel(io, om, cfg, provider, analyzer, clock, events);
            if (events != null) k.restore();
            return k;
        }

        private FileIO.Options fileOptions() {
            return FileIO.Options.builder().charset(charset).build();
        }

        private FileIO.Options storeOptions(EngineConfig.Events ev) {
            return FileIO.Options.builder()
                    .charset(charset)
                    .lockWrites(ev.lockWrites)
                    .lockTimeout(Duration.ofMillis(ev.lockTimeoutMs))
                    .fsyncOnCommit(ev.fsync)
                    .build();
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    /**
     * Rebuilds graph and evaluator from the event log. An empty or missing log starts a fresh graph.
     * The evaluation goal survives.
     *
     * @throws GraphException when persistence is off or the log is not a valid history
     */
    public synchronized void restore() throws IOException {
        if (eventLog == null) {
            throw new GraphException(ErrorCode.CONFIGURATION_ERROR, "event persistence is disabled");
        }
        List<GraphEvent> history = eventLog.readAll();
        String goal = evaluator.goal().orElse(null);

        if (history.isEmpty()) {
            graph = newGraphBuilder().build();
            persistedCursor = 0;
        } else {
            graph = newGraphBuilder().replay(history);
            persistedCursor = history.size();
        }
        evaluator = new DifferentialEvaluator(graph, cfg, embeddingProvider);
        if (goal != null) evaluator.setGoal(goal);

        log.info("GraphKernel restored {} event(s) from {}", history.size(), eventLog.file());
        persistPending();
    }

    /**
     * Appends events not yet written to the log. No-op when persistence is off.
     *
     * @throws GraphException ({@link ErrorCode#INTERNAL_ERROR}) on I/O failure; nothing is lost
     */
    public synchronized void persistPending() {
        if (eventLog == null) return;
        List<GraphEvent> pending = graph.getEventsSince(persistedCursor);
        if (pending.isEmpty()) return;
        try {
            eventLog.appendAll(pending);
        } catch (IOException e) {
            throw new GraphException(ErrorCode.INTERNAL_ERROR, "failed to persist events: " + e.getMessage(), e);
        }
        persistedCursor = pending.get(pending.size() - 1).index + 1;
        log.debug("Persisted {} event(s), cursor={}", pending.size(), persistedCursor);
    }

    // ---------------------------------------------------------------------
    // Facade
    // ---------------------------------------------------------------------

    public Outcome<AddThoughtResult> addThought(ThoughtInput input) {
        return mutate(() -> graph.addThought(input));
    }

    public Outcome<String> createBranch(String parentId) {
        return mutate(() -> graph.createBranch(parentId));
    }

    public Outcome<Boolean> createBranchWithId(String id, String parentId) {
        return mutate(() -> graph.createBranchWithId(id, parentId));
    }

    public Outcome<Boolean> setBranchState(String branchId, BranchState state) {
        return mutate(() -> graph.setBranchState(branchId, state));
    }

    public Outcome<EvaluationResult> evaluate(String branchId) {
        return Outcome.of(() -> evaluator.evaluateIncremental(branchId));
    }

    public Outcome<String> setGoal(String goal) {
        return Outcome.of(() -> {
            evaluator.setGoal(goal);
            return evaluator.goal().orElse(null);
        });
    }

    public Outcome<List<BranchReview.ContradictionReport>> findContradictions() {
        return Outcome.of(() -> review().findContradictions());
    }

    /** Marks low-scoring active branches as dead ends; returns their ids. */
    public Outcome<List<String>> pruneLowScoring() {
        return mutate(() -> review().pruneLowScoring());
    }

    public Outcome<List<CircularPattern>> detectCircularReasoning() {
        return Outcome.of(() -> graph.detectCircularReasoning());
    }

    public Outcome<GraphStatistics> statistics() {
        return Outcome.of(() -> graph.getStatistics());
    }

    /** Any read against the current graph, wrapped in an Outcome. */
    public <T> Outcome<T> call(Function<BranchGraph, T> query) {
        Objects.requireNonNull(query, "query");
        return Outcome.of(() -> query.apply(graph));
    }

    private <T> Outcome<T> mutate(Supplier<T> action) {
        return Outcome.of(() -> {
            T v = action.get();
            persistPending();
            return v;
        });
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public EngineConfig config() { return cfg; }
    public BranchGraph graph() { return graph; }
    public DifferentialEvaluator evaluator() { return evaluator; }
    public BranchAnalytics analytics() { return new BranchAnalytics(graph); }
    public BranchReview review() { return new BranchReview(graph, evaluator); }

    /** Null when persistence is off. */
    public EventLogStore eventLog() { return eventLog; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public synchronized void close() {
        try {
            persistPending();
        } catch (GraphException e) {
            log.warn("GraphKernel close: {} event(s) not persisted: {}",
                    graph.eventCount() - persistedCursor, e.getMessage());
        }
        log.info("GraphKernel closed: events={}", graph.eventCount());
    }

    private BranchGraph.Builder newGraphBuilder() {
        return BranchGraph.builder()
                .config(cfg)
                .embeddingProvider(embeddingProvider)
                .textAnalyzer(textAnalyzer)
                .clock(clock);
    }
}
