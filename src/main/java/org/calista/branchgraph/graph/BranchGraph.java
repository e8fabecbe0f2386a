package org.calista.branchgraph.graph;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.branchgraph.circular.CircularPattern;
import org.calista.branchgraph.circular.CircularReasoningDetector;
import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.embed.EmbeddingGateway;
import org.calista.branchgraph.embed.EmbeddingProvider;
import org.calista.branchgraph.embed.impl.HashingEmbeddingProvider;
import org.calista.branchgraph.error.NotFoundException;
import org.calista.branchgraph.error.ProviderException;
import org.calista.branchgraph.error.ValidationException;
import org.calista.branchgraph.events.CrossReference;
import org.calista.branchgraph.events.EventKind;
import org.calista.branchgraph.events.EventPayload;
import org.calista.branchgraph.events.GraphEvent;
import org.calista.branchgraph.filter.ContradictionBloomFilter;
import org.calista.branchgraph.filter.ContradictionCheck;
import org.calista.branchgraph.matrix.Scored;
import org.calista.branchgraph.matrix.SimilarityMatrix;
import org.calista.branchgraph.text.KeywordExtractor;
import org.calista.branchgraph.text.SimpleTokenizer;
import org.calista.branchgraph.text.TermExtractor;
import org.calista.branchgraph.text.TextAnalyzer;
import org.calista.branchgraph.text.impl.PatternTextAnalyzer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * BranchGraph: система записи: мысли, ветки, журнал событий.
 *
 * <p>
 * Thoughts are content-addressed: the id is a truncated SHA-256 of the trimmed content, so
 * adding the same content twice is a no-op. Every successful mutation appends one or more
 * {@link GraphEvent}s with gap-free, strictly increasing indices; the log starts with the
 * creation of {@value #MAIN_BRANCH}.
 * </p>
 *
 * <p>
 * Concurrency: a single {@link ReentrantReadWriteLock}. A mutation validates everything before
 * taking the write lock, re-checks existence under it, and releases it only after every side
 * effect (event append included) is done. Readers get immutable snapshots. Embeddings are
 * computed before the write lock is taken.
 * </p>
 *
 * <p>
 * All state changes go through {@code apply*} methods that consume an event, so live mutation
 * and {@link Builder#replay} share one code path.
 * </p>
 */
public final class BranchGraph {
    private static final Logger log = LogManager.getLogger(BranchGraph.class);

    public static final String MAIN_BRANCH = "main";
    private static final Pattern AUTO_BRANCH_ID = Pattern.compile("^branch-(\\d+)$");

    private final EngineConfig cfg;
    private final Clock clock;
    private final ThoughtInputValidator validator;
    private final TermExtractor terms;
    private final KeywordExtractor keywordExtractor;
    private final EmbeddingGateway embeddings;
    private final ContradictionBloomFilter contradictionFilter;
    private final CircularReasoningDetector circular;
    private final SimilarityMatrix similarity;

    // =========================
    // State (guarded by rw)
    // =========================

    private final Map<String, Thought> thoughts = new HashMap<>();
    private final Map<String, Integer> ordinals = new HashMap<>();
    private final LinkedHashMap<String, BranchNode> branches = new LinkedHashMap<>();
    private final List<GraphEvent> events = new ArrayList<>();
    private long autoBranchCounter = 0;

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    private BranchGraph(Builder b, boolean createMain) {
        this.cfg = b.cfg;
        this.clock = b.clock;
        this.validator = new ThoughtInputValidator(cfg);
        this.terms = b.terms;
        this.keywordExtractor = new KeywordExtractor(terms);
        this.embeddings = new EmbeddingGateway(b.embeddingProvider, cfg.embedding.timeoutMs, cfg.embedding.cacheSize);
        this.contradictionFilter = new ContradictionBloomFilter(cfg);
        this.circular = new CircularReasoningDetector(b.textAnalyzer, cfg);
        this.similarity = new SimilarityMatrix(cfg.matrix.similarityThreshold, cfg.matrix.initialSize);

        if (createMain) {
            applyBranchCreated(GraphEvent.branchCreated(0, clock.millis(), MAIN_BRANCH, null));
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EngineConfig cfg;
        private EmbeddingProvider embeddingProvider;
        private TextAnalyzer textAnalyzer;
        private Clock clock = Clock.systemUTC();
        private TermExtractor terms;

        public Builder config(EngineConfig cfg) {
            this.cfg = Objects.requireNonNull(cfg, "cfg");
            return this;
        }

        public Builder embeddingProvider(EmbeddingProvider p) {
            this.embeddingProvider = Objects.requireNonNull(p, "embeddingProvider");
            return this;
        }

        public Builder textAnalyzer(TextAnalyzer a) {
            this.textAnalyzer = Objects.requireNonNull(a, "textAnalyzer");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public BranchGraph build() {
            prepare();
            return new BranchGraph(this, true);
        }

        /**
         * Rebuilds a store from a complete, ordered event log (the first event must create the root).
         *
         * @throws ValidationException when the log is not a valid history
         */
        public BranchGraph replay(List<GraphEvent> history) {
            Objects.requireNonNull(history, "history");
            prepare();
            BranchGraph g = new BranchGraph(this, false);
            g.replayAll(history);
            return g;
        }

        private void prepare() {
            if (cfg == null) cfg = new EngineConfig();
            cfg.validate();
            terms = new TermExtractor(SimpleTokenizer.INSTANCE, cfg.text.stopWords);
            if (embeddingProvider == null) embeddingProvider = new HashingEmbeddingProvider(terms, cfg.embedding.dimension);
            if (textAnalyzer == null) textAnalyzer = new PatternTextAnalyzer();
        }
    }

    // =========================
    // Mutations
    // =========================

    /**
     * Adds a thought. See class docs for ordering and atomicity.
     *
     * @throws ValidationException malformed input; nothing changed
     * @throws NotFoundException   parent or cross-reference target branch missing; nothing changed
     */
    public AddThoughtResult addThought(ThoughtInput in) {
        validator.validate(in);
        final String content = in.content.trim();
        final String id = contentId(content);

        rw.readLock().lock();
        try {
            Thought existing = thoughts.get(id);
            if (existing != null) {
                log.debug("Duplicate thought {} ignored", id);
                return AddThoughtResult.duplicateOf(existing);
            }
        } finally {
            rw.readLock().unlock();
        }

        float[] emb = tryEmbed(content);

        rw.writeLock().lock();
        try {
            Thought existing = thoughts.get(id);
            if (existing != null) return AddThoughtResult.duplicateOf(existing);

            String parent = in.parentBranchId == null ? MAIN_BRANCH : in.parentBranchId;
            boolean needsBranch = in.branchId == null || !branches.containsKey(in.branchId);
            if (needsBranch && !branches.containsKey(parent)) throw NotFoundException.branch(parent);
            for (ThoughtInput.CrossRef r : in.crossRefs) {
                if (!branches.containsKey(r.toBranch)) throw NotFoundException.branch(r.toBranch);
            }

            // --- point of no return: validation is complete ---

            String branchId = in.branchId;
            if (branchId == null) branchId = nextAutoBranchId();
            if (!branches.containsKey(branchId)) {
                applyBranchCreated(GraphEvent.branchCreated(events.size(), clock.millis(), branchId, parent));
            }

            double confidence = in.confidence == null ? cfg.branch.defaultConfidence : in.confidence;
            List<String> keyPoints = in.keyPoints == null ? List.of() : in.keyPoints.stream().map(String::trim).toList();
            List<String> refs = in.crossRefs.stream().map(r -> r.toBranch).toList();

            long now = clock.millis();
            Applied applied = applyThoughtAdded(GraphEvent.thoughtAdded(events.size(), now, branchId, id,
                    content, in.kind.trim(), confidence, keyPoints, refs), emb);

            for (ThoughtInput.CrossRef r : in.crossRefs) {
                CrossReference ref = CrossReference.of(branchId, r.toBranch, r.kind, r.reason.trim(), r.strength);
                applyCrossRef(GraphEvent.crossRefAdded(events.size(), now, id, ref));
            }

            if (log.isDebugEnabled()) {
                log.debug("Thought {} added to {} (contradiction={}, overlap={})",
                        id, branchId, applied.contradiction.potentialContradiction, applied.overlap != null);
            }
            return new AddThoughtResult(id, branchId, false, applied.contradiction, applied.overlap);
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Creates a branch with a generated id {@code branch-N}. Parent defaults to {@value #MAIN_BRANCH}.
     */
    public String createBranch(String parentId) {
        String parent = parentId == null ? MAIN_BRANCH : parentId;
        validator.validateBranchId(parent, "parentId");

        rw.writeLock().lock();
        try {
            if (!branches.containsKey(parent)) throw NotFoundException.branch(parent);
            String id = nextAutoBranchId();
            applyBranchCreated(GraphEvent.branchCreated(events.size(), clock.millis(), id, parent));
            return id;
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Creates a branch with a caller-chosen id. An existing id is rejected or ignored according
     * to {@code branch.duplicatePolicy}.
     *
     * @return true if a branch was created
     */
    public boolean createBranchWithId(String id, String parentId) {
        validator.validateBranchId(id, "branchId");
        String parent = parentId == null ? MAIN_BRANCH : parentId;
        validator.validateBranchId(parent, "parentId");

        rw.writeLock().lock();
        try {
            if (branches.containsKey(id)) {
                if (cfg.branch.duplicatePolicy == EngineConfig.DuplicateBranchPolicy.IGNORE) return false;
                throw ValidationException.duplicateBranch(id);
            }
            if (!branches.containsKey(parent)) throw NotFoundException.branch(parent);
            applyBranchCreated(GraphEvent.branchCreated(events.size(), clock.millis(), id, parent));
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * @return true if the state changed (and an event was recorded)
     */
    public boolean setBranchState(String branchId, BranchState state) {
        Objects.requireNonNull(state, "state");
        rw.writeLock().lock();
        try {
            BranchNode b = requireBranch(branchId);
            if (b.state == state) return false;
            applyStateChanged(GraphEvent.branchStateChanged(events.size(), clock.millis(), branchId, state.wireName()));
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Word-set cosine of two thoughts, memoised in the similarity matrix. A pair is computed at most once.
     */
    public double calculateSimilarity(String thoughtId1, String thoughtId2) {
        rw.writeLock().lock();
        try {
            Thought a = requireThought(thoughtId1);
            Thought b = requireThought(thoughtId2);
            if (a.id.equals(b.id)) return 1.0;

            OptionalDouble known = similarity.lookup(a.id, b.id);
            if (known.isPresent()) return known.getAsDouble();

            double sim = TermExtractor.setCosine(terms.words(a.content), terms.words(b.content));
            similarity.set(a.id, b.id, sim);
            return sim;
        } finally {
            rw.writeLock().unlock();
        }
    }

    // =========================
    // Queries
    // =========================

    public Optional<Thought> getThought(String id) {
        if (id == null) return Optional.empty();
        rw.readLock().lock();
        try {
            return Optional.ofNullable(thoughts.get(id));
        } finally {
            rw.readLock().unlock();
        }
    }

    public Optional<Branch> getBranch(String id) {
        if (id == null) return Optional.empty();
        rw.readLock().lock();
        try {
            BranchNode b = branches.get(id);
            return b == null ? Optional.empty() : Optional.of(b.snapshot());
        } finally {
            rw.readLock().unlock();
        }
    }

    public boolean hasBranch(String id) {
        rw.readLock().lock();
        try {
            return id != null && branches.containsKey(id);
        } finally {
            rw.readLock().unlock();
        }
    }

    /** All branches in creation order. */
    public List<Branch> getAllBranches() {
        rw.readLock().lock();
        try {
            List<Branch> out = new ArrayList<>(branches.size());
            for (BranchNode b : branches.values()) out.add(b.snapshot());
            return Collections.unmodifiableList(out);
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Last {@code n} thoughts of a branch, oldest first. */
    public List<Thought> getRecentThoughts(String branchId, int n) {
        if (n < 0) throw new ValidationException("n must be non-negative: " + n);
        rw.readLock().lock();
        try {
            BranchNode b = requireBranch(branchId);
            int from = Math.max(0, b.thoughtIds.size() - n);
            return resolve(b.thoughtIds.subList(from, b.thoughtIds.size()));
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Every thought of a branch, in insertion order. */
    public List<Thought> getBranchThoughts(String branchId) {
        return getRecentThoughts(branchId, Integer.MAX_VALUE);
    }

    /**
     * Up to {@code n} thoughts that precede {@code thoughtId} in its branch, oldest first.
     */
    public List<Thought> getPrecedingThoughts(String thoughtId, int n) {
        if (n < 0) throw new ValidationException("n must be non-negative: " + n);
        rw.readLock().lock();
        try {
            Thought t = requireThought(thoughtId);
            BranchNode b = branches.get(t.branchId);
            int pos = ordinals.get(t.id);
            return resolve(b.thoughtIds.subList(Math.max(0, pos - n), pos));
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * Events with {@code index >= cursor}, in order. Cursor past the end yields an empty list.
     */
    public List<GraphEvent> getEventsSince(long cursor) {
        if (cursor < 0) throw new ValidationException("cursor must be non-negative: " + cursor);
        rw.readLock().lock();
        try {
            if (cursor >= events.size()) return List.of();
            return List.copyOf(events.subList((int) cursor, events.size()));
        } finally {
            rw.readLock().unlock();
        }
    }

    public long eventCount() {
        rw.readLock().lock();
        try {
            return events.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * Branch ids reachable from {@code startBranchId} through child links within {@code maxDepth} hops,
     * start included, in breadth-first order.
     */
    public Set<String> breadthFirstSearch(String startBranchId, int maxDepth) {
        validator.validateMaxDepth(maxDepth);
        rw.readLock().lock();
        try {
            requireBranch(startBranchId);
            Set<String> visited = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            Deque<Integer> depth = new ArrayDeque<>();
            visited.add(startBranchId);
            queue.add(startBranchId);
            depth.add(0);

            while (!queue.isEmpty()) {
                String cur = queue.poll();
                int d = depth.poll();
                if (d >= maxDepth) continue;
                for (String child : branches.get(cur).childIds) {
                    if (visited.add(child)) {
                        queue.add(child);
                        depth.add(d + 1);
                    }
                }
            }
            return Collections.unmodifiableSet(visited);
        } finally {
            rw.readLock().unlock();
        }
    }

    /**
     * @throws ValidationException when {@code regex} does not compile
     */
    public List<ThoughtMatch> searchThoughts(String regex) {
        if (regex == null) throw new ValidationException("pattern must not be null");
        try {
            return searchThoughts(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        } catch (PatternSyntaxException e) {
            throw new ValidationException("invalid pattern: " + e.getDescription());
        }
    }

    /** Matches in branch creation order, then thought order. */
    public List<ThoughtMatch> searchThoughts(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        rw.readLock().lock();
        try {
            List<ThoughtMatch> out = new ArrayList<>();
            for (BranchNode b : branches.values()) {
                for (String tid : b.thoughtIds) {
                    if (pattern.matcher(thoughts.get(tid).content).find()) out.add(new ThoughtMatch(tid, b.id));
                }
            }
            return out;
        } finally {
            rw.readLock().unlock();
        }
    }

    public List<Scored<String>> mostSimilar(String thoughtId, int k) {
        if (k < 0) throw new ValidationException("k must be non-negative: " + k);
        rw.readLock().lock();
        try {
            requireThought(thoughtId);
            return similarity.mostSimilar(thoughtId, k);
        } finally {
            rw.readLock().unlock();
        }
    }

    public List<List<String>> clusters() {
        return clusters(cfg.matrix.clusteringMinSimilarity);
    }

    public List<List<String>> clusters(double minSimilarity) {
        rw.readLock().lock();
        try {
            return similarity.clusters(minSimilarity);
        } finally {
            rw.readLock().unlock();
        }
    }

    public List<CircularPattern> detectCircularReasoning() {
        List<CircularPattern> found = circular.detectAllPatterns();
        if (!found.isEmpty() && log.isInfoEnabled()) {
            log.info("Circular reasoning: {} pattern(s) detected", found.size());
        }
        return found;
    }

    public GraphStatistics getStatistics() {
        rw.readLock().lock();
        try {
            Map<BranchState, Integer> dist = new EnumMap<>(BranchState.class);
            int active = 0;
            for (BranchNode b : branches.values()) {
                dist.merge(b.state, 1, Integer::sum);
                if (b.state == BranchState.ACTIVE) active++;
            }
            double avg = branches.isEmpty() ? 0.0 : (double) thoughts.size() / branches.size();
            return new GraphStatistics(branches.size(), thoughts.size(), active, avg, dist, events.size(),
                    contradictionFilter.stats(), similarity.stats(), circular.stats());
        } finally {
            rw.readLock().unlock();
        }
    }

    public EngineConfig config() {
        return cfg;
    }

    public TermExtractor terms() {
        return terms;
    }

    // =========================
    // Content addressing
    // =========================

    /**
     * Lowercase hex SHA-256 of the trimmed content, truncated to {@code hash.substringLength}.
     */
    public String contentId(String content) {
        Objects.requireNonNull(content, "content");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(content.trim().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, cfg.hash.substringLength);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // =========================
    // Event application (shared by live path and replay)
    // =========================

    private static final class Applied {
        final ContradictionCheck contradiction;
        final OverlapWarning overlap;

        Applied(ContradictionCheck contradiction, OverlapWarning overlap) {
            this.contradiction = contradiction;
            this.overlap = overlap;
        }
    }

    private void applyBranchCreated(GraphEvent e) {
        String parent = e.payload == null ? null : e.payload.parentBranchId;
        BranchNode node = new BranchNode(e.branchId, parent, e.tsEpochMs,
                cfg.branch.initialPriority, cfg.branch.initialConfidence);
        branches.put(node.id, node);
        if (parent != null) branches.get(parent).childIds.add(node.id);

        Matcher m = AUTO_BRANCH_ID.matcher(node.id);
        if (m.matches()) {
            try {
                autoBranchCounter = Math.max(autoBranchCounter, Long.parseLong(m.group(1)));
            } catch (NumberFormatException ignored) {
                // too long to be one of ours
            }
        }
        events.add(e);
        log.debug("Branch {} created (parent={})", node.id, parent);
    }

    private Applied applyThoughtAdded(GraphEvent e, float[] embedding) {
        EventPayload p = e.payload;
        BranchNode b = branches.get(e.branchId);
        Thought t = new Thought(e.thoughtId, p.content, b.id, p.thoughtKind,
                p.confidence == null ? cfg.branch.defaultConfidence : p.confidence,
                p.keyPoints, e.tsEpochMs);

        thoughts.put(t.id, t);
        ordinals.put(t.id, b.thoughtIds.size());
        b.thoughtIds.add(t.id);

        OverlapWarning overlap = null;
        if (embedding != null) {
            updateProfile(b, embedding, e.tsEpochMs);
            overlap = checkOverlap(b, embedding);
        }

        ContradictionCheck cc = contradictionFilter.checkAndAdd(t.content);
        circular.addThought(t.id, t.content, p.references == null ? List.of() : p.references);
        similarity.register(t.id);

        events.add(e);
        return new Applied(cc, overlap);
    }

    private void applyCrossRef(GraphEvent e) {
        events.add(e);
    }

    private void applyStateChanged(GraphEvent e) {
        branches.get(e.branchId).state = BranchState.parse(e.payload.state);
        events.add(e);
    }

    private void replayAll(List<GraphEvent> history) {
        rw.writeLock().lock();
        try {
            for (GraphEvent e : history) {
                if (e == null || e.kind == null) throw new ValidationException("event log contains a malformed event");
                if (e.index != events.size()) {
                    throw new ValidationException("event log index gap: expected " + events.size() + ", got " + e.index);
                }
                if (events.isEmpty() && (e.kind != EventKind.BRANCH_CREATED || !MAIN_BRANCH.equals(e.branchId))) {
                    throw new ValidationException("event log must start with the creation of " + MAIN_BRANCH);
                }
                replayOne(e);
            }
        } finally {
            rw.writeLock().unlock();
        }
        log.info("Replayed {} events: {} branches, {} thoughts", events.size(), branches.size(), thoughts.size());
    }

    private void replayOne(GraphEvent e) {
        switch (e.kind) {
            case BRANCH_CREATED -> {
                if (branches.containsKey(e.branchId)) throw new ValidationException("duplicate branch in log: " + e.branchId);
                String parent = e.payload == null ? null : e.payload.parentBranchId;
                if (parent != null && !branches.containsKey(parent)) throw NotFoundException.branch(parent);
                applyBranchCreated(e);
            }
            case THOUGHT_ADDED -> {
                if (e.payload == null || e.payload.content == null || e.thoughtId == null) {
                    throw new ValidationException("thought event #" + e.index + " has no content");
                }
                requireBranch(e.branchId);
                if (!e.thoughtId.equals(contentId(e.payload.content))) {
                    throw new ValidationException("thought event #" + e.index + " id does not match its content");
                }
                if (thoughts.containsKey(e.thoughtId)) throw new ValidationException("duplicate thought in log: " + e.thoughtId);
                applyThoughtAdded(e, tryEmbed(e.payload.content));
            }
            case CROSS_REF_ADDED -> {
                if (e.payload == null || e.payload.crossReference == null) {
                    throw new ValidationException("cross reference event #" + e.index + " has no reference");
                }
                applyCrossRef(e);
            }
            case BRANCH_STATE_CHANGED -> {
                requireBranch(e.branchId);
                applyStateChanged(e);
            }
        }
    }

    // =========================
    // Semantic profile / overlap
    // =========================

    private float[] tryEmbed(String content) {
        try {
            return embeddings.embed(content);
        } catch (ProviderException e) {
            log.warn("Embedding unavailable ({}), semantic profile update skipped", e.code());
            return null;
        }
    }

    private void updateProfile(BranchNode b, float[] emb, long now) {
        if (b.center != null && b.center.length != emb.length) {
            log.warn("Embedding dimension changed for branch {} ({} -> {}), profile reset", b.id, b.center.length, emb.length);
            b.center = null;
        }
        if (b.center == null) {
            b.center = emb.clone();
            b.profileCount = 1;
        } else {
            int n = b.profileCount;
            for (int i = 0; i < emb.length; i++) b.center[i] = (b.center[i] * n + emb[i]) / (n + 1);
            b.profileCount = n + 1;
        }
        b.profileUpdatedAtEpochMs = now;

        List<String> docs = new ArrayList<>(b.thoughtIds.size());
        for (String tid : b.thoughtIds) docs.add(thoughts.get(tid).content);
        b.keywords = keywordExtractor.extract(docs, cfg.branch.keywordCount);
    }

    private OverlapWarning checkOverlap(BranchNode current, float[] emb) {
        if (current.center == null) return null;
        double currentSim = embeddings.cosine(emb, current.center);

        String best = null;
        double bestSim = Double.NEGATIVE_INFINITY;
        for (BranchNode other : branches.values()) {
            if (other == current || other.center == null || other.center.length != emb.length) continue;
            double s = embeddings.cosine(emb, other.center);
            if (s > bestSim) {
                bestSim = s;
                best = other.id;
            }
        }
        if (best == null || bestSim <= currentSim + cfg.branch.overlapMargin) return null;

        log.debug("Overlap: thought in {} is closer to {} ({} vs {})", current.id, best, bestSim, currentSim);
        return new OverlapWarning(best, currentSim, bestSim);
    }

    // =========================
    // Internals
    // =========================

    private String nextAutoBranchId() {
        String id;
        do {
            id = "branch-" + (++autoBranchCounter);
        } while (branches.containsKey(id));
        return id;
    }

    private BranchNode requireBranch(String id) {
        BranchNode b = id == null ? null : branches.get(id);
        if (b == null) throw NotFoundException.branch(id);
        return b;
    }

    private Thought requireThought(String id) {
        Thought t = id == null ? null : thoughts.get(id);
        if (t == null) throw NotFoundException.thought(id);
        return t;
    }

    private List<Thought> resolve(List<String> ids) {
        List<Thought> out = new ArrayList<>(ids.size());
        for (String id : ids) out.add(thoughts.get(id));
        return Collections.unmodifiableList(out);
    }
}
