package org.calista.branchgraph.graph;

import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.error.ErrorCode;
import org.calista.branchgraph.error.NotFoundException;
import org.calista.branchgraph.error.ValidationException;
import org.calista.branchgraph.events.CrossRefKind;
import org.calista.branchgraph.events.EventKind;
import org.calista.branchgraph.events.GraphEvent;
import org.calista.branchgraph.filter.ContradictionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BranchGraphTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private BranchGraph graph;

    @BeforeEach
    void setUp() {
        graph = BranchGraph.builder().clock(CLOCK).build();
    }

    private AddThoughtResult add(String content, String branchId) {
        return graph.addThought(ThoughtInput.builder(content).branchId(branchId).build());
    }

    // ----------------------------- creation -----------------------------

    @Test
    void startsWithMainBranchAsEventZero() {
        assertTrue(graph.hasBranch(BranchGraph.MAIN_BRANCH));
        List<GraphEvent> events = graph.getEventsSince(0);
        assertEquals(1, events.size());
        assertEquals(EventKind.BRANCH_CREATED, events.get(0).kind);
        assertEquals(BranchGraph.MAIN_BRANCH, events.get(0).branchId);
        assertNull(graph.getBranch("main").orElseThrow().parentId);
    }

    @Test
    void createBranchGeneratesIdsUnderMain() {
        String b1 = graph.createBranch(null);
        String b2 = graph.createBranch(b1);
        assertEquals("branch-1", b1);
        assertEquals("branch-2", b2);
        assertEquals("main", graph.getBranch(b1).orElseThrow().parentId);
        assertEquals(List.of(b2), graph.getBranch(b1).orElseThrow().childIds);
        assertThrows(NotFoundException.class, () -> graph.createBranch("nope"));
    }

    @Test
    void generatedIdsSkipTakenOnes() {
        graph.createBranchWithId("branch-5", null);
        assertEquals("branch-6", graph.createBranch(null));
    }

    @Test
    void duplicateBranchIsRejectedByDefault() {
        graph.createBranchWithId("ideas", null);
        ValidationException e = assertThrows(ValidationException.class, () -> graph.createBranchWithId("ideas", null));
        assertEquals(ErrorCode.DUPLICATE_BRANCH, e.code());
    }

    @Test
    void duplicateBranchCanBeIgnored() {
        EngineConfig cfg = new EngineConfig();
        cfg.branch.duplicatePolicy = EngineConfig.DuplicateBranchPolicy.IGNORE;
        BranchGraph g = BranchGraph.builder().config(cfg).build();

        assertTrue(g.createBranchWithId("ideas", null));
        long events = g.eventCount();
        assertFalse(g.createBranchWithId("ideas", null));
        assertEquals(events, g.eventCount());
    }

    @Test
    void branchIdsAreValidated() {
        assertThrows(ValidationException.class, () -> graph.createBranchWithId("has space", null));
        assertThrows(ValidationException.class, () -> graph.createBranchWithId("x".repeat(101), null));
    }

    // ----------------------------- thoughts -----------------------------

    @Test
    void contentIsAddressedAfterTrimming() {
        AddThoughtResult first = add("  Cats are mammals.  ", "main");
        long events = graph.eventCount();
        AddThoughtResult again = add("Cats are mammals.", "main");

        assertFalse(first.duplicate);
        assertTrue(again.duplicate);
        assertEquals(first.thoughtId, again.thoughtId);
        assertEquals(events, graph.eventCount());
        assertEquals("Cats are mammals.", graph.getThought(first.thoughtId).orElseThrow().content);
        assertEquals(16, first.thoughtId.length());
        assertEquals(graph.contentId("Cats are mammals."), first.thoughtId);
    }

    @Test
    void differentContentGetsDifferentIds() {
        assertNotEquals(add("Cats are mammals.", "main").thoughtId, add("Cats are reptiles.", "main").thoughtId);
    }

    @Test
    void missingBranchIdCreatesAutoBranch() {
        AddThoughtResult r = graph.addThought(ThoughtInput.builder("Fresh idea").build());
        assertEquals("branch-1", r.branchId);
        assertEquals("main", graph.getBranch("branch-1").orElseThrow().parentId);

        AddThoughtResult named = graph.addThought(ThoughtInput.builder("Named idea").branchId("named").parentBranchId("branch-1").build());
        assertEquals("named", named.branchId);
        assertEquals("branch-1", graph.getBranch("named").orElseThrow().parentId);
    }

    @Test
    void eventIndicesAreGapFreeAndIncreasing() {
        graph.createBranchWithId("other", null);
        graph.addThought(ThoughtInput.builder("A thought with a reference")
                .branchId("main")
                .crossRef("other", CrossRefKind.SUPPORTS, "same evidence", 0.6)
                .build());
        add("Another thought", "other");
        graph.setBranchState("other", BranchState.COMPLETED);

        List<GraphEvent> events = graph.getEventsSince(0);
        for (int i = 0; i < events.size(); i++) assertEquals(i, events.get(i).index);
        assertEquals(List.of(EventKind.BRANCH_CREATED, EventKind.BRANCH_CREATED, EventKind.THOUGHT_ADDED,
                        EventKind.CROSS_REF_ADDED, EventKind.THOUGHT_ADDED, EventKind.BRANCH_STATE_CHANGED),
                events.stream().map(e -> e.kind).toList());

        assertEquals(events.subList(3, events.size()), graph.getEventsSince(3));
        assertTrue(graph.getEventsSince(100).isEmpty());
        assertThrows(ValidationException.class, () -> graph.getEventsSince(-1));
    }

    @Test
    void crossReferenceEventCarriesReference() {
        graph.createBranchWithId("other", null);
        AddThoughtResult r = graph.addThought(ThoughtInput.builder("Linked")
                .branchId("main")
                .crossRef("other", CrossRefKind.CONTRADICTORY, "opposite claim", 0.9)
                .build());

        GraphEvent ref = graph.getEventsSince(graph.eventCount() - 1).get(0);
        assertEquals(EventKind.CROSS_REF_ADDED, ref.kind);
        assertEquals(r.thoughtId, ref.thoughtId);
        assertEquals("main", ref.payload.crossReference.fromBranch);
        assertEquals("other", ref.payload.crossReference.toBranch);
        assertEquals(CrossRefKind.CONTRADICTORY, ref.payload.crossReference.kind);
    }

    @Test
    void invalidInputLeavesStateUntouched() {
        long events = graph.eventCount();
        int branches = graph.getAllBranches().size();

        assertThrows(ValidationException.class, () -> graph.addThought(ThoughtInput.builder("   ").build()));
        assertThrows(ValidationException.class, () -> graph.addThought(ThoughtInput.builder("ok").confidence(1.5).build()));
        assertThrows(ValidationException.class, () -> graph.addThought(ThoughtInput.builder("ok").kind(" ").build()));
        assertThrows(ValidationException.class, () -> graph.addThought(ThoughtInput.builder("ok").keyPoints(List.of("a", " ")).build()));
        assertThrows(ValidationException.class, () -> graph.addThought(ThoughtInput.builder("x".repeat(10_001)).build()));
        assertThrows(ValidationException.class, () -> graph.addThought(ThoughtInput.builder("ok")
                .crossRef("main", CrossRefKind.SUPPORTS, "", 0.5).build()));
        assertThrows(NotFoundException.class, () -> graph.addThought(ThoughtInput.builder("ok")
                .crossRef("ghost", CrossRefKind.SUPPORTS, "because", 0.5).build()));
        assertThrows(NotFoundException.class, () -> graph.addThought(ThoughtInput.builder("ok")
                .parentBranchId("ghost").build()));

        assertEquals(events, graph.eventCount());
        assertEquals(branches, graph.getAllBranches().size());
        assertEquals(0, graph.getStatistics().totalThoughts);
    }

    @Test
    void defaultsApplyToOptionalFields() {
        AddThoughtResult r = add("Plain", "main");
        Thought t = graph.getThought(r.thoughtId).orElseThrow();
        assertEquals(1.0, t.confidence);
        assertEquals("analysis", t.kind);
        assertEquals(List.of(), t.keyPoints);
        assertEquals(CLOCK.millis(), t.createdAtEpochMs);
    }

    @Test
    void recentAndPrecedingThoughtsAreOldestFirst() {
        String a = add("one", "main").thoughtId;
        String b = add("two", "main").thoughtId;
        String c = add("three", "main").thoughtId;

        assertEquals(List.of(b, c), graph.getRecentThoughts("main", 2).stream().map(t -> t.id).toList());
        assertEquals(List.of(a, b), graph.getPrecedingThoughts(c, 5).stream().map(t -> t.id).toList());
        assertTrue(graph.getPrecedingThoughts(a, 5).isEmpty());
        assertThrows(NotFoundException.class, () -> graph.getRecentThoughts("ghost", 1));
        assertThrows(ValidationException.class, () -> graph.getPrecedingThoughts(c, -1));
        assertThrows(ValidationException.class, () -> graph.getRecentThoughts("main", -1));
    }

    @Test
    void concurrentWritersKeepLogConsistentForReaders() throws Exception {
        final int writers = 4;
        final int perWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        Queue<String> failures = new ConcurrentLinkedQueue<>();

        try {
            List<Future<?>> writes = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                final int writer = w;
                writes.add(pool.submit(() -> {
                    start.await();
                    String branch = graph.createBranch(null);
                    for (int i = 0; i < perWriter; i++) {
                        ThoughtInput.Builder b = ThoughtInput.builder("writer " + writer + " step " + i).branchId(branch);
                        if (i % 5 == 0) b.crossRef("main", CrossRefKind.SUPPORTS, "shared ground", 0.5);
                        graph.addThought(b.build());
                    }
                    return null;
                }));
            }
            List<Future<?>> reads = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                reads.add(pool.submit(() -> {
                    start.await();
                    while (writing.get()) {
                        List<GraphEvent> events = graph.getEventsSince(0);
                        for (int i = 0; i < events.size(); i++) {
                            GraphEvent e = events.get(i);
                            if (e.index != i) failures.add("index " + e.index + " at position " + i);
                            if (e.kind == EventKind.THOUGHT_ADDED && graph.getThought(e.thoughtId).isEmpty()) {
                                failures.add("unresolvable thought " + e.thoughtId);
                            }
                        }
                        if (graph.getAllBranches().isEmpty()) failures.add("no branches");
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> f : writes) f.get(30, TimeUnit.SECONDS);
            writing.set(false);
            for (Future<?> f : reads) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertTrue(failures.isEmpty(), () -> String.join("; ", failures));

        int thoughts = writers * perWriter;
        int branches = 1 + writers;
        int crossRefs = writers * (perWriter / 5);
        assertEquals(thoughts, graph.getStatistics().totalThoughts);
        assertEquals(branches, graph.getAllBranches().size());
        assertEquals(thoughts + branches + crossRefs, graph.eventCount());

        List<GraphEvent> events = graph.getEventsSince(0);
        for (int i = 0; i < events.size(); i++) assertEquals(i, events.get(i).index);
    }

    // ----------------------------- contradiction / overlap -----------------------------

    @Test
    void negatedStatementIsFlaggedByPreFilter() {
        assertFalse(add("Cats are mammals.", "main").contradiction.potentialContradiction);
        AddThoughtResult r = add("Cats are not mammals.", "main");
        assertTrue(r.contradiction.potentialContradiction);
        assertTrue(r.contradiction.types.contains(ContradictionType.NEGATION));
    }

    @Test
    void thoughtCloserToAnotherBranchGetsOverlapWarning() {
        graph.createBranchWithId("cats", null);
        graph.createBranchWithId("db", null);
        add("Cats are independent animals", "cats");
        add("Cats hunt small mice at night", "cats");
        add("Cats sleep most of the day", "cats");
        add("Database indexes speed up queries on large tables", "db");

        AddThoughtResult r = add("Database indexes speed up queries on large tables today", "cats");
        OverlapWarning w = r.overlapWarning().orElseThrow();
        assertEquals("db", w.suggestedBranch);
        assertTrue(w.suggestedSimilarity > w.currentSimilarity + 0.15);
    }

    @Test
    void onTopicThoughtHasNoOverlapWarning() {
        graph.createBranchWithId("cats", null);
        graph.createBranchWithId("db", null);
        add("Database indexes speed up queries on large tables", "db");
        add("Cats hunt small mice at night", "cats");
        assertTrue(add("Cats hunt mice in the garden at night", "cats").overlapWarning().isEmpty());
    }

    @Test
    void profilesTrackKeywordsAndCount() {
        add("Cats hunt small mice at night", "main");
        add("Cats sleep most of the day", "main");
        SemanticProfile p = graph.getBranch("main").orElseThrow().semanticProfile().orElseThrow();
        assertEquals(2, p.thoughtCount);
        assertTrue(p.keywords.contains("cats"), p.keywords.toString());
        assertEquals(512, p.dimension());
    }

    // ----------------------------- state -----------------------------

    @Test
    void stateChangeIsRecordedOnlyWhenDifferent() {
        long before = graph.eventCount();
        assertTrue(graph.setBranchState("main", BranchState.SUSPENDED));
        assertFalse(graph.setBranchState("main", BranchState.SUSPENDED));
        assertEquals(before + 1, graph.eventCount());
        assertEquals(BranchState.SUSPENDED, graph.getBranch("main").orElseThrow().state);
        assertEquals("suspended", graph.getEventsSince(before).get(0).payload.state);
        assertThrows(NotFoundException.class, () -> graph.setBranchState("ghost", BranchState.ACTIVE));
    }

    // ----------------------------- search -----------------------------

    @Test
    void breadthFirstSearchHonoursDepth() {
        String b1 = graph.createBranch(null);
        String b2 = graph.createBranch(b1);
        String b3 = graph.createBranch(b2);

        assertEquals(Set.of("main"), graph.breadthFirstSearch("main", 0));
        assertEquals(Set.of("main", b1), graph.breadthFirstSearch("main", 1));
        assertEquals(Set.of("main", b1, b2, b3), graph.breadthFirstSearch("main", 10));
        assertEquals(List.of("main", b1, b2), List.copyOf(graph.breadthFirstSearch("main", 2)));
        assertThrows(ValidationException.class, () -> graph.breadthFirstSearch("main", 1001));
        assertThrows(NotFoundException.class, () -> graph.breadthFirstSearch("ghost", 1));
    }

    @Test
    void searchIsCaseInsensitiveAndValidatesPattern() {
        graph.createBranchWithId("b", null);
        String a = add("Cats are mammals", "main").thoughtId;
        String c = add("Dogs chase CATS", "b").thoughtId;
        add("Birds fly", "b");

        List<ThoughtMatch> hits = graph.searchThoughts("cats");
        assertEquals(List.of(a, c), hits.stream().map(m -> m.thoughtId).toList());
        assertEquals("b", hits.get(1).branchId);
        assertThrows(ValidationException.class, () -> graph.searchThoughts("(unclosed"));
    }

    // ----------------------------- similarity -----------------------------

    @Test
    void similarityIsMemoisedAndSymmetric() {
        String a = add("cats hunt mice at night", "main").thoughtId;
        String b = add("cats hunt birds at night", "main").thoughtId;
        String c = add("database indexes", "main").thoughtId;

        double ab = graph.calculateSimilarity(a, b);
        // words {cats,hunt,mice,at,night} vs {cats,hunt,birds,at,night}: 4 / sqrt(25)
        assertEquals(0.8, ab, 1e-12);
        assertEquals(ab, graph.calculateSimilarity(b, a));
        assertEquals(1.0, graph.calculateSimilarity(a, a));

        assertEquals(0.0, graph.calculateSimilarity(a, c));
        assertEquals(List.of(b), graph.mostSimilar(a, 5).stream().map(s -> s.item).toList());
        assertEquals(List.of(List.of(a, b)), graph.clusters());
        assertThrows(NotFoundException.class, () -> graph.calculateSimilarity(a, "ghost"));
    }

    // ----------------------------- statistics -----------------------------

    @Test
    void statisticsAggregateAllComponents() {
        graph.createBranchWithId("side", null);
        graph.setBranchState("side", BranchState.DEAD_END);
        add("Cats are mammals.", "main");
        add("Dogs are mammals.", "main");

        GraphStatistics s = graph.getStatistics();
        assertEquals(2, s.totalBranches);
        assertEquals(2, s.totalThoughts);
        assertEquals(1, s.activeBranches);
        assertEquals(1.0, s.averageThoughtsPerBranch);
        assertEquals(1, s.stateDistribution.get(BranchState.DEAD_END));
        assertEquals(graph.eventCount(), s.totalEvents);
        assertEquals(2, s.similarityMatrix.numThoughts);
        assertEquals(2, s.circularReasoning.totalThoughts);
        assertTrue(s.contradictionFilter.positiveAssertions.numElements > 0);
    }
}
