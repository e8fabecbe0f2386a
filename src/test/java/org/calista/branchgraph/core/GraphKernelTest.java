package org.calista.branchgraph.core;

import org.calista.branchgraph.error.ErrorCode;
import org.calista.branchgraph.error.GraphException;
import org.calista.branchgraph.error.Outcome;
import org.calista.branchgraph.evaluate.EvaluationResult;
import org.calista.branchgraph.events.CrossRefKind;
import org.calista.branchgraph.graph.AddThoughtResult;
import org.calista.branchgraph.graph.BranchState;
import org.calista.branchgraph.graph.ThoughtInput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphKernelTest {

    @TempDir
    Path root;

    private EngineConfig persistentConfig() {
        EngineConfig cfg = new EngineConfig();
        cfg.baseDir = "store";
        cfg.events.persist = true;
        return cfg;
    }

    @Test
    void buildFromFileCreatesDefaultConfig() throws Exception {
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(Path.of("engine.json"))) {
            assertTrue(Files.exists(root.resolve("engine.json")));
            assertEquals(root.resolve("data").toAbsolutePath().normalize(), k.io().baseDir());
            assertNull(k.eventLog());
            assertTrue(k.graph().hasBranch("main"));
        }
    }

    @Test
    void mutationsArePersistedAndRestored() throws Exception {
        String thoughtId;
        long events;
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(persistentConfig())) {
            assertTrue(k.createBranchWithId("evidence", null).ok);
            Outcome<AddThoughtResult> added = k.addThought(ThoughtInput.builder("Cats are mammals.")
                    .branchId("main")
                    .crossRef("evidence", CrossRefKind.SUPPORTS, "field notes", 0.7)
                    .build());
            assertTrue(added.ok);
            thoughtId = added.value.thoughtId;
            assertTrue(k.setBranchState("evidence", BranchState.SUSPENDED).orElseThrow());
            events = k.graph().eventCount();

            assertEquals(events, Files.readAllLines(k.eventLog().file()).size());
        }

        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(persistentConfig())) {
            assertEquals(events, k.graph().eventCount());
            assertTrue(k.graph().getThought(thoughtId).isPresent());
            assertEquals(BranchState.SUSPENDED, k.graph().getBranch("evidence").orElseThrow().state);

            assertTrue(k.addThought(ThoughtInput.builder("Cats are mammals.").branchId("main").build()).value.duplicate);
            assertEquals(events, Files.readAllLines(k.eventLog().file()).size());
        }
    }

    @Test
    void lockedAndSyncedLogRoundTrips() throws Exception {
        EngineConfig cfg = persistentConfig();
        cfg.events.lockWrites = true;
        cfg.events.fsync = true;

        long events;
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(cfg)) {
            assertTrue(k.io().options().lockWrites);
            assertTrue(k.io().options().fsyncOnCommit);
            assertTrue(k.addThought(ThoughtInput.builder("Locked write").branchId("main").build()).ok);
            events = k.graph().eventCount();
        }
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(cfg)) {
            assertEquals(events, k.graph().eventCount());
        }
    }

    @Test
    void failuresMapToErrorCodes() throws Exception {
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(new EngineConfig())) {
            Outcome<AddThoughtResult> missingParent = k.addThought(ThoughtInput.builder("x").parentBranchId("ghost").build());
            assertFalse(missingParent.ok);
            assertEquals(ErrorCode.BRANCH_NOT_FOUND, missingParent.code);
            assertFalse(missingParent.retryable);

            assertEquals(ErrorCode.DUPLICATE_BRANCH, k.createBranchWithId("main", null).code);
            assertEquals(ErrorCode.INVALID_INPUT, k.addThought(ThoughtInput.builder(" ").build()).code);
            assertEquals(ErrorCode.BRANCH_NOT_FOUND, k.evaluate("ghost").code);
            assertEquals(ErrorCode.INVALID_INPUT, k.call(g -> g.searchThoughts("[")).code);
        }
    }

    @Test
    void pruningIsPersisted() throws Exception {
        EngineConfig cfg = persistentConfig();
        cfg.branch.pruneThreshold = 0.8;
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(cfg)) {
            k.addThought(ThoughtInput.builder("Cats are mammals.").branchId("weak").confidence(1.0).build());
            k.addThought(ThoughtInput.builder("Cats are not mammals.").branchId("weak").confidence(0.0).build());

            assertEquals(List.of("weak"), k.pruneLowScoring().orElseThrow());
        }
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(persistentConfig())) {
            assertEquals(BranchState.DEAD_END, k.graph().getBranch("weak").orElseThrow().state);
        }
    }

    @Test
    void restoreNeedsPersistence() throws Exception {
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(new EngineConfig())) {
            GraphException e = assertThrows(GraphException.class, k::restore);
            assertEquals(ErrorCode.CONFIGURATION_ERROR, e.code());
        }
    }

    @Test
    void goalSurvivesRestore() throws Exception {
        try (GraphKernel k = GraphKernel.builder().configRoot(root).build(persistentConfig())) {
            k.addThought(ThoughtInput.builder("Cats hunt small mice").branchId("main").build());
            assertEquals("cats", k.setGoal(" cats ").orElseThrow());

            k.restore();
            assertEquals("cats", k.evaluator().goal().orElseThrow());
            EvaluationResult r = k.evaluate("main").orElseThrow();
            assertEquals(1.0, r.goalAlignment, 1e-9);
            assertEquals(1, r.thoughtCount);
            assertTrue(k.statistics().orElseThrow().totalThoughts == 1);
            assertTrue(k.detectCircularReasoning().orElseThrow().isEmpty());
        }
    }
}
