package org.calista.branchgraph.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.branchgraph.error.ConfigurationException;
import org.calista.branchgraph.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("engine.json");

        EngineConfig cfg = EngineConfig.loadOrCreate(io, file, mapper);
        assertTrue(Files.exists(file));
        assertEquals(16, cfg.hash.substringLength);
        assertEquals(512, cfg.embedding.dimension);

        EngineConfig again = EngineConfig.loadOrCreate(io, file, mapper);
        assertEquals(cfg.evaluation.windowSize, again.evaluation.windowSize);
        assertEquals(cfg.branch.duplicatePolicy, again.branch.duplicatePolicy);
    }

    @Test
    void partialFileKeepsDefaultsAndIgnoresUnknownKeys() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "{\"branch\":{\"duplicatePolicy\":\"IGNORE\"},\"legacy\":true,\"evaluation\":{\"windowSize\":0}}");

        EngineConfig cfg = EngineConfig.loadOrCreate(io, file, mapper);
        assertEquals(EngineConfig.DuplicateBranchPolicy.IGNORE, cfg.branch.duplicatePolicy);
        assertEquals(1, cfg.evaluation.windowSize);
        assertEquals(0.15, cfg.branch.overlapMargin);
    }

    @Test
    void weightsMustSumToOne() {
        EngineConfig cfg = new EngineConfig();
        cfg.evaluation.weights.coherence = 0.5;
        ConfigurationException e = assertThrows(ConfigurationException.class, cfg::validate);
        assertTrue(e.getMessage().contains("sum"), e.getMessage());
    }

    @Test
    void outOfRangeValuesAreRejected() {
        EngineConfig a = new EngineConfig();
        a.hash.substringLength = 4;
        assertThrows(ConfigurationException.class, a::validate);

        EngineConfig b = new EngineConfig();
        b.matrix.similarityThreshold = 1.5;
        assertThrows(ConfigurationException.class, b::validate);

        EngineConfig c = new EngineConfig();
        c.bloomFilter.positive.falsePositiveRate = 0.0;
        assertThrows(ConfigurationException.class, c::validate);

        EngineConfig d = new EngineConfig();
        d.branch.pruneThreshold = 1.5;
        assertThrows(ConfigurationException.class, d::validate);

        EngineConfig e = new EngineConfig();
        e.evaluation.thresholds.contradiction = -0.1;
        assertThrows(ConfigurationException.class, e::validate);
    }

    @Test
    void badFileFailsLoading() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "{\"circular\":{\"premiseSimilarity\":2.0}}");
        assertThrows(ConfigurationException.class, () -> EngineConfig.loadOrCreate(io, file, mapper));
    }
}
