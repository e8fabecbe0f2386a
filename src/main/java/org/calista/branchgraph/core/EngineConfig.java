package org.calista.branchgraph.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.branchgraph.error.ConfigurationException;
import org.calista.branchgraph.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * EngineConfig: простой POJO конфиг движка:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует структурные значения и отклоняет невалидные пороги/веса
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public String baseDir = "data";
    public Text text = new Text();
    public Hash hash = new Hash();
    public Evaluation evaluation = new Evaluation();
    public Matrix matrix = new Matrix();
    public BloomFilters bloomFilter = new BloomFilters();
    public Branch branch = new Branch();
    public Circular circular = new Circular();
    public Embedding embedding = new Embedding();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Text {
        /** Concept words must be strictly longer than this. */
        public int minWordLength = 3;
        public int maxContentLength = 10_000;
        public int maxBranchIdLength = 100;
        public List<String> stopWords = new ArrayList<>(List.of(
                "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
                "from", "as", "is", "was", "are", "were", "been", "be", "have", "has", "had",
                "do", "does", "did", "will", "would", "could", "should", "may", "might",
                "must", "can", "this", "that", "these", "those", "it", "its", "a", "an"));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Hash {
        public int substringLength = 16;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Evaluation {
        public int windowSize = 5;
        public int goalWindow = 10;
        public int gradientWindow = 5;
        public int minSharedTerms = 2;
        public boolean embeddingGoalAlignment = false;
        public int similarityCacheSize = 1000;
        public List<String> negationTerms = new ArrayList<>(List.of(
                "not", "never", "no", "cannot", "disagree", "however", "but", "contrary"));
        public Weights weights = new Weights();
        public Thresholds thresholds = new Thresholds();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Weights {
        public double coherence = 0.20;
        public double contradiction = 0.25;
        public double informationGain = 0.20;
        public double goalAlignment = 0.15;
        public double confidenceGradient = 0.10;
        public double redundancy = 0.10;

        public double sum() {
            return coherence + contradiction + informationGain + goalAlignment + confidenceGradient + redundancy;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Thresholds {
        /** Above this a window member counts as redundant. */
        public double similarity = 0.85;
        /** Branches whose contradiction score is above this are reported. */
        public double contradiction = 0.7;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Matrix {
        public int initialSize = 1000;
        public double similarityThreshold = 0.3;
        public double clusteringMinSimilarity = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class BloomFilters {
        public FilterSpec positive = new FilterSpec(5_000, 0.001);
        public FilterSpec negative = new FilterSpec(5_000, 0.001);
        public FilterSpec conceptPairs = new FilterSpec(10_000, 0.01);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FilterSpec {
        public int expectedElements;
        public double falsePositiveRate;

        public FilterSpec() {
            this(10_000, 0.01);
        }

        public FilterSpec(int expectedElements, double falsePositiveRate) {
            this.expectedElements = expectedElements;
            this.falsePositiveRate = falsePositiveRate;
        }
    }

    public enum DuplicateBranchPolicy {
        REJECT,
        IGNORE
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Branch {
        public double defaultConfidence = 1.0;
        public double initialPriority = 0.5;
        public double initialConfidence = 0.5;
        public double overlapMargin = 0.15;
        public int keywordCount = 10;
        public DuplicateBranchPolicy duplicatePolicy = DuplicateBranchPolicy.REJECT;
        public double mergeThreshold = 0.7;
        public double driftThreshold = 0.5;
        public int driftSampleSize = 5;
        /** Active branches scoring below this are marked dead ends by pruning. */
        public double pruneThreshold = 0.2;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Circular {
        public int maxTrackedThoughts = 10_000;
        /** Closed BFS path must be longer than this to count as an indirect cycle. */
        public int indirectMinPathNodes = 3;
        public double premiseSimilarity = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Embedding {
        public int dimension = 512;
        public long timeoutMs = 5_000;
        public int cacheSize = 1000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public boolean persist = false;
        public String logFile = "events.jsonl";
        /** Take an OS file lock around every write; for logs shared by several processes. */
        public boolean lockWrites = false;
        public long lockTimeoutMs = 3_000;
        /** Force writes to disk before an append or config save returns. */
        public boolean fsync = false;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static EngineConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            EngineConfig created = new EngineConfig().validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            EngineConfig created = new EngineConfig().validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        EngineConfig cfg = mapper.readValue(json, EngineConfig.class);
        if (cfg == null) cfg = new EngineConfig();
        return cfg.validate();
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, EngineConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    /**
     * Normalizes missing sections and structural knobs, then rejects thresholds and weights
     * that would make scores meaningless.
     *
     * @return this, for chaining
     * @throws ConfigurationException on an invalid threshold or weight
     */
    public EngineConfig validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (text == null) text = new Text();
        if (text.minWordLength < 0) text.minWordLength = 0;
        if (text.maxContentLength < 1) text.maxContentLength = 10_000;
        if (text.maxBranchIdLength < 1) text.maxBranchIdLength = 100;
        if (text.stopWords == null) text.stopWords = new ArrayList<>();

        if (hash == null) hash = new Hash();
        if (hash.substringLength < 8 || hash.substringLength > 64) {
            throw new ConfigurationException("hash.substringLength must be in [8,64]: " + hash.substringLength);
        }

        if (evaluation == null) evaluation = new Evaluation();
        if (evaluation.windowSize < 1) evaluation.windowSize = 1;
        if (evaluation.goalWindow < 1) evaluation.goalWindow = 1;
        if (evaluation.gradientWindow < 2) evaluation.gradientWindow = 2;
        if (evaluation.minSharedTerms < 1) evaluation.minSharedTerms = 1;
        if (evaluation.similarityCacheSize < 16) evaluation.similarityCacheSize = 16;
        if (evaluation.negationTerms == null || evaluation.negationTerms.isEmpty()) {
            evaluation.negationTerms = new Evaluation().negationTerms;
        }
        if (evaluation.thresholds == null) evaluation.thresholds = new Thresholds();
        requireUnit("evaluation.thresholds.similarity", evaluation.thresholds.similarity);
        requireUnit("evaluation.thresholds.contradiction", evaluation.thresholds.contradiction);
        if (evaluation.weights == null) evaluation.weights = new Weights();
        validateWeights(evaluation.weights);

        if (matrix == null) matrix = new Matrix();
        if (matrix.initialSize < 1) matrix.initialSize = 1;
        requireUnit("matrix.similarityThreshold", matrix.similarityThreshold);
        requireUnit("matrix.clusteringMinSimilarity", matrix.clusteringMinSimilarity);

        if (bloomFilter == null) bloomFilter = new BloomFilters();
        if (bloomFilter.positive == null) bloomFilter.positive = new FilterSpec(5_000, 0.001);
        if (bloomFilter.negative == null) bloomFilter.negative = new FilterSpec(5_000, 0.001);
        if (bloomFilter.conceptPairs == null) bloomFilter.conceptPairs = new FilterSpec(10_000, 0.01);
        validateFilter("bloomFilter.positive", bloomFilter.positive);
        validateFilter("bloomFilter.negative", bloomFilter.negative);
        validateFilter("bloomFilter.conceptPairs", bloomFilter.conceptPairs);

        if (branch == null) branch = new Branch();
        if (branch.duplicatePolicy == null) branch.duplicatePolicy = DuplicateBranchPolicy.REJECT;
        if (branch.keywordCount < 1) branch.keywordCount = 1;
        if (branch.driftSampleSize < 1) branch.driftSampleSize = 1;
        requireUnit("branch.defaultConfidence", branch.defaultConfidence);
        requireUnit("branch.initialPriority", branch.initialPriority);
        requireUnit("branch.initialConfidence", branch.initialConfidence);
        requireUnit("branch.overlapMargin", branch.overlapMargin);
        requireUnit("branch.mergeThreshold", branch.mergeThreshold);
        requireUnit("branch.driftThreshold", branch.driftThreshold);
        requireUnit("branch.pruneThreshold", branch.pruneThreshold);

        if (circular == null) circular = new Circular();
        if (circular.maxTrackedThoughts < 2) circular.maxTrackedThoughts = 2;
        if (circular.indirectMinPathNodes < 2) circular.indirectMinPathNodes = 2;
        requireUnit("circular.premiseSimilarity", circular.premiseSimilarity);

        if (embedding == null) embedding = new Embedding();
        if (embedding.dimension < 16) embedding.dimension = 16;
        if (embedding.timeoutMs < 1) embedding.timeoutMs = 1;
        if (embedding.cacheSize < 16) embedding.cacheSize = 16;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "events.jsonl";
        if (events.lockTimeoutMs < 1) events.lockTimeoutMs = 1;

        return this;
    }

    private static void validateWeights(Weights w) {
        requireUnit("evaluation.weights.coherence", w.coherence);
        requireUnit("evaluation.weights.contradiction", w.contradiction);
        requireUnit("evaluation.weights.informationGain", w.informationGain);
        requireUnit("evaluation.weights.goalAlignment", w.goalAlignment);
        requireUnit("evaluation.weights.confidenceGradient", w.confidenceGradient);
        requireUnit("evaluation.weights.redundancy", w.redundancy);
        double sum = w.sum();
        if (Math.abs(sum - 1.0) > 1e-6) {
            throw new ConfigurationException(String.format(Locale.ROOT, "evaluation.weights must sum to 1.0, got %.6f", sum));
        }
    }

    private static void validateFilter(String name, FilterSpec f) {
        if (f.expectedElements < 1) {
            throw new ConfigurationException(name + ".expectedElements must be positive: " + f.expectedElements);
        }
        if (!(f.falsePositiveRate > 0.0 && f.falsePositiveRate < 1.0)) {
            throw new ConfigurationException(name + ".falsePositiveRate must be in (0,1): " + f.falsePositiveRate);
        }
    }

    private static void requireUnit(String name, double v) {
        if (!Double.isFinite(v) || v < 0.0 || v > 1.0) {
            throw new ConfigurationException(name + " must be in [0,1]: " + v);
        }
    }
}
