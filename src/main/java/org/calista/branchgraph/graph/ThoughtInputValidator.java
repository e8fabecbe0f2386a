package org.calista.branchgraph.graph;

import org.calista.branchgraph.core.EngineConfig;
import org.calista.branchgraph.error.ValidationException;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shape checks for store input. Pure: never looks at store state, never mutates anything.
 */
public final class ThoughtInputValidator {

    private static final Pattern BRANCH_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");
    public static final int MAX_DEPTH = 1000;
    private static final int MAX_REASON_LENGTH = 1000;

    private final int maxContentLength;
    private final int maxBranchIdLength;

    public ThoughtInputValidator(EngineConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.maxContentLength = cfg.text.maxContentLength;
        this.maxBranchIdLength = cfg.text.maxBranchIdLength;
    }

    public void validate(ThoughtInput in) {
        if (in == null) throw new ValidationException("input must not be null");
        validateContent(in.content);

        if (in.kind == null || in.kind.isBlank()) throw new ValidationException("kind must not be blank");
        if (in.confidence != null) validateUnit("confidence", in.confidence);

        if (in.branchId != null) validateBranchId(in.branchId, "branchId");
        if (in.parentBranchId != null) validateBranchId(in.parentBranchId, "parentBranchId");

        validateKeyPoints(in.keyPoints);

        for (int i = 0; i < in.crossRefs.size(); i++) {
            ThoughtInput.CrossRef r = in.crossRefs.get(i);
            String at = "crossRefs[" + i + "]";
            if (r == null) throw new ValidationException(at + " must not be null");
            validateBranchId(r.toBranch, at + ".toBranch");
            if (r.kind == null) throw new ValidationException(at + ".kind must not be null");
            if (r.reason == null || r.reason.isBlank()) throw new ValidationException(at + ".reason must not be blank");
            if (r.reason.length() > MAX_REASON_LENGTH) {
                throw new ValidationException(at + ".reason exceeds " + MAX_REASON_LENGTH + " characters");
            }
            validateUnit(at + ".strength", r.strength);
        }
    }

    public void validateContent(String content) {
        if (content == null) throw new ValidationException("content must not be null");
        String t = content.trim();
        if (t.isEmpty()) throw new ValidationException("content must not be empty");
        if (t.length() > maxContentLength) {
            throw new ValidationException("content exceeds " + maxContentLength + " characters: " + t.length());
        }
    }

    public void validateBranchId(String id, String field) {
        if (id == null || id.isEmpty()) throw new ValidationException(field + " must not be empty");
        if (id.length() > maxBranchIdLength) {
            throw new ValidationException(field + " exceeds " + maxBranchIdLength + " characters");
        }
        if (!BRANCH_ID.matcher(id).matches()) {
            throw new ValidationException(field + " may only contain letters, digits, '_' and '-': " + id);
        }
    }

    public void validateMaxDepth(int maxDepth) {
        if (maxDepth < 0) throw new ValidationException("maxDepth must be non-negative: " + maxDepth);
        if (maxDepth > MAX_DEPTH) throw new ValidationException("maxDepth exceeds " + MAX_DEPTH + ": " + maxDepth);
    }

    private static void validateKeyPoints(List<String> keyPoints) {
        if (keyPoints == null) return;
        for (int i = 0; i < keyPoints.size(); i++) {
            String k = keyPoints.get(i);
            if (k == null || k.isBlank()) throw new ValidationException("keyPoints[" + i + "] must not be blank");
        }
    }

    private static void validateUnit(String field, double v) {
        if (!Double.isFinite(v) || v < 0.0 || v > 1.0) {
            throw new ValidationException(field + " must be in [0,1]: " + v);
        }
    }
}
