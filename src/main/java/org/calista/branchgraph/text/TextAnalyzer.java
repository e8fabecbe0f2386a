package org.calista.branchgraph.text;

/**
 * Extracts the logical skeleton of a thought.
 * Implementations must be deterministic and side-effect free.
 */
public interface TextAnalyzer {
    LogicalComponents analyze(String content);
}
