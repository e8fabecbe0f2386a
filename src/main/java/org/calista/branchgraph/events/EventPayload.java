package org.calista.branchgraph.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Data an event carries beyond its header. Which fields are set depends on the {@link EventKind}:
 * <ul>
 *   <li>THOUGHT_ADDED: content, thoughtKind, confidence, keyPoints, references</li>
 *   <li>BRANCH_CREATED: parentBranchId (null for the root)</li>
 *   <li>CROSS_REF_ADDED: crossReference</li>
 *   <li>BRANCH_STATE_CHANGED: state</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EventPayload {
    public String content;
    public String thoughtKind;
    public Double confidence;
    public List<String> keyPoints;
    /** Cross-reference target branches of the thought, in input order. */
    public List<String> references;
    public String parentBranchId;
    public CrossReference crossReference;
    public String state;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventPayload p)) return false;
        return Objects.equals(content, p.content)
                && Objects.equals(thoughtKind, p.thoughtKind)
                && Objects.equals(confidence, p.confidence)
                && Objects.equals(keyPoints, p.keyPoints)
                && Objects.equals(references, p.references)
                && Objects.equals(parentBranchId, p.parentBranchId)
                && Objects.equals(crossReference, p.crossReference)
                && Objects.equals(state, p.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, thoughtKind, confidence, keyPoints, references, parentBranchId, crossReference, state);
    }
}
