package org.calista.branchgraph.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the append-only mutation log. Indices start at 0 and have no gaps.
 * Instances handed out by the store must be treated as immutable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphEvent {
    public long index;
    public EventKind kind;
    public long tsEpochMs;
    public String branchId;
    public String thoughtId;
    public EventPayload payload;

    public static GraphEvent branchCreated(long index, long tsEpochMs, String branchId, String parentBranchId) {
        EventPayload p = new EventPayload();
        p.parentBranchId = parentBranchId;
        return of(index, EventKind.BRANCH_CREATED, tsEpochMs, branchId, null, p);
    }

    public static GraphEvent thoughtAdded(long index, long tsEpochMs, String branchId, String thoughtId,
                                          String content, String thoughtKind, double confidence,
                                          List<String> keyPoints, List<String> references) {
        EventPayload p = new EventPayload();
        p.content = content;
        p.thoughtKind = thoughtKind;
        p.confidence = confidence;
        p.keyPoints = List.copyOf(keyPoints);
        p.references = List.copyOf(references);
        return of(index, EventKind.THOUGHT_ADDED, tsEpochMs, branchId, thoughtId, p);
    }

    public static GraphEvent crossRefAdded(long index, long tsEpochMs, String thoughtId, CrossReference ref) {
        EventPayload p = new EventPayload();
        p.crossReference = ref;
        return of(index, EventKind.CROSS_REF_ADDED, tsEpochMs, ref.fromBranch, thoughtId, p);
    }

    public static GraphEvent branchStateChanged(long index, long tsEpochMs, String branchId, String state) {
        EventPayload p = new EventPayload();
        p.state = state;
        return of(index, EventKind.BRANCH_STATE_CHANGED, tsEpochMs, branchId, null, p);
    }

    private static GraphEvent of(long index, EventKind kind, long tsEpochMs, String branchId, String thoughtId, EventPayload payload) {
        GraphEvent e = new GraphEvent();
        e.index = index;
        e.kind = kind;
        e.tsEpochMs = tsEpochMs;
        e.branchId = branchId;
        e.thoughtId = thoughtId;
        e.payload = payload;
        return e;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphEvent e)) return false;
        return index == e.index
                && tsEpochMs == e.tsEpochMs
                && kind == e.kind
                && Objects.equals(branchId, e.branchId)
                && Objects.equals(thoughtId, e.thoughtId)
                && Objects.equals(payload, e.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, kind, tsEpochMs, branchId, thoughtId, payload);
    }

    @Override
    public String toString() {
        return "GraphEvent{#" + index + ' ' + kind + ", branch=" + branchId + (thoughtId == null ? "" : ", thought=" + thoughtId) + '}';
    }
}
