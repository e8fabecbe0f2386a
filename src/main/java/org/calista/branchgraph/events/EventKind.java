package org.calista.branchgraph.events;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum EventKind {
    @JsonProperty("thought_added") THOUGHT_ADDED,
    @JsonProperty("branch_created") BRANCH_CREATED,
    @JsonProperty("cross_ref_added") CROSS_REF_ADDED,
    @JsonProperty("branch_state_changed") BRANCH_STATE_CHANGED
}
