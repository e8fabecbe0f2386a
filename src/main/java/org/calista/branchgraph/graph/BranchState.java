package org.calista.branchgraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BranchState {
    ACTIVE,
    SUSPENDED,
    COMPLETED,
    DEAD_END;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BranchState parse(String s) {
        if (s == null) throw new IllegalArgumentException("branch state is null");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
