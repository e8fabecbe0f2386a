package org.calista.branchgraph.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CrossRefKind {
    COMPLEMENTARY,
    CONTRADICTORY,
    BUILDS_UPON,
    ALTERNATIVE,
    SUPPORTS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive; accepts {@code builds_upon} as well as {@code BUILDS_UPON}.
     *
     * @throws IllegalArgumentException on unknown names
     */
    @JsonCreator
    public static CrossRefKind parse(String s) {
        if (s == null) throw new IllegalArgumentException("cross reference kind is null");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
