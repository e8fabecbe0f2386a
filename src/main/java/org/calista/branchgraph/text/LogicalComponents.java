package org.calista.branchgraph.text;

import java.util.List;

/**
 * Premises, conclusions and explicit thought references found in one piece of text.
 * All lists are immutable and keep extraction order.
 */
public final class LogicalComponents {

    public static final LogicalComponents EMPTY = new LogicalComponents(List.of(), List.of(), List.of());

    public final List<String> premises;
    public final List<String> conclusions;
    public final List<String> dependencies;

    public LogicalComponents(List<String> premises, List<String> conclusions, List<String> dependencies) {
        this.premises = premises == null ? List.of() : List.copyOf(premises);
        this.conclusions = conclusions == null ? List.of() : List.copyOf(conclusions);
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public boolean isEmpty() {
        return premises.isEmpty() && conclusions.isEmpty() && dependencies.isEmpty();
    }

    @Override
    public String toString() {
        return "LogicalComponents{premises=" + premises + ", conclusions=" + conclusions + ", dependencies=" + dependencies + '}';
    }
}
