package com.viffx.Slr.Compiler;

import java.util.List;

/**
 * Thrown when a grammar is not SLR(1): two different actions compete for the same cell of the
 * action table. The table is never returned in that case.
 */
public class GrammarConflictException extends IllegalStateException {
    public enum Kind { SHIFT_REDUCE, REDUCE_REDUCE }

    private final Kind kind;
    private final int state;
    private final String terminal;
    private final Action existing;
    private final Action conflicting;
    private final List<String> items;

    public GrammarConflictException(Kind kind, int state, String terminal, Action existing, Action conflicting, List<String> items) {
        super(kind + " conflict in state " + state + " on " + terminal + ": " + existing + " vs " + conflicting +
                "\n\tITEMS: " + String.join("\n\t       ", items));
        this.kind = kind;
        this.state = state;
        this.terminal = terminal;
        this.existing = existing;
        this.conflicting = conflicting;
        this.items = List.copyOf(items);
    }

    public Kind kind() {
        return kind;
    }

    public int state() {
        return state;
    }

    public String terminal() {
        return terminal;
    }

    public Action existing() {
        return existing;
    }

    public Action conflicting() {
        return conflicting;
    }

    /**
     * @return the items of the conflicting state, printed as dotted productions
     */
    public List<String> items() {
        return items;
    }
}
