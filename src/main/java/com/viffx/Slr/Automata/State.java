package com.viffx.Slr.Automata;

import com.viffx.Slr.Grammar.Grammar;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A state of the LR(0) automaton: its id and the closed set of items it holds.
 */
public record State(int id, SortedSet<Item> items) {
    public State {
        items = Collections.unmodifiableSortedSet(new TreeSet<>(items));
    }

    /**
     * Returns the items that are not added by closure: the start item of state 0 and every item
     * whose dot has moved.
     */
    public List<Item> kernel() {
        return items.stream()
                .filter(item -> item.dot() > 0 || item.index() == Grammar.START_PRODUCTION)
                .collect(Collectors.toList());
    }
}
