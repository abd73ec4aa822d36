package com.viffx.Slr.Compiler;

import com.viffx.Slr.Symbols.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The stack of a running parse. Each entry pairs a state with the tree built for the symbol that
 * led into it. The bottom entry holds state {@code 0} and no tree and can never be popped.
 */
final class ParseStack {
    record Entry(int state, AstNode node) {}

    private final List<Entry> entries = new ArrayList<>();

    ParseStack() {
        entries.add(new Entry(0, null));
    }

    void push(int state, AstNode node) {
        entries.add(new Entry(state, node));
    }

    int state() {
        return entries.get(entries.size() - 1).state();
    }

    AstNode node() {
        return entries.get(entries.size() - 1).node();
    }

    /**
     * Removes the top {@code count} entries and returns their trees, bottom most first.
     *
     * @throws IllegalStateException if that would remove the bottom entry
     */
    List<AstNode> pop(int count) {
        if (count >= entries.size()) {
            throw new IllegalStateException("Cannot pop " + count + " entries from a stack of " + (entries.size() - 1));
        }
        List<Entry> top = entries.subList(entries.size() - count, entries.size());
        List<AstNode> nodes = new ArrayList<>(count);
        for (Entry entry : top) nodes.add(entry.node());
        top.clear();
        return nodes;
    }

    /**
     * @return the number of entries above the bottom one
     */
    int size() {
        return entries.size() - 1;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[0");
        for (int i = 1; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            builder.append(' ').append(entry.node().label()).append(' ').append(entry.state());
        }
        return builder.append(']').toString();
    }
}
