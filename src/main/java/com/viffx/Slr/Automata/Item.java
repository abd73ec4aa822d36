package com.viffx.Slr.Automata;

/**
 * An LR(0) item: production {@code index} with {@code dot} symbols of its right hand side recognised.
 */
public record Item(int index, int dot) implements Comparable<Item> {
    public Item {
        if (index < 0 || dot < 0) throw new IllegalArgumentException("Items need a non-negative index and dot");
    }

    public Item advance() {
        return new Item(index, dot + 1);
    }

    @Override
    public int compareTo(Item o) {
        return index != o.index ? Integer.compare(index, o.index) : Integer.compare(dot, o.dot);
    }
}
