package com.viffx.Slr.Grammar;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import java.util.RandomAccess;

/**
 * The right hand side of a production as a read only list of symbol indexes, tagged with the
 * index of its left hand side and its own position in the grammar.
 */
public final class Production extends AbstractList<Integer> implements RandomAccess {
    private final int index;
    private final int lhs;
    private final int[] rhs;

    Production(int index, int lhs, int[] rhs) {
        this.index = index;
        this.lhs = lhs;
        this.rhs = rhs.clone();
    }

    public int index() {
        return index;
    }

    public int lhs() {
        return lhs;
    }

    public boolean atEnd(int dot) {
        return dot >= rhs.length;
    }

    /**
     * Returns the symbols after the one at {@code dot}.
     */
    public List<Integer> beta(int dot) {
        dot++;
        if (dot > rhs.length) {
            throw new IndexOutOfBoundsException(String.format("Index %d out of bounds for length %d", dot, rhs.length));
        }
        return subList(dot, rhs.length);
    }

    @Override
    public Integer get(int i) {
        return rhs[i];
    }

    public int symbol(int i) {
        return rhs[i];
    }

    @Override
    public int size() {
        return rhs.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Production that)) return false;
        return index == that.index && lhs == that.lhs && Arrays.equals(rhs, that.rhs);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + lhs) + Arrays.hashCode(rhs);
    }

    @Override
    public String toString() {
        return "Production{" +
                "index=" + index +
                ", lhs=" + lhs +
                ", elements=" + Arrays.toString(rhs) +
                '}';
    }
}
