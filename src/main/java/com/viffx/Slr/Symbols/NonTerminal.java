package com.viffx.Slr.Symbols;

public record NonTerminal(String value) implements Symbol {
    public static final NonTerminal START = new NonTerminal("START");

    public NonTerminal {
        if (value == null || value.isEmpty()) throw new IllegalArgumentException("A NonTerminal needs a name");
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    @Override
    public String toString() {
        return value;
    }
}
