package com.viffx.Slr.Symbols;

public sealed interface Symbol permits Terminal, NonTerminal {
    String value();
    boolean isTerminal();
}
