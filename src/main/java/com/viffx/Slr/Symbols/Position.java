package com.viffx.Slr.Symbols;

/**
 * A one based line and column in the source a token was read from.
 */
public record Position(int line, int column) {
    public static final Position UNKNOWN = new Position(0, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
