package com.viffx.Slr.Symbols;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A token handed to the parser: the grammar terminal it was classified as, the text it was read
 * from and where that text was found.
 */
public record Token(@NotNull Terminal terminal, @NotNull String lexeme, @NotNull Position position) {

    public Token {
        Objects.requireNonNull(terminal, "terminal cannot be null");
        Objects.requireNonNull(lexeme, "lexeme cannot be null");
        Objects.requireNonNull(position, "position cannot be null");
    }

    public Token(Terminal terminal, String lexeme) {
        this(terminal, lexeme, Position.UNKNOWN);
    }

    public static Token eof(Position position) {
        return new Token(Terminal.EOF, "$", position);
    }

    public boolean isEof() {
        return terminal.equals(Terminal.EOF);
    }

    @Override
    public String toString() {
        return "Token{" +
                "terminal=" + terminal +
                ", lexeme='" + lexeme + '\'' +
                ", position=" + position +
                '}';
    }
}
