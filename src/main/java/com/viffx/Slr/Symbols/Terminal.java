package com.viffx.Slr.Symbols;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Objects;

/**
 * A terminal of the grammar.
 * <p>
 * A terminal with a {@code null} value stands for a whole token class (any identifier, any number,
 * any type name). A terminal with a value is a literal such as a keyword or a piece of punctuation.
 *
 * @param type  the kind of terminal
 * @param value the literal text, or {@code null} for a token class
 */
public record Terminal(@NotNull SymbolType type, String value) implements Symbol {
    public static final Terminal EPSILON = new Terminal(SymbolType.EPSILON, null);
    public static final Terminal EOF = new Terminal(SymbolType.EOF, "$");
    public static final Terminal ID = new Terminal(SymbolType.ID, null);
    public static final Terminal NUM = new Terminal(SymbolType.NUM, null);
    public static final Terminal TYPE = new Terminal(SymbolType.TYPE, null);
    public static final Terminal STR = new Terminal(SymbolType.STR, null);

    public Terminal {
        Objects.requireNonNull(type, "type cannot be null");
    }

    public static Terminal keyword(String value) {
        return new Terminal(SymbolType.KEY, value);
    }

    public static Terminal symbol(String value) {
        return new Terminal(SymbolType.SYM, value);
    }

    public boolean isClass() {
        return value == null;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    /**
     * Returns the text a user would type for this terminal: the literal itself, or the lower case
     * name of the token class ({@code id}, {@code num}, ...).
     */
    public String display() {
        if (value != null) return value;
        return type.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return type + "(" + (value == null ? "" : value.replaceAll("\n", "\\\\n")) + ")";
    }
}
