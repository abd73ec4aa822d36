package com.viffx.Slr.Compiler;

import com.viffx.Slr.Symbols.Position;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Symbols.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Serves tokens from memory. An {@code EOF} token is appended unless the list already ends with one.
 */
public final class ListTokenSource implements TokenSource {
    private final List<Token> tokens;
    private int index = 0;

    public ListTokenSource(List<Token> tokens) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || !copy.get(copy.size() - 1).isEof()) {
            copy.add(Token.eof(new Position(1, copy.size() + 1)));
        }
        this.tokens = List.copyOf(copy);
    }

    /**
     * Builds one token per terminal, using {@link Terminal#display()} as the lexeme and the list
     * position as the column.
     */
    public static ListTokenSource of(Terminal... terminals) {
        List<Token> tokens = new ArrayList<>(terminals.length);
        for (Terminal terminal : terminals) {
            tokens.add(new Token(terminal, terminal.display(), new Position(1, tokens.size() + 1)));
        }
        return new ListTokenSource(tokens);
    }

    @Override
    public Token next() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) index++;
        return token;
    }

    public List<Token> tokens() {
        return tokens;
    }
}
