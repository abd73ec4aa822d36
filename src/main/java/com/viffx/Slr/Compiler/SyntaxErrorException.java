package com.viffx.Slr.Compiler;

import com.viffx.Slr.Symbols.Position;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Symbols.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the input is not in the language of the grammar. The parse that threw it is over;
 * the table it ran on is unaffected.
 */
public class SyntaxErrorException extends Exception {
    private final Token token;
    private final int tokenIndex;
    private final int state;
    private final List<Terminal> expected;

    public SyntaxErrorException(Token token, int tokenIndex, int state, List<Terminal> expected) {
        super("Unexpected token '" + token.lexeme() + "' at " + token.position() +
                ". Expected one of: " + expected.stream().map(Terminal::display).collect(Collectors.joining(", ")));
        this.token = token;
        this.tokenIndex = tokenIndex;
        this.state = state;
        this.expected = List.copyOf(expected);
    }

    public Token token() {
        return token;
    }

    public Position position() {
        return token.position();
    }

    /**
     * @return the zero based index of the offending token in the input
     */
    public int tokenIndex() {
        return tokenIndex;
    }

    public int state() {
        return state;
    }

    public List<Terminal> expected() {
        return expected;
    }
}
