package com.viffx.Slr.Compiler;

import com.viffx.Slr.Symbols.Position;

import java.io.IOException;

/**
 * Thrown by a token source when the input contains text that forms no token.
 */
public class LexerException extends IOException {
    private final Position position;

    public LexerException(String message, Position position) {
        super(message + " at " + position);
        this.position = position;
    }

    public Position position() {
        return position;
    }
}
