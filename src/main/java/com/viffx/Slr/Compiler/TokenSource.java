package com.viffx.Slr.Compiler;

import com.viffx.Slr.Symbols.Token;

import java.io.IOException;

/**
 * A pull based, in order sequence of tokens ending with exactly one {@code EOF} token.
 * <p>
 * The parser calls {@link #next()} once per consumed token and never after receiving {@code EOF}.
 */
@FunctionalInterface
public interface TokenSource {
    Token next() throws IOException;
}
