package com.viffx.Slr.Compiler;

import com.viffx.Slr.Symbols.AstNode;
import com.viffx.Slr.Symbols.Token;

/**
 * Observes the moves of a parse as they happen. Every method does nothing by default.
 */
public interface ParseListener {
    ParseListener NONE = new ParseListener() {};

    default void onShift(int state, Token token) {}

    default void onReduce(int production, AstNode node) {}

    default void onAccept(AstNode root) {}
}
