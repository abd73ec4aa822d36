package com.viffx.Slr.Render;

import com.viffx.Slr.Symbols.AstNode;

/**
 * Turns a finished parse tree into text.
 */
@FunctionalInterface
public interface Renderer {
    String render(AstNode root);
}
