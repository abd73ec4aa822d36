package com.viffx.Slr.Render;

import com.viffx.Slr.Symbols.AstNode;

/**
 * Prints a tree on one line: an internal node as {@code (Name child ...)} and a leaf as its lexeme.
 * A node reduced from an empty production prints as {@code (Name)}.
 */
public class ParenRenderer implements Renderer {
    @Override
    public String render(AstNode root) {
        StringBuilder builder = new StringBuilder();
        append(root, builder);
        return builder.toString();
    }

    private void append(AstNode node, StringBuilder builder) {
        if (node.isLeaf()) {
            builder.append(node.label());
            return;
        }
        builder.append('(').append(node.label());
        for (AstNode child : node.children()) {
            builder.append(' ');
            append(child, builder);
        }
        builder.append(')');
    }
}
