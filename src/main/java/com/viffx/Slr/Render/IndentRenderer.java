package com.viffx.Slr.Render;

import com.viffx.Slr.Symbols.AstNode;

/**
 * Prints a tree one node per line, each child indented {@code width} spaces deeper than its parent.
 * <pre>
 * E
 *   E
 *     T
 *       id
 *   +
 *   T
 *     id
 * </pre>
 */
public class IndentRenderer implements Renderer {
    public static final int DEFAULT_WIDTH = 2;

    private final String unit;

    public IndentRenderer() {
        this(DEFAULT_WIDTH);
    }

    public IndentRenderer(int width) {
        if (width < 0) throw new IllegalArgumentException("Indentation width cannot be negative: " + width);
        unit = " ".repeat(width);
    }

    @Override
    public String render(AstNode root) {
        StringBuilder builder = new StringBuilder();
        append(root, 0, builder);
        return builder.toString();
    }

    private void append(AstNode node, int depth, StringBuilder builder) {
        if (depth > 0) builder.append('\n');
        builder.append(unit.repeat(depth)).append(node.label());
        for (AstNode child : node.children()) {
            append(child, depth + 1, builder);
        }
    }
}
