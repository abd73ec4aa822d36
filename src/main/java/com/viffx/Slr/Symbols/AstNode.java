package com.viffx.Slr.Symbols;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node of a finished parse tree.
 * <p>
 * Internal nodes stand for a reduced production and carry its left hand side and production index.
 * Leaves stand for a shifted {@link Token}. Equality is structural and ignores source positions,
 * so two parses of the same tokens compare equal.
 */
public final class AstNode {
    private final Symbol symbol;
    private final int production;
    private final Token token;
    private final List<AstNode> children;

    private AstNode(Symbol symbol, int production, Token token, List<AstNode> children) {
        this.symbol = symbol;
        this.production = production;
        this.token = token;
        this.children = children;
    }

    public static AstNode leaf(@NotNull Token token) {
        Objects.requireNonNull(token, "token cannot be null");
        return new AstNode(token.terminal(), -1, token, List.of());
    }

    public static AstNode node(@NotNull NonTerminal symbol, int production, @NotNull List<AstNode> children) {
        Objects.requireNonNull(symbol, "symbol cannot be null");
        return new AstNode(symbol, production, null, List.copyOf(children));
    }

    public Symbol symbol() {
        return symbol;
    }

    /**
     * @return the index of the reduced production, or {@code -1} for a leaf
     */
    public int production() {
        return production;
    }

    /**
     * @return the shifted token, or {@code null} for an internal node
     */
    public Token token() {
        return token;
    }

    public List<AstNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return token != null;
    }

    /**
     * Returns the text this node is printed as: the lexeme of a leaf or the name of an internal node.
     */
    public String label() {
        return isLeaf() ? token.lexeme() : symbol.value();
    }

    /**
     * Collects the tokens under this node from left to right.
     */
    public List<Token> leaves() {
        List<Token> leaves = new ArrayList<>();
        collectLeaves(this, leaves);
        return leaves;
    }

    private static void collectLeaves(AstNode node, List<Token> leaves) {
        if (node.isLeaf()) {
            leaves.add(node.token);
            return;
        }
        for (AstNode child : node.children) {
            collectLeaves(child, leaves);
        }
    }

    /**
     * Compares the branching of two trees while ignoring what the nodes hold.
     */
    public boolean sameShape(AstNode other) {
        if (other == null || isLeaf() != other.isLeaf()) return false;
        if (children.size() != other.children.size()) return false;
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameShape(other.children.get(i))) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AstNode that = (AstNode) o;
        if (!symbol.equals(that.symbol) || production != that.production) return false;
        if (isLeaf() != that.isLeaf()) return false;
        if (isLeaf() && !token.lexeme().equals(that.token.lexeme())) return false;
        return children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, production, isLeaf() ? token.lexeme() : null, children);
    }

    @Override
    public String toString() {
        return "AstNode{" +
                "symbol=" + symbol + ", " +
                (isLeaf() ? "lexeme=" + token.lexeme() : "children=" + children) +
                '}';
    }
}
