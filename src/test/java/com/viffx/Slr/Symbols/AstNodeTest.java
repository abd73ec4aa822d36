package com.viffx.Slr.Symbols;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AstNodeTest {
    private static AstNode id(String lexeme, int column) {
        return AstNode.leaf(new Token(Terminal.ID, lexeme, new Position(1, column)));
    }

    @Test
    void equalityIgnoresPositions() {
        AstNode first = AstNode.node(new NonTerminal("T"), 3, List.of(id("a", 1)));
        AstNode second = AstNode.node(new NonTerminal("T"), 3, List.of(id("a", 9)));

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first).isNotEqualTo(AstNode.node(new NonTerminal("T"), 3, List.of(id("b", 1))));
        assertThat(first).isNotEqualTo(AstNode.node(new NonTerminal("T"), 4, List.of(id("a", 1))));
    }

    @Test
    void shapeIgnoresLabels() {
        AstNode first = AstNode.node(new NonTerminal("T"), 3, List.of(id("a", 1), id("b", 2)));
        AstNode second = AstNode.node(new NonTerminal("U"), -1, List.of(id("x", 1), id("y", 2)));
        AstNode third = AstNode.node(new NonTerminal("T"), 3, List.of(id("a", 1)));

        assertThat(first.sameShape(second)).isTrue();
        assertThat(first.sameShape(third)).isFalse();
        assertThat(first.sameShape(null)).isFalse();
    }

    @Test
    void collectsLeavesLeftToRight() {
        AstNode tree = AstNode.node(new NonTerminal("E"), 1, List.of(
                AstNode.node(new NonTerminal("T"), 2, List.of(id("a", 1))),
                id("b", 2),
                AstNode.node(new NonTerminal("T"), 2, List.of(id("c", 3)))));

        assertThat(tree.leaves()).extracting(Token::lexeme).containsExactly("a", "b", "c");
        assertThat(tree.isLeaf()).isFalse();
        assertThat(tree.label()).isEqualTo("E");
        assertThat(tree.token()).isNull();
    }

    @Test
    void childrenCannotBeChanged() {
        AstNode tree = AstNode.node(new NonTerminal("T"), 3, List.of(id("a", 1)));
        assertThatThrownBy(() -> tree.children().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void terminalsDisplayAsTyped() {
        assertThat(Terminal.ID.display()).isEqualTo("id");
        assertThat(Terminal.symbol("==").display()).isEqualTo("==");
        assertThat(Terminal.keyword("if").toString()).isEqualTo("KEY(if)");
        assertThat(Terminal.EOF.toString()).isEqualTo("EOF($)");
    }
}
