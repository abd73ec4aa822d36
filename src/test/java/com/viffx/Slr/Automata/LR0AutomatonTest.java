package com.viffx.Slr.Automata;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Symbols.NonTerminal;
import com.viffx.Slr.Symbols.Terminal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LR(0) automaton")
class LR0AutomatonTest {
    private final Grammar grammar = Grammar.parse("""
            START > E;
            E > E SYM(+) T | T;
            T > ID();
            """);
    private final LR0Automaton automaton = new LR0Automaton(grammar);

    private final int E = grammar.indexOf(new NonTerminal("E"));
    private final int T = grammar.indexOf(new NonTerminal("T"));
    private final int PLUS = grammar.indexOf(Terminal.symbol("+"));
    private final int ID = grammar.indexOf(Terminal.ID);

    private List<String> items(int state) {
        return automaton.state(state).items().stream().map(grammar::toString).collect(Collectors.toList());
    }

    @Test
    @DisplayName("state 0 is the closure of the START item")
    void startState() {
        assertThat(items(0)).containsExactly(
                "START > • E;",
                "E > • E SYM(+) T;",
                "E > • T;",
                "T > • ID();");
        assertThat(automaton.state(0).kernel()).containsExactly(new Item(0, 0));
    }

    @Test
    @DisplayName("numbers states breadth first in symbol order")
    void numbering() {
        assertThat(automaton.stateCount()).isEqualTo(6);
        assertThat(automaton.transition(0, E)).isEqualTo(1);
        assertThat(automaton.transition(0, T)).isEqualTo(2);
        assertThat(automaton.transition(0, ID)).isEqualTo(3);
        assertThat(automaton.transition(1, PLUS)).isEqualTo(4);
        assertThat(automaton.transition(4, T)).isEqualTo(5);
        assertThat(items(5)).containsExactly("E > E SYM(+) T •;");
    }

    @Test
    @DisplayName("reuses a state reached twice with the same items")
    void deduplicates() {
        assertThat(automaton.transition(4, ID)).isEqualTo(automaton.transition(0, ID));
        assertThat(automaton.transition(2, PLUS)).isEqualTo(-1);
    }

    @Test
    @DisplayName("closure adds the productions of non-terminals after the dot")
    void closure() {
        assertThat(automaton.closure(List.of(new Item(1, 2))))
                .containsExactly(new Item(1, 2), new Item(3, 0));
    }

    @Test
    @DisplayName("goto is empty when no item can move over the symbol")
    void emptyGoTo() {
        assertThat(automaton.goTo(automaton.state(0).items(), PLUS)).isEmpty();
        assertThat(automaton.goTo(automaton.state(0).items(), E))
                .containsExactly(new Item(0, 1), new Item(1, 1));
    }

    @Test
    @DisplayName("builds the same automaton on every run")
    void deterministic() {
        assertThat(new LR0Automaton(grammar).describe()).isEqualTo(automaton.describe());
    }

    @Test
    @DisplayName("handles empty productions")
    void emptyProductions() {
        Grammar lists = Grammar.parse("""
                START > L;
                L > ID() L | EPSILON();
                """);
        LR0Automaton listAutomaton = new LR0Automaton(lists);
        assertThat(listAutomaton.state(0).items()).containsExactly(new Item(0, 0), new Item(1, 0), new Item(2, 0));
        assertThat(listAutomaton.stateCount()).isEqualTo(4);
    }
}
