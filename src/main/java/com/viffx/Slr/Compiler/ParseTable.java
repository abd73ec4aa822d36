package com.viffx.Slr.Compiler;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Symbols.Terminal;

import java.util.*;

/**
 * The ACTION and GOTO tables of an SLR(1) parser, one row per LR(0) state.
 * <p>
 * A row maps a symbol index to its action: terminals to {@code SHIFT}, {@code REDUCE} or
 * {@code ACCEPT}, non-terminals to {@code GOTO}. A missing entry is an error. The table is immutable
 * once built and may be shared by any number of concurrent parses.
 */
public final class ParseTable {
    private final Grammar grammar;
    private final List<Map<Integer, Action>> rows;

    ParseTable(Grammar grammar, List<? extends Map<Integer, Action>> rows) {
        this.grammar = grammar;
        List<Map<Integer, Action>> copy = new ArrayList<>(rows.size());
        for (Map<Integer, Action> row : rows) {
            copy.add(Collections.unmodifiableMap(new TreeMap<>(row)));
        }
        this.rows = List.copyOf(copy);
    }

    /**
     * @return the action for {@code terminal} in {@code state}, or {@code null} for an error entry
     */
    public Action action(int state, int terminal) {
        Action action = rows.get(state).get(terminal);
        if (action == null || action.type() == ActionType.GOTO) return null;
        return action;
    }

    /**
     * @return the state to push after reducing to {@code nonTerminal} in {@code state}, or {@code -1}
     */
    public int gotoState(int state, int nonTerminal) {
        Action action = rows.get(state).get(nonTerminal);
        if (action == null || action.type() != ActionType.GOTO) return -1;
        return action.data();
    }

    /**
     * Returns every terminal with a non error action in {@code state}, in symbol index order.
     */
    public List<Terminal> expectedTerminals(int state) {
        List<Terminal> expected = new ArrayList<>();
        rows.get(state).forEach((symbol, action) -> {
            if (action.type() != ActionType.GOTO) expected.add((Terminal) grammar.symbol(symbol));
        });
        return expected;
    }

    public Map<Integer, Action> row(int state) {
        return rows.get(state);
    }

    public int stateCount() {
        return rows.size();
    }

    public Grammar grammar() {
        return grammar;
    }

    public String describe() {
        StringBuilder text = new StringBuilder();
        for (int state = 0; state < rows.size(); state++) {
            text.append(state);
            rows.get(state).forEach((symbol, action) -> text
                    .append(" \"").append(grammar.symbol(symbol)).append("\" ==> ").append(action));
            text.append('\n');
        }
        return text.toString();
    }
}
