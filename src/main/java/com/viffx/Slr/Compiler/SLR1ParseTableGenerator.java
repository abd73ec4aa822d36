package com.viffx.Slr.Compiler;

import com.viffx.Slr.Automata.FirstFollowSets;
import com.viffx.Slr.Automata.Item;
import com.viffx.Slr.Automata.LR0Automaton;
import com.viffx.Slr.Automata.State;
import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Grammar.Production;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Fills the SLR(1) tables from the LR(0) automaton and the FOLLOW sets of a grammar.
 * <p>
 * For every state and every item in it:
 * <ul>
 *   <li>{@code START > S •} puts ACCEPT on {@code EOF}.</li>
 *   <li>any other complete item {@code A > α •} puts REDUCE on every terminal of FOLLOW(A).</li>
 *   <li>an item with a terminal after the dot puts SHIFT to the successor state.</li>
 *   <li>an item with a non-terminal after the dot puts GOTO to the successor state.</li>
 * </ul>
 * A cell that would receive two different actions aborts the build with a
 * {@link GrammarConflictException}.
 */
public class SLR1ParseTableGenerator {
    private static final Logger logger = LogManager.getLogger(SLR1ParseTableGenerator.class);

    //[INSTANCE_FIELDS]
    private final Grammar grammar;
    private final FirstFollowSets sets;
    private final LR0Automaton automaton;

    //[CONSTRUCTORS]
    public SLR1ParseTableGenerator(@NotNull Grammar grammar) {
        this(grammar, new FirstFollowSets(grammar), new LR0Automaton(grammar));
    }

    public SLR1ParseTableGenerator(@NotNull Grammar grammar, @NotNull FirstFollowSets sets, @NotNull LR0Automaton automaton) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        this.sets = Objects.requireNonNull(sets, "sets cannot be null");
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
    }

    //[PUBLIC_METHODS]
    /**
     * @return the finished table
     * @throws GrammarConflictException if the grammar is not SLR(1)
     */
    public ParseTable generate() {
        List<Map<Integer, Action>> rows = new ArrayList<>(automaton.stateCount());
        for (State state : automaton.states()) {
            Map<Integer, Action> row = new TreeMap<>();
            for (Item item : state.items()) {
                if (grammar.atEnd(item)) {
                    addReduceActions(state, item, row);
                    continue;
                }
                int symbol = grammar.symbol(item);
                int target = automaton.transition(state.id(), symbol);
                if (target < 0) throw new IllegalStateException("State " + state.id() + " has no transition on " + grammar.symbol(symbol));
                Action action = grammar.isNonTerminal(symbol) ? Action.goTo(target) : Action.shift(target);
                put(state, row, symbol, action);
            }
            rows.add(row);
        }

        ParseTable table = new ParseTable(grammar, rows);
        logger.debug("Built SLR(1) table with {} states", table.stateCount());
        if (logger.isTraceEnabled()) logger.trace("\n{}", table.describe());
        return table;
    }

    //[HELPER_METHODS_FOR_GENERATE]
    private void addReduceActions(State state, Item item, Map<Integer, Action> row) {
        if (item.index() == Grammar.START_PRODUCTION) {
            put(state, row, grammar.EOF(), Action.ACCEPT);
            return;
        }
        Production production = grammar.production(item.index());
        BitSet follow = sets.follow(production.lhs());
        Action reduce = Action.reduce(item.index());
        for (int terminal = follow.nextSetBit(0); terminal >= 0; terminal = follow.nextSetBit(terminal + 1)) {
            put(state, row, terminal, reduce);
        }
    }

    private void put(State state, Map<Integer, Action> row, int symbol, Action action) {
        Action existing = row.putIfAbsent(symbol, action);
        if (existing == null || existing.equals(action)) return;

        GrammarConflictException.Kind kind =
                existing.type() == ActionType.SHIFT || action.type() == ActionType.SHIFT
                        ? GrammarConflictException.Kind.SHIFT_REDUCE
                        : GrammarConflictException.Kind.REDUCE_REDUCE;
        List<String> items = new ArrayList<>();
        for (Item item : state.items()) items.add(grammar.toString(item));
        GrammarConflictException conflict = new GrammarConflictException(
                kind, state.id(), grammar.symbol(symbol).toString(), existing, action, items);
        logger.debug("Aborting table build: {}", conflict.getMessage());
        throw conflict;
    }
}
