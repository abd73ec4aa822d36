package com.viffx.Slr.Automata;

import com.viffx.Slr.Grammar.Grammar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * The canonical collection of LR(0) item sets of a {@link Grammar} and the goto function between them.
 * <p>
 * State 0 is the closure of {@code START > • S;}. States are discovered breadth first and numbered
 * in discovery order; two item sets with the same content are the same state. Symbols are visited in
 * index order so the numbering is the same on every run.
 */
public final class LR0Automaton {
    private static final Logger logger = LogManager.getLogger(LR0Automaton.class);

    // ====== INSTANCE FIELDS ====== //
    private final Grammar grammar;
    private final List<State> states;
    // transitions[fromState][symbol] = toState, -1 when there is none
    private final int[][] transitions;

    // ====== CONSTRUCTORS ====== //
    public LR0Automaton(@NotNull Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");

        int symbolCount = grammar.symbolCount();
        Map<Set<Item>, Integer> stateToId = new HashMap<>();
        List<SortedSet<Item>> itemSets = new ArrayList<>();
        List<int[]> transitionTables = new ArrayList<>();

        SortedSet<Item> start = closure(List.of(new Item(Grammar.START_PRODUCTION, 0)));
        stateToId.put(start, 0);
        itemSets.add(start);

        // itemSets doubles as the work queue, every state added is expanded once
        for (int fromState = 0; fromState < itemSets.size(); fromState++) {
            SortedSet<Item> state = itemSets.get(fromState);
            int[] transitionTable = new int[symbolCount];
            Arrays.fill(transitionTable, -1);

            for (int symbol : symbolsAfterDot(state)) {
                SortedSet<Item> target = goTo(state, symbol);
                Integer toState = stateToId.get(target);
                if (toState == null) {
                    toState = itemSets.size();
                    stateToId.put(target, toState);
                    itemSets.add(target);
                }
                transitionTable[symbol] = toState;
            }
            transitionTables.add(transitionTable);
        }

        List<State> states = new ArrayList<>(itemSets.size());
        for (int i = 0; i < itemSets.size(); i++) {
            states.add(new State(i, itemSets.get(i)));
        }
        this.states = List.copyOf(states);
        this.transitions = transitionTables.toArray(new int[0][]);

        logger.debug("Built {} LR(0) states for {} productions", states.size(), grammar.productionsCount());
        if (logger.isTraceEnabled()) logger.trace("\n{}", describe());
    }

    // ====== PUBLIC API ====== //
    /**
     * Expands an item set with the initial items of every production of every non-terminal that
     * appears directly after a dot, until no new items appear.
     *
     * @param items the items to close over
     * @return a new sorted set holding {@code items} and everything they imply
     */
    public SortedSet<Item> closure(Collection<Item> items) {
        SortedSet<Item> J = new TreeSet<>(items);
        Queue<Item> queue = new ArrayDeque<>(items);
        while (!queue.isEmpty()) {
            Item item = queue.poll();

            if (grammar.atEnd(item)) continue;

            int B = grammar.symbol(item);
            if (!grammar.isNonTerminal(B)) continue;

            grammar.forEachProduction(B, index -> {
                Item newItem = new Item(index, 0);
                if (J.add(newItem)) queue.add(newItem);
            });
        }
        return J;
    }

    /**
     * Advances the dot over {@code symbol} in every item that allows it and closes the result.
     *
     * @return the successor item set, empty when no item has {@code symbol} after its dot
     */
    public SortedSet<Item> goTo(Collection<Item> items, int symbol) {
        List<Item> kernel = new ArrayList<>();
        for (Item item : items) {
            if (grammar.atEnd(item) || grammar.symbol(item) != symbol) continue;
            kernel.add(item.advance());
        }
        if (kernel.isEmpty()) return new TreeSet<>();
        return closure(kernel);
    }

    public State state(int id) {
        return states.get(id);
    }

    public List<State> states() {
        return states;
    }

    public int stateCount() {
        return states.size();
    }

    /**
     * @return the state reached from {@code fromState} over {@code symbol}, or {@code -1}
     */
    public int transition(int fromState, int symbol) {
        return transitions[fromState][symbol];
    }

    public Grammar grammar() {
        return grammar;
    }

    public String describe() {
        StringBuilder text = new StringBuilder();
        for (State state : states) {
            text.append("State ").append(state.id()).append(":\n");
            for (Item item : state.items()) {
                text.append("\t").append(grammar.toString(item)).append("\n");
            }
            int[] transitionTable = transitions[state.id()];
            for (int symbol = 0; symbol < transitionTable.length; symbol++) {
                if (transitionTable[symbol] < 0) continue;
                text.append("\ton ")
                        .append(grammar.symbol(symbol))
                        .append(" goto ")
                        .append(transitionTable[symbol])
                        .append("\n");
            }
        }
        return text.toString();
    }

    // ====== HELPERS ====== //
    private SortedSet<Integer> symbolsAfterDot(Set<Item> state) {
        SortedSet<Integer> symbols = new TreeSet<>();
        for (Item item : state) {
            if (!grammar.atEnd(item)) symbols.add(grammar.symbol(item));
        }
        return symbols;
    }
}
