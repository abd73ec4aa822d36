package com.viffx.Slr.Automata;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Grammar.Production;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * FIRST sets for every symbol and FOLLOW sets for every non-terminal of a {@link Grammar}.
 * <p>
 * Sets are {@link BitSet}s indexed by symbol. A non-terminal that derives the empty string carries
 * the {@code EPSILON} bit in its FIRST set; FOLLOW sets never do. Both are computed by passes over
 * all productions that repeat until nothing changes, which terminates because sets only grow and
 * are bounded by the symbol count.
 */
public final class FirstFollowSets {
    private static final Logger logger = LogManager.getLogger(FirstFollowSets.class);

    //[INSTANCE_FIELDS]
    private final Grammar grammar;
    private final BitSet[] first;
    private final BitSet[] follow;

    //[CONSTRUCTORS]
    public FirstFollowSets(Grammar grammar) {
        this.grammar = grammar;
        int symbolCount = grammar.symbolCount();
        first = new BitSet[symbolCount];
        follow = new BitSet[symbolCount];
        for (int i = 0; i < symbolCount; i++) {
            first[i] = new BitSet(symbolCount);
            follow[i] = new BitSet(symbolCount);
            // a terminal (EPSILON and EOF included) begins only with itself
            if (!grammar.isNonTerminal(i)) first[i].set(i);
        }

        int firstPasses = computeFirstSets();
        int followPasses = computeFollowSets();
        logger.debug("FIRST sets settled after {} passes, FOLLOW sets after {} passes", firstPasses, followPasses);
        if (logger.isTraceEnabled()) logger.trace("\n{}", describe());
    }

    //[PRIVATE_METHODS]
    private int computeFirstSets() {
        int passes = 0;
        boolean change;
        do {
            change = false;
            passes++;
            for (int i = 0; i < grammar.productionsCount(); i++) {
                Production production = grammar.production(i);
                BitSet lhs = first[production.lhs()];
                int before = lhs.cardinality();
                lhs.or(firstOf(production));
                change |= lhs.cardinality() != before;
            }
        } while (change);
        return passes;
    }

    private int computeFollowSets() {
        final int EPSILON = grammar.EPSILON();
        follow[grammar.START()].set(grammar.EOF());
        follow[grammar.startSymbol()].set(grammar.EOF());

        int passes = 0;
        boolean change;
        do {
            change = false;
            passes++;
            for (int i = 0; i < grammar.productionsCount(); i++) {
                Production production = grammar.production(i);
                for (int dot = 0; dot < production.size(); dot++) {
                    int B = production.symbol(dot);
                    if (!grammar.isNonTerminal(B)) continue;

                    BitSet target = follow[B];
                    int before = target.cardinality();

                    // FOLLOW(B) gains FIRST(beta) without epsilon, and FOLLOW(A) when beta can vanish
                    BitSet beta = firstOf(production.beta(dot));
                    boolean vanishes = beta.get(EPSILON);
                    beta.clear(EPSILON);
                    target.or(beta);
                    if (vanishes) target.or(follow[production.lhs()]);

                    change |= target.cardinality() != before;
                }
            }
        } while (change);
        return passes;
    }

    //[PUBLIC_METHODS]
    /**
     * Returns FIRST of a sequence of symbols. The result holds {@code EPSILON} if every symbol of
     * the sequence can derive the empty string, which includes the empty sequence.
     *
     * @param symbols symbol indexes, read left to right
     * @return a fresh set the caller may modify
     */
    public BitSet firstOf(List<Integer> symbols) {
        final int EPSILON = grammar.EPSILON();
        BitSet result = new BitSet(first.length);
        for (int symbol : symbols) {
            BitSet current = first[symbol];
            result.or(current);
            if (!current.get(EPSILON)) {
                result.clear(EPSILON);
                return result;
            }
        }
        result.set(EPSILON);
        return result;
    }

    public BitSet first(int symbol) {
        return (BitSet) first[symbol].clone();
    }

    /**
     * @throws IllegalArgumentException if {@code nonTerminal} is a terminal
     */
    public BitSet follow(int nonTerminal) {
        if (!grammar.isNonTerminal(nonTerminal)) {
            throw new IllegalArgumentException("FOLLOW sets are only defined for non-terminals: " + grammar.symbol(nonTerminal));
        }
        return (BitSet) follow[nonTerminal].clone();
    }

    public boolean nullable(int symbol) {
        return first[symbol].get(grammar.EPSILON());
    }

    public String describe() {
        StringBuilder builder = new StringBuilder();
        grammar.forEachNonTerminal(nonTerminal -> builder
                .append(grammar.symbol(nonTerminal))
                .append(" FIRST => ").append(names(first[nonTerminal]))
                .append(" FOLLOW => ").append(names(follow[nonTerminal]))
                .append('\n'));
        return builder.toString();
    }

    private String names(BitSet set) {
        return set.stream()
                .mapToObj(grammar::symbol)
                .map(Object::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
