package com.viffx.Slr.Grammar;

import com.viffx.Slr.Automata.Item;
import com.viffx.Slr.Symbols.NonTerminal;
import com.viffx.Slr.Symbols.Symbol;
import com.viffx.Slr.Symbols.SymbolType;
import com.viffx.Slr.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;

/**
 * An immutable context free grammar with every symbol mapped to an integer index.
 * <p>
 * Production {@code 0} is always the synthetic {@code START > S;} production added for the
 * designated start symbol {@code S}; reducing by it means the whole input has been recognised.
 * Empty right hand sides are stored as productions of length zero, the {@code EPSILON} symbol only
 * shows up inside FIRST sets.
 */
public class Grammar {
    /**
     * Index of the synthetic {@code START > S;} production.
     */
    public static final int START_PRODUCTION = 0;

    // ====== INSTANCE FIELDS ====== //
    // Symbols fields
    private final Symbol[] symbols;
    private final Map<Symbol, Integer> indexes;
    private final boolean[] isNonTerminal;
    private final int[] nonTerminals;
    private final int[] terminals;
    private final int EPSILON;
    private final int EOF;
    private final int START;
    private final int startSymbol;

    // Productions fields
    private final List<Production> productions;
    private final int[][] productionsOf;

    // ====== CONSTRUCTORS ====== //
    private Grammar(Builder builder) {
        if (builder.start == null) throw new MalformedGrammarException("No start symbol is set");
        if (NonTerminal.START.equals(builder.start)) {
            throw new MalformedGrammarException("The NonTerminal START is reserved and cannot be the start symbol");
        }

        // register every symbol in order of first appearance
        Map<Symbol, Integer> indexes = new LinkedHashMap<>();
        indexes.put(NonTerminal.START, 0);
        indexes.put(builder.start, 1);
        Set<NonTerminal> defined = new HashSet<>();
        for (Rule rule : builder.rules) {
            checkRule(rule);
            defined.add(rule.lhs());
            indexes.putIfAbsent(rule.lhs(), indexes.size());
            for (Symbol symbol : rule.rhs()) {
                if (Terminal.EPSILON.equals(symbol)) continue;
                indexes.putIfAbsent(symbol, indexes.size());
            }
        }
        checkForUndefinedNonTerminals(indexes.keySet(), defined);
        indexes.putIfAbsent(Terminal.EPSILON, indexes.size());
        indexes.putIfAbsent(Terminal.EOF, indexes.size());

        // reduce the symbols to arrays
        symbols = new Symbol[indexes.size()];
        isNonTerminal = new boolean[indexes.size()];
        int[] nonTerminals = new int[indexes.size()];
        int[] terminals = new int[indexes.size()];
        int nonTerminalCount = 0;
        int terminalCount = 0;
        for (Map.Entry<Symbol, Integer> entry : indexes.entrySet()) {
            int index = entry.getValue();
            Symbol symbol = entry.getKey();
            symbols[index] = symbol;
            isNonTerminal[index] = !symbol.isTerminal();
            if (isNonTerminal[index]) {
                nonTerminals[nonTerminalCount++] = index;
            } else if (!Terminal.EPSILON.equals(symbol)) {
                terminals[terminalCount++] = index;
            }
        }
        this.nonTerminals = Arrays.copyOf(nonTerminals, nonTerminalCount);
        this.terminals = Arrays.copyOf(terminals, terminalCount);
        this.indexes = Collections.unmodifiableMap(indexes);
        START = 0;
        startSymbol = 1;
        EPSILON = indexes.get(Terminal.EPSILON);
        EOF = indexes.get(Terminal.EOF);

        // compile the rules into productions, dropping epsilons
        List<Production> productions = new ArrayList<>(builder.rules.size() + 1);
        productions.add(new Production(START_PRODUCTION, START, new int[]{startSymbol}));
        for (Rule rule : builder.rules) {
            int[] rhs = rule.rhs().stream()
                    .filter(symbol -> !Terminal.EPSILON.equals(symbol))
                    .mapToInt(indexes::get)
                    .toArray();
            productions.add(new Production(productions.size(), indexes.get(rule.lhs()), rhs));
        }
        this.productions = List.copyOf(productions);

        // group the production indexes by left hand side
        List<List<Integer>> grouped = new ArrayList<>(symbols.length);
        for (int i = 0; i < symbols.length; i++) grouped.add(new ArrayList<>());
        for (Production production : productions) grouped.get(production.lhs()).add(production.index());
        productionsOf = new int[symbols.length][];
        for (int i = 0; i < symbols.length; i++) {
            productionsOf[i] = grouped.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a grammar written in the grammar text format, for example:
     * <pre>
     *   START > E;
     *   E > E SYM(+) T | T;
     *   T > ID();
     * </pre>
     *
     * @throws MalformedGrammarException if the text is not a valid grammar
     * @throws IOException if the reader fails
     */
    public static Grammar load(Reader reader) throws IOException {
        return new GrammarReader(reader).read();
    }

    public static Grammar load(Path filePath) throws IOException {
        try (Reader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    /**
     * Loads a grammar bundled on the classpath, such as {@code grammars/lang.grammar}.
     */
    public static Grammar loadResource(String resource) throws IOException {
        InputStream stream = Grammar.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) throw new IOException("Could not find grammar resource: " + resource);
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public static Grammar parse(String text) {
        try {
            return load(new StringReader(text));
        } catch (IOException e) {
            throw new MalformedGrammarException("Could not read grammar text", e);
        }
    }

    // ====== PUBLIC API ====== //

    // Items

    /**
     * Returns if the input {@code item} is at or beyond the end of the production it references
     *
     * @param item the grammar item whose dot position is inspected
     * @return if the item's dot is at or beyond the end of the production it references
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public boolean atEnd(@NotNull Item item) {
        Objects.requireNonNull(item, "item cannot be null");
        return productions.get(item.index()).atEnd(item.dot());
    }

    /**
     * Returns the grammar symbol index at the current dot position of the given item.
     *
     * @param item the grammar item whose dot position is inspected
     * @return the symbol index at the dot position
     * @throws IndexOutOfBoundsException if the dot position is equal to or greater than the production size
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public int symbol(@NotNull Item item) {
        Objects.requireNonNull(item, "item cannot be null");

        Production production = productions.get(item.index());
        if (production.atEnd(item.dot())) {
            throw new IndexOutOfBoundsException(
                    String.format("Index %d out of bounds for length %d", item.dot(), production.size()));
        }
        return production.symbol(item.dot());
    }

    /**
     * Returns a string representation of the given grammar {@link Item} in the
     * "production with dot" style, for example:
     * <pre>
     *   E > E • SYM(+) T;
     * </pre>
     *
     * @param item the grammar item to represent as a string
     * @return a human-readable string showing the production and dot position
     */
    public String toString(Item item) {
        if (item == null) return "null";
        Production production = productions.get(item.index());

        StringBuilder builder = new StringBuilder();
        builder.append(symbols[production.lhs()]).append(" >");
        for (int i = 0; i < production.size(); i++) {
            if (i == item.dot()) builder.append(" •");
            builder.append(' ').append(symbols[production.symbol(i)]);
        }
        if (production.isEmpty()) builder.append(" EPSILON()");
        if (production.atEnd(item.dot())) builder.append(" •");
        return builder.append(';').toString();
    }

    // Productions

    /**
     * Returns a string representation of the given {@link Production} in the grammar text format:
     * <pre>
     *   A > B SYM(;) D;
     * </pre>
     * An empty right hand side is printed as {@code EPSILON()}.
     *
     * @param production the grammar production to represent as a string
     * @return a human-readable string showing the production rule
     */
    public String toString(Production production) {
        StringBuilder builder = new StringBuilder();
        builder.append(symbols[production.lhs()]).append(" >");
        if (production.isEmpty()) return builder.append(" EPSILON();").toString();
        for (int symbol : production) {
            builder.append(' ').append(symbols[symbol]);
        }
        return builder.append(';').toString();
    }

    /**
     * Resolves a production index to its corresponding {@link Production} object.
     *
     * @param production the integer index of the production
     * @return the {@link Production} corresponding to the index
     */
    public Production production(int production) {
        return productions.get(production);
    }

    /**
     * Returns the total number of productions in the grammar, including the {@code START} production.
     */
    public int productionsCount() {
        return productions.size();
    }

    /**
     * Applies the given {@link Consumer} to the index of every production whose left hand side is
     * {@code nonTerminal}, in declaration order.
     *
     * @param nonTerminal the non-terminal whose productions to iterate over
     * @param consumer a function to process each production index belonging to that non-terminal
     */
    public void forEachProduction(int nonTerminal, Consumer<Integer> consumer) {
        for (int index : productionsOf[nonTerminal]) {
            consumer.accept(index);
        }
    }

    // Symbols

    /**
     * Resolves a symbol index to its corresponding {@link Symbol} object.
     */
    public Symbol symbol(int symbol) {
        return symbols[symbol];
    }

    /**
     * Returns the index of {@code symbol}, or {@code -1} if the grammar does not use it.
     */
    @Contract(pure = true)
    public int indexOf(@NotNull Symbol symbol) {
        Integer index = indexes.get(symbol);
        return index == null ? -1 : index;
    }

    public boolean isNonTerminal(int symbol) {
        return isNonTerminal[symbol];
    }

    /**
     * Returns the total number of grammar symbols, terminals, non-terminals and {@code EPSILON} alike.
     */
    public int symbolCount() {
        return symbols.length;
    }

    /**
     * Returns the indexes of every terminal that can appear in the input, {@code EOF} included
     * and {@code EPSILON} excluded.
     */
    public int[] terminals() {
        return terminals.clone();
    }

    public int[] nonTerminals() {
        return nonTerminals.clone();
    }

    public void forEachNonTerminal(Consumer<Integer> consumer) {
        for (int nonTerminal : nonTerminals) {
            consumer.accept(nonTerminal);
        }
    }

    /**
     * Returns the literal values of every terminal of the given type, for instance all keywords.
     */
    public Set<String> literals(SymbolType type) {
        Set<String> literals = new LinkedHashSet<>();
        for (int terminal : terminals) {
            Terminal t = (Terminal) symbols[terminal];
            if (t.type() == type && t.value() != null) literals.add(t.value());
        }
        return literals;
    }

    // Special Symbols

    /**
     * Returns the index of the {@code EPSILON} symbol, the empty string marker used by FIRST sets.
     */
    public int EPSILON() {
        return EPSILON;
    }

    /**
     * Returns the index of the {@code EOF} symbol, the end marker terminating every input.
     */
    public int EOF() {
        return EOF;
    }

    /**
     * Returns the index of the synthetic {@code START} non-terminal.
     */
    public int START() {
        return START;
    }

    /**
     * Returns the index of the user designated start symbol.
     */
    public int startSymbol() {
        return startSymbol;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Production production : productions) {
            builder.append(production.index()).append(": ").append(toString(production)).append('\n');
        }
        return builder.toString();
    }

    // ====== VALIDATION ====== //
    private static void checkRule(Rule rule) {
        if (NonTerminal.START.equals(rule.lhs())) {
            throw new MalformedGrammarException("The NonTerminal START cannot be redefined");
        }
        for (Symbol symbol : rule.rhs()) {
            if (NonTerminal.START.equals(symbol)) {
                throw new MalformedGrammarException("The NonTerminal START cannot be part of any right hand side: " + rule);
            }
            if (symbol instanceof Terminal t && t.type() == SymbolType.EOF) {
                throw new MalformedGrammarException("The end marker cannot be part of any right hand side: " + rule);
            }
        }
    }

    // find all used non-terminals that are not defined and notify the user
    private static void checkForUndefinedNonTerminals(Set<Symbol> used, Set<NonTerminal> defined) {
        List<Symbol> undefined = new ArrayList<>();
        for (Symbol symbol : used) {
            if (symbol.isTerminal() || NonTerminal.START.equals(symbol)) continue;
            if (!defined.contains(symbol)) undefined.add(symbol);
        }
        if (!undefined.isEmpty()) {
            throw new MalformedGrammarException("The following nonTerminals are undefined in the input grammar: " + undefined);
        }
    }

    // ====== BUILDER ====== //
    private record Rule(NonTerminal lhs, List<Symbol> rhs) {
        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder().append(lhs).append(" >");
            rhs.forEach(symbol -> builder.append(' ').append(symbol));
            return builder.append(';').toString();
        }
    }

    /**
     * Collects rules in declaration order. Non-terminals may be referenced before they are defined;
     * {@link #build()} fails if one never is.
     */
    public static final class Builder {
        private NonTerminal start;
        private final List<Rule> rules = new ArrayList<>();

        private Builder() {}

        public Builder start(String name) {
            start = new NonTerminal(name);
            return this;
        }

        public Builder rule(String lhs, Symbol... rhs) {
            return rule(new NonTerminal(lhs), Arrays.asList(rhs));
        }

        public Builder rule(@NotNull NonTerminal lhs, @NotNull List<? extends Symbol> rhs) {
            Objects.requireNonNull(lhs, "lhs cannot be null");
            for (Symbol symbol : rhs) Objects.requireNonNull(symbol, "right hand sides cannot hold null");
            rules.add(new Rule(lhs, List.copyOf(rhs)));
            return this;
        }

        public Grammar build() {
            return new Grammar(this);
        }
    }
}
