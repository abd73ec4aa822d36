package com.viffx.Slr.Compiler;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Grammar.Production;
import com.viffx.Slr.Symbols.AstNode;
import com.viffx.Slr.Symbols.NonTerminal;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Symbols.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Table driven shift-reduce parser.
 * <p>
 * A parser holds nothing but its immutable {@link ParseTable}; every call to {@link #parse} owns a
 * fresh {@link ParseStack}, so one parser can serve several threads at once.
 */
public final class Parser {
    private static final Logger logger = LogManager.getLogger(Parser.class);

    private final ParseTable table;
    private final Grammar grammar;

    public Parser(@NotNull ParseTable table) {
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.grammar = table.grammar();
    }

    /**
     * Builds the FIRST/FOLLOW sets, the LR(0) automaton and the SLR(1) table of {@code grammar}.
     *
     * @throws GrammarConflictException if the grammar is not SLR(1)
     */
    public static Parser forGrammar(@NotNull Grammar grammar) {
        long start = System.nanoTime();
        ParseTable table = new SLR1ParseTableGenerator(grammar).generate();
        logger.debug("Generated parser for {} productions in {} ms",
                grammar.productionsCount(), (System.nanoTime() - start) / 1_000_000);
        return new Parser(table);
    }

    public AstNode parse(@NotNull TokenSource tokens) throws IOException, SyntaxErrorException {
        return parse(tokens, ParseListener.NONE);
    }

    /**
     * Runs the input to acceptance or to the first error.
     *
     * @return the node of the start symbol, covering the whole input
     * @throws SyntaxErrorException if a token has no action in the current state
     * @throws IOException if the token source fails
     */
    public AstNode parse(@NotNull TokenSource tokens, @NotNull ParseListener listener) throws IOException, SyntaxErrorException {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");

        ParseStack stack = new ParseStack();
        Token current = tokens.next();
        int tokenIndex = 0;

        while (true) {
            int state = stack.state();
            Action action = table.action(state, column(current.terminal()));
            if (action == null) {
                SyntaxErrorException error = new SyntaxErrorException(current, tokenIndex, state, table.expectedTerminals(state));
                logger.debug("Rejected in state {}: {}", state, error.getMessage());
                throw error;
            }

            switch (action.type()) {
                case SHIFT -> {
                    stack.push(action.data(), AstNode.leaf(current));
                    logger.trace("shift {} -> {}", current.lexeme(), action.data());
                    listener.onShift(action.data(), current);
                    current = tokens.next();
                    tokenIndex++;
                }
                case REDUCE -> {
                    AstNode node = reduce(stack, action.data());
                    listener.onReduce(action.data(), node);
                }
                case ACCEPT -> {
                    if (stack.size() != 1) throw new IllegalStateException("Accepted with a stack of " + stack);
                    AstNode root = stack.node();
                    logger.trace("accept after {} tokens", tokenIndex);
                    listener.onAccept(root);
                    return root;
                }
                default -> throw new IllegalStateException("Unexpected action in the ACTION table: " + action);
            }
        }
    }

    public ParseTable table() {
        return table;
    }

    public Grammar grammar() {
        return grammar;
    }

    // pops the right hand side, builds the node and pushes the GOTO state
    private AstNode reduce(ParseStack stack, int index) {
        Production production = grammar.production(index);
        List<AstNode> children = stack.pop(production.size());
        AstNode node = AstNode.node((NonTerminal) grammar.symbol(production.lhs()), index, children);

        int exposed = stack.state();
        int target = table.gotoState(exposed, production.lhs());
        if (target < 0) {
            throw new IllegalStateException("No GOTO entry for state " + exposed + " and " + grammar.symbol(production.lhs()));
        }
        stack.push(target, node);
        if (logger.isTraceEnabled()) logger.trace("reduce {} -> {}", grammar.toString(production), target);
        return node;
    }

    // a literal match wins over the token class, so a keyword is never read as an identifier
    private int column(Terminal terminal) {
        int index = grammar.indexOf(terminal);
        if (index >= 0 || terminal.isClass()) return index;
        return grammar.indexOf(new Terminal(terminal.type(), null));
    }
}
