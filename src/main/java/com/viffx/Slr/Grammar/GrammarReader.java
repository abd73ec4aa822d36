package com.viffx.Slr.Grammar;

import com.viffx.Slr.Symbols.NonTerminal;
import com.viffx.Slr.Symbols.Symbol;
import com.viffx.Slr.Symbols.SymbolType;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Utils.LexicalCharacterBuffer;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.lang.Character.isLetterOrDigit;
import static java.lang.Character.isWhitespace;

/**
 * Reads the grammar text format into a {@link Grammar}.
 * <p>
 * A grammar is a list of rules of the form
 * <pre>
 *   NonTerminal1 > NonTerminal2 SYM(+) ID() | NonTerminal3;
 * </pre>
 * Bare names are non-terminals, {@code TYPE(value)} is a terminal where {@code TYPE} names a
 * {@link SymbolType} and an empty value declares a whole token class. {@code EPSILON()} stands for
 * the empty right hand side and {@code #} starts a comment that runs to the end of the line.
 * <p>
 * The rule {@code START > S;} designates {@code S} as the start symbol. It must appear exactly once
 * and have exactly one production with exactly one symbol.
 */
final class GrammarReader {
    // ====== INSTANCE FIELDS ====== //
    private final LexicalCharacterBuffer lexer;
    private final Grammar.Builder builder = Grammar.builder();
    private final Set<NonTerminal> defined = new HashSet<>();
    private boolean startDefined = false;

    // Error reporting fields
    private int numRules = 0;
    private int line = 1;
    private final List<GrammarToken> currentRule = new ArrayList<>();

    // ====== CONSTRUCTORS ====== //
    GrammarReader(Reader reader) throws IOException {
        lexer = new LexicalCharacterBuffer(reader) {
            @Override
            protected void onNextChar() {
                if (crntChar() == '\n') line++;
            }
        };
    }

    // ====== INTERNAL DATA TYPES ====== //
    private enum Kind { NON_TERMINAL, TERMINAL, PUNCTUATION, EOF }

    private record GrammarToken(Kind kind, String text, Symbol symbol) {
        static final GrammarToken EOF = new GrammarToken(Kind.EOF, "EOF", null);

        @Override
        public String toString() {
            return symbol == null ? text : symbol.toString();
        }
    }

    // ====== PARSING METHODS ====== //
    Grammar read() throws IOException {
        while (true) {
            ignoreWhiteSpace();

            // break if after absorbing white space we reach the end of the file
            if (lexer.eof()) break;

            parseRule();
        }
        if (!startDefined) {
            throw new MalformedGrammarException("No start symbol is set, the grammar needs a rule of the form: START > Program;");
        }
        return builder.build();
    }

    /**
     * Parses a single rule and hands its productions to the builder.
     *
     * @throws MalformedGrammarException if the rule is malformed or violates the START constraints
     */
    private void parseRule() throws IOException {
        // update and reset parsing state
        numRules++;
        currentRule.clear();

        // ------ Parse the non-terminal declaration (left hand side) ------ //
        GrammarToken leftHandSide = expect(Kind.NON_TERMINAL, null);
        NonTerminal lhs = (NonTerminal) leftHandSide.symbol();
        boolean isStart = NonTerminal.START.equals(lhs);
        if (isStart) {
            if (startDefined) throw error("The NonTerminal START can only be defined once.");
            startDefined = true;
        } else if (!defined.add(lhs)) {
            throw error("nonTerminal: " + lhs + " is already defined");
        }
        expect(Kind.PUNCTUATION, ">");

        // ------ parse the right hand side ------ //
        List<List<Symbol>> alternatives = new ArrayList<>();
        List<Symbol> alternative = new ArrayList<>();
        while (true) {
            GrammarToken current = next();
            if (current.kind() == Kind.EOF) throw error("Reached end of file while defining a non terminal");

            if (current.kind() != Kind.PUNCTUATION) {
                if (NonTerminal.START.equals(current.symbol())) {
                    throw error("The NonTerminal START cannot be part of any right hand side.");
                }
                alternative.add(current.symbol());
                continue;
            }

            // A ";", ">" or a "|" has been detected meaning that the current production is terminated
            if (alternative.isEmpty()) throw error("Unexpected symbol: " + current + ", use EPSILON() for an empty production");
            alternatives.add(alternative);
            alternative = new ArrayList<>();

            if (current.text().equals(";")) break;
            if (current.text().equals(">")) throw error("MISSING SEMICOLON");
        }

        if (!isStart) {
            for (List<Symbol> rhs : alternatives) builder.rule(lhs, rhs);
            return;
        }
        if (alternatives.size() != 1) throw error("The NonTerminal START must have only one production.");
        List<Symbol> rhs = alternatives.get(0);
        if (rhs.size() != 1 || rhs.get(0).isTerminal()) {
            throw error("The NonTerminal START may only have one non terminal in the right hand side.");
        }
        builder.start(rhs.get(0).value());
    }

    // ====== LEXICAL UTILITIES ====== //
    private void ignoreWhiteSpace() throws IOException {
        while (!lexer.eof()) {
            char c = lexer.crntChar();
            if (c == '#') {
                while (!lexer.eof() && lexer.crntChar() != '\n') lexer.nextChar();
            } else if (isWhitespace(c)) {
                lexer.nextChar();
            } else {
                return;
            }
        }
    }

    /**
     * Reads the next token of the grammar text: one of the punctuation symbols {@code >}, {@code |}
     * and {@code ;}, a non-terminal name, or a terminal declaration of the form {@code TYPE(value)}.
     *
     * @return the next token, or {@link GrammarToken#EOF} at the end of the input
     */
    private GrammarToken next() throws IOException {
        ignoreWhiteSpace();
        if (lexer.eof()) return GrammarToken.EOF;

        // Detect a grammar symbol
        char c = lexer.crntChar();
        if (!isLetterOrDigit(c) && c != '_') {
            lexer.nextChar();
            return switch (c) {
                case '>', '|', ';' -> record(new GrammarToken(Kind.PUNCTUATION, String.valueOf(c), null));
                default -> throw error("unknown symbol: " + c);
            };
        }

        // Read the name of the token
        StringBuilder builder = new StringBuilder();
        while (!lexer.eof() && (isLetterOrDigit(lexer.crntChar()) || lexer.crntChar() == '_')) {
            builder.append(lexer.crntChar());
            lexer.nextChar();
        }
        String name = builder.toString();

        // without a value in brackets the name is a non-terminal, otherwise it is the type of a terminal
        if (lexer.eof() || lexer.crntChar() != '(') {
            return record(new GrammarToken(Kind.NON_TERMINAL, name, new NonTerminal(name)));
        }

        SymbolType type;
        try {
            type = SymbolType.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw error("illegal terminal type: " + name);
        }
        if (type == SymbolType.EOF) throw error("the end marker is implicit and cannot be declared");

        String value = readTerminalValue();
        if (type == SymbolType.EPSILON) {
            if (value != null) throw error("EPSILON() does not take a value");
            return record(new GrammarToken(Kind.TERMINAL, name, Terminal.EPSILON));
        }
        if (value == null && (type == SymbolType.KEY || type == SymbolType.SYM)) {
            throw error(type + " terminals need a value");
        }
        return record(new GrammarToken(Kind.TERMINAL, name, new Terminal(type, value)));
    }

    // the current character is the opening bracket, a ')' directly followed by another ')' is the value itself
    private String readTerminalValue() throws IOException {
        StringBuilder value = new StringBuilder();
        lexer.nextChar();
        while (true) {
            if (lexer.eof()) throw error("expected ')' got EOF");
            char c = lexer.crntChar();
            if (c == ')') {
                if (value.length() == 0 && lexer.hasPeek() && lexer.peekChar() == ')') {
                    value.append(c);
                    lexer.nextChar();
                }
                break;
            }
            if (c == '\n') throw error("expected ')' got a new line");
            value.append(c);
            lexer.nextChar();
        }

        // consume the closing bracket
        lexer.nextChar();
        String text = value.toString();
        return (text.equals("ε") || text.isEmpty()) ? null : text;
    }

    private GrammarToken expect(Kind kind, String expectedText) throws IOException {
        GrammarToken token = next();
        if (token.kind() == kind && (expectedText == null || expectedText.equals(token.text()))) return token;
        throw error("EXPECTED: " + kind + (expectedText == null ? "" : "(" + expectedText + ")") + " GOT: " + token);
    }

    private GrammarToken record(GrammarToken token) {
        currentRule.add(token);
        return token;
    }

    // ====== ERROR REPORTING ====== //
    private MalformedGrammarException error(String message) {
        return new MalformedGrammarException(
                "Rule: " + numRules + " Line: " + line + " " + message +
                "\n\tCONTEXT: " + currentRule +
                "\n\tBuffer: " + lexer.buffer());
    }
}
