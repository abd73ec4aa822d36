package com.viffx.Slr.Compiler;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Symbols.Position;
import com.viffx.Slr.Symbols.SymbolType;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Symbols.Token;
import com.viffx.Slr.Utils.LexicalCharacterBuffer;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Reader;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import static java.lang.Character.*;

/**
 * Turns source text into tokens for a grammar.
 * <p>
 * The vocabulary comes from the grammar itself: every {@code KEY(..)} literal is a keyword, every
 * {@code SYM(..)} literal is punctuation and every {@code TYPE(..)} literal, together with the
 * configured type names, is a type. Punctuation takes the longest literal that matches, so
 * {@code ==} wins over {@code =}, and {@code ==} reads as {@code =} {@code =} when only {@code =}
 * and {@code ===} exist. Other words are identifiers, digit runs are numbers and {@code "..."} is a
 * string. Text between two {@code #} characters is a comment and is skipped.
 */
public class Lexer implements TokenSource, AutoCloseable {
    private final LexicalCharacterBuffer buffer;
    private final Set<String> keywords;
    private final Set<String> typeNames;
    private final Set<String> symbols;
    private final Set<String> symbolPrefixes = new HashSet<>();
    private final Set<String> typeLiterals;

    // position of the current character
    private int line = 1;
    private int column = 1;

    public Lexer(@NotNull Reader source, @NotNull Grammar grammar, @NotNull Collection<String> typeNames) throws IOException {
        Objects.requireNonNull(grammar, "grammar cannot be null");
        buffer = new LexicalCharacterBuffer(Objects.requireNonNull(source, "source cannot be null")) {
            @Override
            protected void onNextChar() {
                if (crntChar() == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
        };
        keywords = grammar.literals(SymbolType.KEY);
        symbols = grammar.literals(SymbolType.SYM);
        typeLiterals = grammar.literals(SymbolType.TYPE);
        this.typeNames = new LinkedHashSet<>(typeNames);
        this.typeNames.addAll(typeLiterals);
        for (String symbol : symbols) {
            for (int i = 1; i <= symbol.length(); i++) symbolPrefixes.add(symbol.substring(0, i));
        }
    }

    // Gets the next token.
    @Override
    public Token next() throws IOException {
        skipWhiteSpaceAndComments();

        Position position = new Position(line, column);
        if (buffer.eof()) return Token.eof(position);

        char c = buffer.crntChar();
        if (c == '"') return new Token(Terminal.STR, nextStringLiteral(position), position);
        if (isDigit(c)) return new Token(Terminal.NUM, nextWhile(Character::isDigit), position);
        if (isLetter(c) || c == '_') {
            String word = nextWhile(ch -> isLetterOrDigit(ch) || ch == '_');
            if (keywords.contains(word)) return new Token(Terminal.keyword(word), word, position);
            if (typeNames.contains(word)) return new Token(typeTerminal(word), word, position);
            return new Token(Terminal.ID, word, position);
        }
        return nextSymbol(position);
    }

    @Override
    public void close() throws IOException {
        buffer.close();
    }

    // ====== SCANNING HELPERS ====== //
    private void skipWhiteSpaceAndComments() throws IOException {
        while (!buffer.eof()) {
            char c = buffer.crntChar();
            if (isWhitespace(c)) {
                buffer.nextChar();
            } else if (c == '#' && !symbolPrefixes.contains("#")) {
                nextBlock('#', new Position(line, column));
            } else {
                return;
            }
        }
    }

    private String nextWhile(CharPredicate accept) throws IOException {
        StringBuilder builder = new StringBuilder();
        while (!buffer.eof() && accept.test(buffer.crntChar())) {
            builder.append(buffer.crntChar());
            buffer.nextChar();
        }
        return builder.toString();
    }

    // extends the match while the text so far is still the start of some punctuation literal,
    // then gives back whatever was read past the last complete literal
    private Token nextSymbol(Position position) throws IOException {
        StringBuilder builder = new StringBuilder();
        String matched = null;
        int matchedLine = line;
        int matchedColumn = column;
        while (!buffer.eof() && symbolPrefixes.contains(builder.toString() + buffer.crntChar())) {
            builder.append(buffer.crntChar());
            buffer.nextChar();
            if (symbols.contains(builder.toString())) {
                matched = builder.toString();
                matchedLine = line;
                matchedColumn = column;
            }
        }
        String text = builder.toString();
        if (text.isEmpty()) throw new LexerException("Unrecognized symbol: '" + buffer.crntChar() + "'", position);
        if (matched == null) throw new LexerException("Incomplete symbol: '" + text + "'", position);
        if (matched.length() < text.length()) {
            buffer.unread(text.substring(matched.length()));
            line = matchedLine;
            column = matchedColumn;
        }
        return new Token(Terminal.symbol(matched), matched, position);
    }

    private String nextStringLiteral(Position position) throws IOException {
        return nextBlock('"', position);
    }

    /* Returns the characters up to the first non escaped end character and moves past it.
     * The current character is the opening one. */
    private String nextBlock(char endChar, Position position) throws IOException {
        StringBuilder builder = new StringBuilder();
        boolean escaped = false;
        buffer.nextChar();
        while (true) {
            if (buffer.eof()) throw new LexerException("Unterminated block, expected " + endChar, position);
            char c = buffer.crntChar();
            if (c == endChar && !escaped) break;
            if (c == '\\' && !escaped) {
                escaped = true;
            } else {
                if (escaped && c != endChar && c != '\\') builder.append('\\');
                builder.append(c);
                escaped = false;
            }
            buffer.nextChar();
        }
        buffer.nextChar();
        return builder.toString();
    }

    private Terminal typeTerminal(String word) {
        return typeLiterals.contains(word) ? new Terminal(SymbolType.TYPE, word) : Terminal.TYPE;
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
