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
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Reads pre-tokenized input: whitespace separated words, each naming one terminal.
 * <ul>
 *   <li>{@code id}, {@code identifier} and {@code id:name} are identifiers.</li>
 *   <li>{@code num}, {@code number}, {@code num:42} and bare digit runs are numbers.</li>
 *   <li>{@code type}, {@code str} and {@code string} name their token classes.</li>
 *   <li>a configured type name such as {@code int} is a type.</li>
 *   <li>a keyword or punctuation literal of the grammar stands for itself.</li>
 *   <li>{@code kind:text} names the terminal {@code kind} and uses {@code text} as the lexeme.</li>
 *   <li>any other word starting with {@code id} or {@code num}, such as {@code idx} or {@code num2},
 *   is an identifier or a number spelled out in full.</li>
 * </ul>
 * Grammar literals are tried before the prefixes, so a keyword such as {@code identity} keeps its meaning.
 * A word that matches nothing becomes a literal the grammar does not know, so the parser reports
 * it as a syntax error at its position.
 */
public class WordTokenSource implements TokenSource, AutoCloseable {
    private final LexicalCharacterBuffer buffer;
    private final Set<String> keywords;
    private final Set<String> symbols;
    private final Set<String> typeNames;
    private final Set<String> typeLiterals;

    private int line = 1;
    private int column = 1;

    public WordTokenSource(@NotNull Reader source, @NotNull Grammar grammar, @NotNull Collection<String> typeNames) throws IOException {
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
    }

    @Override
    public Token next() throws IOException {
        while (!buffer.eof() && Character.isWhitespace(buffer.crntChar())) buffer.nextChar();

        Position position = new Position(line, column);
        if (buffer.eof()) return Token.eof(position);

        StringBuilder word = new StringBuilder();
        while (!buffer.eof() && !Character.isWhitespace(buffer.crntChar())) {
            word.append(buffer.crntChar());
            buffer.nextChar();
        }
        return classify(word.toString(), position);
    }

    @Override
    public void close() throws IOException {
        buffer.close();
    }

    Token classify(String word, Position position) {
        Token literal = literal(word, word, position);
        if (literal != null) return literal;

        int colon = word.indexOf(':');
        if (colon > 0 && colon < word.length() - 1) {
            String kind = word.substring(0, colon);
            String text = word.substring(colon + 1);
            Token tagged = literal(kind, text, position);
            if (tagged != null) return tagged;
        }
        if (word.startsWith("id")) return new Token(Terminal.ID, word, position);
        if (word.startsWith("num") || word.chars().allMatch(Character::isDigit)) return new Token(Terminal.NUM, word, position);

        Terminal unknown = Character.isLetter(word.charAt(0)) ? Terminal.keyword(word) : Terminal.symbol(word);
        return new Token(unknown, word, position);
    }

    // resolves a kind word to a terminal, null when the word names none
    private Token literal(String kind, String lexeme, Position position) {
        switch (kind) {
            case "id", "identifier" -> {
                return new Token(Terminal.ID, lexeme, position);
            }
            case "num", "number" -> {
                return new Token(Terminal.NUM, lexeme, position);
            }
            case "str", "string" -> {
                return new Token(Terminal.STR, lexeme, position);
            }
            case "type" -> {
                return new Token(Terminal.TYPE, lexeme, position);
            }
            default -> {
                if (typeNames.contains(kind)) {
                    Terminal type = typeLiterals.contains(kind) ? new Terminal(SymbolType.TYPE, kind) : Terminal.TYPE;
                    return new Token(type, lexeme, position);
                }
                if (keywords.contains(kind)) return new Token(Terminal.keyword(kind), lexeme, position);
                if (symbols.contains(kind)) return new Token(Terminal.symbol(kind), lexeme, position);
                return null;
            }
        }
    }
}
