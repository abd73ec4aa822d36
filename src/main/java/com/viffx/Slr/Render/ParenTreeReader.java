package com.viffx.Slr.Render;

import com.viffx.Slr.Compiler.Parser;
import com.viffx.Slr.Compiler.SyntaxErrorException;
import com.viffx.Slr.Compiler.TokenSource;
import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Symbols.AstNode;
import com.viffx.Slr.Symbols.NonTerminal;
import com.viffx.Slr.Symbols.Position;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Symbols.Token;
import com.viffx.Slr.Utils.LexicalCharacterBuffer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the output of {@link ParenRenderer} back into a tree.
 * <p>
 * The text is parsed with the bundled {@code grammars/sexpr.grammar} by the same SLR(1) engine that
 * produced the original tree. The rebuilt tree has the same shape and labels as the original; its
 * internal nodes carry production {@code -1} since the text does not record which production was
 * reduced. Leaves made of a bare parenthesis or containing whitespace cannot be read back.
 */
public class ParenTreeReader {
    public static final String GRAMMAR_RESOURCE = "grammars/sexpr.grammar";

    private final Parser parser;

    public ParenTreeReader() throws IOException {
        this(Parser.forGrammar(Grammar.loadResource(GRAMMAR_RESOURCE)));
    }

    public ParenTreeReader(Parser parser) {
        this.parser = parser;
    }

    /**
     * @throws SyntaxErrorException if {@code text} is not a well formed parenthesised tree
     */
    public AstNode read(String text) throws IOException, SyntaxErrorException {
        try (SExprTokens tokens = new SExprTokens(text)) {
            AstNode sexpr = parser.parse(tokens);
            return toTree(sexpr);
        }
    }

    // SExpr > ( name Elements )
    private AstNode toTree(AstNode sexpr) {
        List<AstNode> parts = sexpr.children();
        String name = parts.get(1).label();
        List<AstNode> children = new ArrayList<>();
        collectElements(parts.get(2), children);
        return AstNode.node(new NonTerminal(name), -1, children);
    }

    // Elements > Element Elements | EPSILON() and Element > SExpr | ID()
    private void collectElements(AstNode elements, List<AstNode> children) {
        while (!elements.children().isEmpty()) {
            AstNode element = elements.children().get(0).children().get(0);
            if (element.isLeaf()) {
                children.add(AstNode.leaf(new Token(Terminal.ID, element.label(), element.token().position())));
            } else {
                children.add(toTree(element));
            }
            elements = elements.children().get(1);
        }
    }

    /**
     * Splits text into {@code (}, {@code )} and runs of anything else.
     */
    private static final class SExprTokens implements TokenSource, AutoCloseable {
        private static final Terminal OPEN = Terminal.symbol("(");
        private static final Terminal CLOSE = Terminal.symbol(")");

        private final LexicalCharacterBuffer buffer;
        private int column = 1;

        SExprTokens(String text) throws IOException {
            buffer = new LexicalCharacterBuffer(text) {
                @Override
                protected void onNextChar() {
                    column++;
                }
            };
        }

        @Override
        public Token next() throws IOException {
            while (!buffer.eof() && Character.isWhitespace(buffer.crntChar())) buffer.nextChar();
            Position position = new Position(1, column);
            if (buffer.eof()) return Token.eof(position);

            char c = buffer.crntChar();
            if (c == '(' || c == ')') {
                buffer.nextChar();
                return new Token(c == '(' ? OPEN : CLOSE, String.valueOf(c), position);
            }
            StringBuilder word = new StringBuilder();
            while (!buffer.eof() && !isDelimiter(buffer.crntChar())) {
                word.append(buffer.crntChar());
                buffer.nextChar();
            }
            return new Token(Terminal.ID, word.toString(), position);
        }

        private static boolean isDelimiter(char c) {
            return c == '(' || c == ')' || Character.isWhitespace(c);
        }

        @Override
        public void close() throws IOException {
            buffer.close();
        }
    }
}
