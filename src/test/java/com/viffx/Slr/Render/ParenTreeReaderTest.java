package com.viffx.Slr.Render;

import com.viffx.Slr.Compiler.Lexer;
import com.viffx.Slr.Compiler.ListTokenSource;
import com.viffx.Slr.Compiler.Parser;
import com.viffx.Slr.Compiler.SyntaxErrorException;
import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Symbols.AstNode;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Symbols.Token;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Paren rendering round trip")
class ParenTreeReaderTest {
    private static ParenTreeReader reader;
    private final ParenRenderer renderer = new ParenRenderer();

    @BeforeAll
    static void buildReader() throws IOException {
        reader = new ParenTreeReader();
    }

    @Test
    @DisplayName("reads back a sum with the same shape")
    void sum() throws Exception {
        Parser parser = Parser.forGrammar(Grammar.loadResource("grammars/expr.grammar"));
        AstNode original = parser.parse(ListTokenSource.of(Terminal.ID, Terminal.symbol("+"), Terminal.ID));

        String text = renderer.render(original);
        AstNode copy = reader.read(text);

        assertThat(copy.sameShape(original)).isTrue();
        assertThat(renderer.render(copy)).isEqualTo(text);
    }

    @Test
    @DisplayName("reads back a statement of the bundled language")
    void languageStatement() throws Exception {
        Grammar lang = Grammar.loadResource("grammars/lang.grammar");
        String source = "int x = 1 + y * -2; bool b;";
        AstNode original = Parser.forGrammar(lang)
                .parse(new Lexer(new StringReader(source), lang, List.of("int", "bool")));

        String text = renderer.render(original);
        AstNode copy = reader.read(text);

        assertThat(copy.sameShape(original)).isTrue();
        assertThat(renderer.render(copy)).isEqualTo(text);
        assertThat(copy.leaves()).extracting(Token::lexeme)
                .containsExactlyElementsOf(original.leaves().stream().map(Token::lexeme).toList());
    }

    @Test
    @DisplayName("keeps empty nodes")
    void emptyNodes() throws Exception {
        AstNode tree = reader.read("(L a (L) b)");
        assertThat(tree.children()).hasSize(3);
        assertThat(tree.children().get(1).children()).isEmpty();
        assertThat(tree.children().get(1).isLeaf()).isFalse();
    }

    @Test
    @DisplayName("rejects unbalanced text")
    void unbalanced() {
        assertThatThrownBy(() -> reader.read("(E (T id)")).isInstanceOf(SyntaxErrorException.class);
        assertThatThrownBy(() -> reader.read("id")).isInstanceOf(SyntaxErrorException.class);
    }
}
