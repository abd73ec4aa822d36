package com.viffx.Slr.Render;

import com.viffx.Slr.Compiler.Lexer;
import com.viffx.Slr.Compiler.Parser;
import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Symbols.AstNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Indent renderer")
class IndentRendererTest {
    private final Grammar blocks = Grammar.parse("""
            START > Stmt;
            Stmt > KEY(if) SYM(() ID() SYM()) Block | ID();
            Block > SYM({) Stmt SYM(});
            """);

    private AstNode parse(String source) throws Exception {
        return Parser.forGrammar(blocks).parse(new Lexer(new StringReader(source), blocks, List.of()));
    }

    private static int indentOf(String line) {
        return line.length() - line.stripLeading().length();
    }

    @Test
    @DisplayName("nests the body of an if one level deeper than the if")
    void nestsBody() throws Exception {
        String text = new IndentRenderer().render(parse("if (x) { y }"));

        assertThat(text).isEqualTo(String.join("\n",
                "Stmt",
                "  if",
                "  (",
                "  x",
                "  )",
                "  Block",
                "    {",
                "    Stmt",
                "      y",
                "    }"));
        List<String> lines = text.lines().toList();
        String ifLine = lines.get(1);
        String bodyLine = lines.get(7);
        assertThat(indentOf(bodyLine) - indentOf(ifLine)).isEqualTo(2);
    }

    @Test
    @DisplayName("uses the configured width per level")
    void configuredWidth() throws Exception {
        String text = new IndentRenderer(4).render(parse("if (x) { if (y) { z } }"));
        assertThat(text.lines()).contains("        Stmt", "                Stmt", "                    z");
    }

    @Test
    @DisplayName("prints a single leaf tree on one line")
    void singleLine() throws Exception {
        assertThat(new IndentRenderer().render(parse("y"))).isEqualTo("Stmt\n  y");
    }

    @Test
    @DisplayName("rejects a negative width")
    void negativeWidth() {
        assertThatThrownBy(() -> new IndentRenderer(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
