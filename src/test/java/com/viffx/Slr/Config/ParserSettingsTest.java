package com.viffx.Slr.Config;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Render.IndentRenderer;
import com.viffx.Slr.Render.ParenRenderer;
import com.viffx.Slr.Symbols.NonTerminal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Parser settings")
class ParserSettingsTest {

    @Test
    @DisplayName("reads the bundled slr.yml")
    void defaults() {
        ParserSettings settings = ParserSettings.defaults();

        assertThat(settings.grammar()).isEqualTo("grammars/lang.grammar");
        assertThat(settings.grammarFile()).isNull();
        assertThat(settings.renderer()).isEqualTo(RendererKind.PAREN);
        assertThat(settings.indentWidth()).isEqualTo(2);
        assertThat(settings.typeNames()).containsExactly("int", "float", "bool", "void");
        assertThat(settings.words()).isFalse();
        assertThat(settings.createRenderer()).isInstanceOf(ParenRenderer.class);
    }

    @Test
    @DisplayName("keeps values a file leaves out")
    void partialOverride() {
        ParserSettings settings = ParserSettings.defaults().apply("""
                renderer: indent
                indentWidth: 4
                """);

        assertThat(settings.renderer()).isEqualTo(RendererKind.INDENT);
        assertThat(settings.indentWidth()).isEqualTo(4);
        assertThat(settings.typeNames()).hasSize(4);
        assertThat(settings.createRenderer()).isInstanceOf(IndentRenderer.class);
    }

    @Test
    @DisplayName("ignores keys it does not know, whatever their type")
    void unknownKeys() {
        ParserSettings settings = ParserSettings.defaults().apply("""
                42: answer
                colour: blue
                renderer: indent
                """);

        assertThat(settings).isEqualTo(ParserSettings.defaults().withRenderer(RendererKind.INDENT));
    }

    @Test
    @DisplayName("treats an empty document as no change")
    void emptyDocument() {
        assertThat(ParserSettings.defaults().apply("")).isEqualTo(ParserSettings.defaults());
    }

    @Test
    @DisplayName("loads a file and the grammar it names")
    void loadsFile(@TempDir Path directory) throws IOException {
        Path grammar = directory.resolve("list.grammar");
        Files.writeString(grammar, "START > L;\nL > ID() L | EPSILON();\n");
        Path config = directory.resolve("slr.yml");
        Files.writeString(config, "grammarFile: " + grammar.toString().replace('\\', '/') + "\nwords: true\ntypeNames: [i32]\n");

        ParserSettings settings = ParserSettings.load(config);
        Grammar loaded = settings.loadGrammar();

        assertThat(settings.words()).isTrue();
        assertThat(settings.typeNames()).containsExactly("i32");
        assertThat(loaded.symbol(loaded.startSymbol())).isEqualTo(new NonTerminal("L"));
    }

    @Test
    @DisplayName("applies command line overrides")
    void overrides() {
        ParserSettings settings = ParserSettings.defaults()
                .withRenderer(RendererKind.INDENT)
                .withWords(true)
                .withGrammarFile(Path.of("other.grammar"));

        assertThat(settings.renderer()).isEqualTo(RendererKind.INDENT);
        assertThat(settings.words()).isTrue();
        assertThat(settings.grammarFile()).isEqualTo(Path.of("other.grammar"));
    }

    @Test
    @DisplayName("rejects values of the wrong kind")
    void invalidValues() {
        ParserSettings defaults = ParserSettings.defaults();
        assertThatThrownBy(() -> defaults.apply("indentWidth: wide"))
                .isInstanceOf(SettingsException.class)
                .hasMessageContaining("indentWidth");
        assertThatThrownBy(() -> defaults.apply("indentWidth: -3"))
                .isInstanceOf(SettingsException.class)
                .hasMessageContaining("negative");
        assertThatThrownBy(() -> defaults.apply("renderer: tree"))
                .isInstanceOf(SettingsException.class)
                .hasMessageContaining("Unknown renderer 'tree'");
        assertThatThrownBy(() -> defaults.apply("typeNames: int"))
                .isInstanceOf(SettingsException.class)
                .hasMessageContaining("must be a list");
        assertThatThrownBy(() -> defaults.apply("- just\n- a list"))
                .isInstanceOf(SettingsException.class)
                .hasMessageContaining("mapping");
        assertThatThrownBy(() -> defaults.apply("renderer: [unclosed"))
                .isInstanceOf(SettingsException.class);
    }

    @Test
    @DisplayName("reports a missing settings file")
    void missingFile(@TempDir Path directory) {
        assertThatThrownBy(() -> ParserSettings.load(directory.resolve("none.yml")))
                .isInstanceOf(SettingsException.class)
                .hasMessageContaining("none.yml");
    }
}
