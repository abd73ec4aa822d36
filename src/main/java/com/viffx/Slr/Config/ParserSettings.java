package com.viffx.Slr.Config;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Render.Renderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settings of the command line front end, read from YAML.
 * <pre>
 * grammar: grammars/lang.grammar   # classpath resource
 * grammarFile: my.grammar          # optional, wins over grammar
 * renderer: paren                  # paren | indent
 * indentWidth: 2
 * typeNames: [int, float, bool, void]
 * words: false                     # read whitespace separated words instead of source text
 * </pre>
 * Keys left out keep the value of the settings the file is applied to, which for
 * {@link #defaults()} are the values of the bundled {@code slr.yml}.
 *
 * @param grammar     classpath resource holding the grammar
 * @param grammarFile grammar file on disk, or {@code null}
 * @param renderer    renderer used for accepted input
 * @param indentWidth spaces per nesting level of the indent renderer
 * @param typeNames   words the lexers classify as {@code TYPE}
 * @param words       whether input is pre-tokenized words
 */
public record ParserSettings(String grammar, Path grammarFile, RendererKind renderer, int indentWidth,
                             List<String> typeNames, boolean words) {
    private static final Logger logger = LogManager.getLogger(ParserSettings.class);

    public static final String RESOURCE = "slr.yml";

    static final ParserSettings BUILT_IN = new ParserSettings(
            "grammars/lang.grammar", null, RendererKind.PAREN, 2, List.of("int", "float", "bool", "void"), false);

    public ParserSettings {
        if (grammar == null || grammar.isBlank()) throw new SettingsException("grammar cannot be empty");
        if (renderer == null) throw new SettingsException("renderer cannot be null");
        if (indentWidth < 0) throw new SettingsException("indentWidth cannot be negative: " + indentWidth);
        typeNames = List.copyOf(typeNames);
    }

    /**
     * Returns the bundled {@code slr.yml} applied over the built in values.
     */
    public static ParserSettings defaults() {
        InputStream stream = ParserSettings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (stream == null) {
            logger.debug("No {} on the classpath, using built in settings", RESOURCE);
            return BUILT_IN;
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return BUILT_IN.merge(new Yaml().load(reader), RESOURCE);
        } catch (IOException | YAMLException e) {
            throw new SettingsException("Failed to read " + RESOURCE, e);
        }
    }

    public static ParserSettings load(Path path) {
        return defaults().apply(path);
    }

    /**
     * Reads a settings file and applies the keys it sets over these settings.
     */
    public ParserSettings apply(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return merge(new Yaml().load(reader), path.toString());
        } catch (IOException | YAMLException e) {
            throw new SettingsException("Failed to read settings from path: " + path, e);
        }
    }

    public ParserSettings apply(String yamlContent) {
        try {
            return merge(new Yaml().load(yamlContent), "string");
        } catch (YAMLException e) {
            throw new SettingsException("Failed to read settings from string", e);
        }
    }

    public ParserSettings withGrammarFile(Path grammarFile) {
        return new ParserSettings(grammar, grammarFile, renderer, indentWidth, typeNames, words);
    }

    public ParserSettings withRenderer(RendererKind renderer) {
        return new ParserSettings(grammar, grammarFile, renderer, indentWidth, typeNames, words);
    }

    public ParserSettings withWords(boolean words) {
        return new ParserSettings(grammar, grammarFile, renderer, indentWidth, typeNames, words);
    }

    public Grammar loadGrammar() throws IOException {
        if (grammarFile != null) return Grammar.load(grammarFile);
        return Grammar.loadResource(grammar);
    }

    public Renderer createRenderer() {
        return renderer.create(indentWidth);
    }

    // ====== YAML MAPPING ====== //
    private ParserSettings merge(Object loaded, String source) {
        if (loaded == null) return this;
        if (!(loaded instanceof Map<?, ?> data)) throw new SettingsException("Settings in " + source + " must be a mapping");
        try {
            String grammar = data.containsKey("grammar") ? string(data, "grammar") : this.grammar;
            Path grammarFile = data.containsKey("grammarFile") ? Path.of(string(data, "grammarFile")) : this.grammarFile;
            RendererKind renderer = data.containsKey("renderer") ? RendererKind.of(string(data, "renderer")) : this.renderer;
            int indentWidth = data.containsKey("indentWidth") ? integer(data, "indentWidth") : this.indentWidth;
            List<String> typeNames = data.containsKey("typeNames") ? strings(data, "typeNames") : this.typeNames;
            boolean words = data.containsKey("words") ? bool(data, "words") : this.words;
            ParserSettings merged = new ParserSettings(grammar, grammarFile, renderer, indentWidth, typeNames, words);
            logger.debug("Loaded settings from {}: {}", source, merged);
            return merged;
        } catch (IllegalArgumentException e) {
            throw new SettingsException("Invalid settings in " + source + ": " + e.getMessage(), e);
        }
    }

    private static String string(Map<?, ?> data, String key) {
        Object value = data.get(key);
        if (value == null) throw new SettingsException("'" + key + "' cannot be empty");
        return value.toString();
    }

    private static int integer(Map<?, ?> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof Integer)) throw new SettingsException("'" + key + "' must be an integer, got: " + value);
        return (Integer) value;
    }

    private static boolean bool(Map<?, ?> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof Boolean)) throw new SettingsException("'" + key + "' must be true or false, got: " + value);
        return (Boolean) value;
    }

    private static List<String> strings(Map<?, ?> data, String key) {
        Object value = data.get(key);
        if (!(value instanceof List)) throw new SettingsException("'" + key + "' must be a list, got: " + value);
        List<String> strings = new ArrayList<>();
        for (Object item : (List<?>) value) strings.add(String.valueOf(item));
        return strings;
    }
}
