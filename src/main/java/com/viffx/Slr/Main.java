package com.viffx.Slr;

import com.viffx.Slr.Compiler.GrammarConflictException;
import com.viffx.Slr.Compiler.Lexer;
import com.viffx.Slr.Compiler.LexerException;
import com.viffx.Slr.Compiler.Parser;
import com.viffx.Slr.Compiler.SyntaxErrorException;
import com.viffx.Slr.Compiler.TokenSource;
import com.viffx.Slr.Compiler.WordTokenSource;
import com.viffx.Slr.Config.ParserSettings;
import com.viffx.Slr.Config.RendererKind;
import com.viffx.Slr.Config.SettingsException;
import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Grammar.MalformedGrammarException;
import com.viffx.Slr.Symbols.AstNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line front end.
 * <pre>
 * Main [--paren | --indent] [--words] [--grammar FILE] [--table] [--config FILE] INPUT
 * </pre>
 * {@code INPUT} is a file, or {@code -} for standard input. Exits with {@code 0} when the input is
 * accepted, {@code 1} when it is rejected and {@code 2} when the grammar, its table or the command
 * line is unusable.
 */
public class Main {
    private static final Logger logger = LogManager.getLogger(Main.class);

    static final int ACCEPTED = 0;
    static final int REJECTED = 1;
    static final int FAILED = 2;

    private static final String USAGE =
            "Usage: Main [--paren | --indent] [--words] [--grammar FILE] [--table] [--config FILE] INPUT";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        // ------ read the command line ------ //
        RendererKind renderer = null;
        Boolean words = null;
        Path grammarFile = null;
        Path configFile = null;
        boolean printTable = false;
        String input = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--paren" -> renderer = RendererKind.PAREN;
                case "--indent" -> renderer = RendererKind.INDENT;
                case "--words" -> words = true;
                case "--table" -> printTable = true;
                case "--grammar", "--config" -> {
                    if (i + 1 >= args.length) return usage(err, arg + " needs a file");
                    Path file = Path.of(args[++i]);
                    if (arg.equals("--grammar")) grammarFile = file;
                    else configFile = file;
                }
                default -> {
                    if (arg.startsWith("--")) return usage(err, "unknown option " + arg);
                    if (input != null) return usage(err, "only one INPUT can be given");
                    input = arg;
                }
            }
        }
        if (input == null && !printTable) return usage(err, "no INPUT given");

        // ------ settings, grammar and table ------ //
        ParserSettings settings;
        Parser parser;
        try {
            settings = configFile == null ? ParserSettings.defaults() : ParserSettings.load(configFile);
            if (renderer != null) settings = settings.withRenderer(renderer);
            if (words != null) settings = settings.withWords(words);
            if (grammarFile != null) settings = settings.withGrammarFile(grammarFile);

            Grammar grammar = settings.loadGrammar();
            parser = Parser.forGrammar(grammar);
        } catch (SettingsException | MalformedGrammarException | GrammarConflictException e) {
            logger.debug("Could not set up the parser", e);
            err.println(e.getMessage());
            return FAILED;
        } catch (IOException e) {
            logger.debug("Could not read the grammar", e);
            err.println("Could not read the grammar: " + e.getMessage());
            return FAILED;
        }

        if (printTable) out.print(parser.table().describe());
        if (input == null) return ACCEPTED;

        // ------ parse ------ //
        try (Reader reader = open(input)) {
            TokenSource tokens = settings.words()
                    ? new WordTokenSource(reader, parser.grammar(), settings.typeNames())
                    : new Lexer(reader, parser.grammar(), settings.typeNames());
            AstNode root = parser.parse(tokens);
            out.println("Accepted");
            out.println(settings.createRenderer().render(root));
            return ACCEPTED;
        } catch (SyntaxErrorException e) {
            out.println("Error at token " + e.tokenIndex() + " (" + e.position() + "): " + e.getMessage());
            return REJECTED;
        } catch (LexerException e) {
            out.println("Error at " + e.position() + ": " + e.getMessage());
            return REJECTED;
        } catch (IOException e) {
            logger.debug("Could not read the input", e);
            err.println("Could not read " + input + ": " + e.getMessage());
            return FAILED;
        }
    }

    private static Reader open(String input) throws IOException {
        if (input.equals("-")) return new InputStreamReader(System.in, StandardCharsets.UTF_8);
        return Files.newBufferedReader(Path.of(input), StandardCharsets.UTF_8);
    }

    private static int usage(PrintStream err, String problem) {
        err.println(problem);
        err.println(USAGE);
        return FAILED;
    }
}
