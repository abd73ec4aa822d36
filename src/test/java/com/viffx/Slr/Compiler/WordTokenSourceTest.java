package com.viffx.Slr.Compiler;

import com.viffx.Slr.Grammar.Grammar;
import com.viffx.Slr.Render.ParenRenderer;
import com.viffx.Slr.Symbols.AstNode;
import com.viffx.Slr.Symbols.Position;
import com.viffx.Slr.Symbols.Terminal;
import com.viffx.Slr.Symbols.Token;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("Word token source")
class WordTokenSourceTest {
    private static final List<String> TYPE_NAMES = List.of("int", "float", "bool", "void");
    private static final String SAMPLE = "int id:main ( ) { int id:x ; return num:0 ; }";

    private static Grammar lang;
    private static Parser parser;

    @BeforeAll
    static void buildParser() throws IOException {
        lang = Grammar.loadResource("grammars/lang.grammar");
        parser = Parser.forGrammar(lang);
    }

    private static WordTokenSource words(String text) throws IOException {
        return new WordTokenSource(new StringReader(text), lang, TYPE_NAMES);
    }

    private static List<Token> read(String text) throws IOException {
        List<Token> tokens = new ArrayList<>();
        try (WordTokenSource source = words(text)) {
            for (Token token = source.next(); !token.isEof(); token = source.next()) tokens.add(token);
        }
        return tokens;
    }

    @Test
    @DisplayName("reads tagged words, bare classes, types and literals")
    void classifies() throws IOException {
        List<Token> tokens = read("int id:main id num:42 7 identifier number return == foo:bar");

        assertThat(tokens).extracting(Token::terminal).containsExactly(
                Terminal.TYPE, Terminal.ID, Terminal.ID, Terminal.NUM, Terminal.NUM, Terminal.ID, Terminal.NUM,
                Terminal.keyword("return"), Terminal.symbol("=="), Terminal.keyword("foo:bar"));
        assertThat(tokens).extracting(Token::lexeme).containsExactly(
                "int", "main", "id", "42", "7", "identifier", "number", "return", "==", "foo:bar");
    }

    @Test
    @DisplayName("uses the text after a literal tag as the lexeme")
    void taggedLiteral() throws IOException {
        assertThat(read("while:loop")).containsExactly(
                new Token(Terminal.keyword("while"), "loop", new Position(1, 1)));
    }

    @Test
    @DisplayName("reads the names of token classes and spelled out identifiers and numbers")
    void classNamesAndPrefixes() throws Exception {
        assertThat(read("type idx num2 numbers")).extracting(Token::terminal).containsExactly(
                Terminal.TYPE, Terminal.ID, Terminal.NUM, Terminal.NUM);

        AstNode declaration = parser.parse(words("type id ;"));
        assertThat(new ParenRenderer().render(declaration))
                .isEqualTo("(Program (DeclList (Decl (VarDecl type id ;)) (DeclList)))");
        assertThat(parser.parse(words("int idx ;")).leaves()).extracting(Token::lexeme)
                .containsExactly("int", "idx", ";");
    }

    @Test
    @DisplayName("tracks the position of each word")
    void positions() throws IOException {
        assertThat(read("int\n  id:x ;")).extracting(Token::position)
                .containsExactly(new Position(1, 1), new Position(2, 3), new Position(2, 8));
    }

    @Test
    @DisplayName("accepts the sample program")
    void acceptsSample() throws Exception {
        AstNode root = parser.parse(words(SAMPLE));

        assertThat(new ParenRenderer().render(root)).isEqualTo(
                "(Program (DeclList (Decl (FuncDecl int main ( (ParamList) ) (Block { " +
                "(StmtList (Stmt (MatchedStmt (VarDecl int x ;))) " +
                "(StmtList (Stmt (MatchedStmt return (Expr (EqlExpr (AddExpr (MulExpr (UnaryExpr (Primary 0)))))) ;)) " +
                "(StmtList))) }))) (DeclList)))");
        assertThat(root.leaves()).hasSize(12);
    }

    @Test
    @DisplayName("reports the index of the word that breaks the program")
    void rejectsMissingSemicolon() {
        SyntaxErrorException error = catchThrowableOfType(
                () -> parser.parse(words("int id:main ( ) { int id:x return num:0 ; }")), SyntaxErrorException.class);

        assertThat(error).isNotNull();
        assertThat(error.tokenIndex()).isEqualTo(7);
        assertThat(error.token().lexeme()).isEqualTo("return");
        assertThat(error.expected()).containsExactly(Terminal.symbol(";"), Terminal.symbol("="));
    }

    @Test
    @DisplayName("reports words the grammar does not know")
    void unknownWord() {
        SyntaxErrorException error = catchThrowableOfType(
                () -> parser.parse(words("int id:x @ ;")), SyntaxErrorException.class);

        assertThat(error.tokenIndex()).isEqualTo(2);
        assertThat(error.token().terminal()).isEqualTo(Terminal.symbol("@"));
    }
}
