package com.zelang.compiler.parser;

import com.zelang.compiler.parser.Token.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ZeTokenizer.
 */
class ZeTokenizerTest {

    @Test
    void testTokenizeStructDeclaration() {
        List<Token> tokens = tokenize("struct User { int id; }");

        assertThat(types(tokens)).containsExactly(
                TokenType.STRUCT, TokenType.IDENT, TokenType.LBRACE,
                TokenType.INT_TYPE, TokenType.IDENT, TokenType.SEMICOLON,
                TokenType.RBRACE, TokenType.EOF);
        assertThat(tokens.get(1).getLiteral()).isEqualTo("User");
        assertThat(tokens.get(4).getLiteral()).isEqualTo("id");
    }

    @Test
    void testPositionsAreOneBased() {
        List<Token> tokens = tokenize("struct User\n  {");

        assertThat(tokens.get(0).getLine()).isEqualTo(1);
        assertThat(tokens.get(0).getColumn()).isEqualTo(1);
        assertThat(tokens.get(1).getColumn()).isEqualTo(8);
        assertThat(tokens.get(2).getLine()).isEqualTo(2);
        assertThat(tokens.get(2).getColumn()).isEqualTo(3);
    }

    @Test
    void testEofIsRepeatedAfterEndOfInput() {
        ZeTokenizer tokenizer = new ZeTokenizer("x");

        assertThat(tokenizer.nextToken().getType()).isEqualTo(TokenType.IDENT);
        assertThat(tokenizer.nextToken().getType()).isEqualTo(TokenType.EOF);
        assertThat(tokenizer.nextToken().getType()).isEqualTo(TokenType.EOF);
        assertThat(tokenizer.nextToken().getType()).isEqualTo(TokenType.EOF);
    }

    @Test
    void testEmptyAndNullSourceYieldOnlyEof() {
        assertThat(types(tokenize(""))).containsExactly(TokenType.EOF);
        assertThat(types(new ZeTokenizer(null).tokenize())).containsExactly(TokenType.EOF);
    }

    @Test
    void testCommentsAreSkipped() {
        String source = """
                // line comment
                struct /* inline */ A
                /* multi
                   line */ {
                """;

        assertThat(types(tokenize(source))).containsExactly(
                TokenType.STRUCT, TokenType.IDENT, TokenType.LBRACE, TokenType.EOF);
    }

    @Test
    void testUnterminatedBlockCommentRunsToEnd() {
        assertThat(types(tokenize("a /* never closed"))).containsExactly(TokenType.IDENT, TokenType.EOF);
    }

    @Test
    void testNumbers() {
        List<Token> tokens = tokenize("42 3.14 7.");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.INT);
        assertThat(tokens.get(0).getLiteral()).isEqualTo("42");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.FLOAT);
        assertThat(tokens.get(1).getLiteral()).isEqualTo("3.14");
        // a dot without a following digit is not part of the number
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.INT);
        assertThat(tokens.get(2).getLiteral()).isEqualTo("7");
        assertThat(tokens.get(3).getType()).isEqualTo(TokenType.ILLEGAL);
    }

    @Test
    void testStrings() {
        List<Token> tokens = tokenize("\"hello world\" \"a\\\"b\"");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).getLiteral()).isEqualTo("hello world");
        assertThat(tokens.get(1).getLiteral()).isEqualTo("a\\\"b");
    }

    @Test
    void testUnterminatedStringRunsToEnd() {
        List<Token> tokens = tokenize("\"abc");

        assertThat(types(tokens)).containsExactly(TokenType.STRING, TokenType.EOF);
        assertThat(tokens.get(0).getLiteral()).isEqualTo("abc");
    }

    @Test
    void testOperators() {
        assertThat(types(tokenize("= == ! != < <= > >= && || + - * /"))).containsExactly(
                TokenType.ASSIGN, TokenType.EQ, TokenType.NOT, TokenType.NOT_EQ,
                TokenType.LT, TokenType.LTE, TokenType.GT, TokenType.GTE,
                TokenType.AND, TokenType.OR, TokenType.PLUS, TokenType.MINUS,
                TokenType.ASTERISK, TokenType.SLASH, TokenType.EOF);
    }

    @Test
    void testLoneAmpersandAndPipeAreIllegal() {
        assertThat(types(tokenize("& |"))).containsExactly(
                TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.EOF);
    }

    @Test
    void testUnknownCharacterIsIllegalAndTokenizingContinues() {
        List<Token> tokens = tokenize("a # b");

        assertThat(types(tokens)).containsExactly(
                TokenType.IDENT, TokenType.ILLEGAL, TokenType.IDENT, TokenType.EOF);
        assertThat(tokens.get(1).getLiteral()).isEqualTo("#");
    }

    @Test
    void testKeywordsAreCaseSensitive() {
        assertThat(types(tokenize("Page page handler Handler DataList"))).containsExactly(
                TokenType.PAGE, TokenType.IDENT, TokenType.HANDLER, TokenType.IDENT,
                TokenType.DATALIST, TokenType.EOF);
    }

    @Test
    void testIdentifiersMayContainUnderscoresAndDigits() {
        List<Token> tokens = tokenize("_created_at2");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.IDENT);
        assertThat(tokens.get(0).getLiteral()).isEqualTo("_created_at2");
    }

    private static List<Token> tokenize(String source) {
        return new ZeTokenizer(source).tokenize();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::getType).toList();
    }
}
