package com.zelang.compiler.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.parser.Token.TokenType;

/**
 * Tokenizer for ZeLang source text.
 *
 * Never fails: unrecognized input comes back as {@link TokenType#ILLEGAL} and the
 * parser decides what to do with it. Once the input is exhausted every call to
 * {@link #nextToken()} returns an {@link TokenType#EOF} token.
 */
public class ZeTokenizer {
    private static final Logger log = LoggerFactory.getLogger(ZeTokenizer.class);

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public ZeTokenizer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the remaining input, including the terminating EOF token.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    public Token nextToken() {
        skipWhitespaceAndComments();

        int startLine = line;
        int startCol = column;

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", startLine, startCol);
        }

        char c = advance();

        switch (c) {
            case '@': return single(TokenType.AT, c, startLine, startCol);
            case '+': return single(TokenType.PLUS, c, startLine, startCol);
            case '-': return single(TokenType.MINUS, c, startLine, startCol);
            case '*': return single(TokenType.ASTERISK, c, startLine, startCol);
            case '/': return single(TokenType.SLASH, c, startLine, startCol);
            case ',': return single(TokenType.COMMA, c, startLine, startCol);
            case ';': return single(TokenType.SEMICOLON, c, startLine, startCol);
            case ':': return single(TokenType.COLON, c, startLine, startCol);
            case '(': return single(TokenType.LPAREN, c, startLine, startCol);
            case ')': return single(TokenType.RPAREN, c, startLine, startCol);
            case '{': return single(TokenType.LBRACE, c, startLine, startCol);
            case '}': return single(TokenType.RBRACE, c, startLine, startCol);
            case '[': return single(TokenType.LBRACKET, c, startLine, startCol);
            case ']': return single(TokenType.RBRACKET, c, startLine, startCol);
            case '=': return pairOr('=', TokenType.EQ, TokenType.ASSIGN, c, startLine, startCol);
            case '!': return pairOr('=', TokenType.NOT_EQ, TokenType.NOT, c, startLine, startCol);
            case '<': return pairOr('=', TokenType.LTE, TokenType.LT, c, startLine, startCol);
            case '>': return pairOr('=', TokenType.GTE, TokenType.GT, c, startLine, startCol);
            case '&': return pairOr('&', TokenType.AND, TokenType.ILLEGAL, c, startLine, startCol);
            case '|': return pairOr('|', TokenType.OR, TokenType.ILLEGAL, c, startLine, startCol);
            case '"': return readString(startLine, startCol);
            default:
                break;
        }

        if (isIdentifierStart(c)) {
            return readIdentifierOrKeyword(startLine, startCol);
        }
        if (isDigit(c)) {
            return readNumber(startLine, startCol);
        }

        log.debug("Illegal character '{}' at {}:{}", c, startLine, startCol);
        return single(TokenType.ILLEGAL, c, startLine, startCol);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekNext() == '*') {
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
                    advance();
                }
                if (!isAtEnd()) {
                    advance();
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private Token single(TokenType type, char c, int startLine, int startCol) {
        return new Token(type, String.valueOf(c), startLine, startCol);
    }

    private Token pairOr(char second, TokenType pairType, TokenType singleType,
                         char first, int startLine, int startCol) {
        if (peek() == second) {
            advance();
            return new Token(pairType, "" + first + second, startLine, startCol);
        }
        return single(singleType, first, startLine, startCol);
    }

    /**
     * The opening quote is already consumed. The literal keeps escape sequences
     * as written; an unterminated string runs to the end of input.
     */
    private Token readString(int startLine, int startCol) {
        int start = pos;
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && peekNext() == '"') {
                advance();
            }
            advance();
        }
        String literal = source.substring(start, pos);
        if (!isAtEnd()) {
            advance();
        }
        return new Token(TokenType.STRING, literal, startLine, startCol);
    }

    private Token readIdentifierOrKeyword(int startLine, int startCol) {
        int start = pos - 1;
        while (!isAtEnd() && (isIdentifierStart(peek()) || isDigit(peek()))) {
            advance();
        }
        String text = source.substring(start, pos);
        return new Token(Keywords.lookup(text), text, startLine, startCol);
    }

    private Token readNumber(int startLine, int startCol) {
        int start = pos - 1;
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        TokenType type = TokenType.INT;
        if (peek() == '.' && isDigit(peekNext())) {
            type = TokenType.FLOAT;
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }
        return new Token(type, source.substring(start, pos), startLine, startCol);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }
}
