package com.zelang.compiler.parser;

import lombok.Value;

/**
 * Represents a token from the ZeLang tokenizer.
 */
@Value
public class Token {
    TokenType type;
    String literal;
    int line;
    int column;

    public enum TokenType {
        EOF("EOF"),
        ILLEGAL("ILLEGAL"),

        IDENT("IDENT"),
        INT("INT"),
        FLOAT("FLOAT"),
        STRING("STRING"),

        STRUCT("STRUCT"),
        INT_TYPE("INT_TYPE"),
        FLOAT_TYPE("FLOAT_TYPE"),
        STRING_TYPE("STRING_TYPE"),
        BOOL_TYPE("BOOL_TYPE"),
        DATE("DATE"),
        DATETIME("DATETIME"),
        IF("IF"),
        ELSE("ELSE"),
        FOR("FOR"),
        WHILE("WHILE"),
        RETURN("RETURN"),
        TRUE("TRUE"),
        FALSE("FALSE"),
        VOID("VOID"),
        PAGE("PAGE"),
        SECTION("SECTION"),
        ROW("ROW"),
        COLUMN("COLUMN"),
        FORM("FORM"),
        INPUT("INPUT"),
        BUTTON("BUTTON"),
        DATALIST("DATALIST"),
        HANDLER("HANDLER"),
        REQUEST("REQUEST"),
        RESPONSE("RESPONSE"),

        ASSIGN("="),
        PLUS("+"),
        MINUS("-"),
        ASTERISK("*"),
        SLASH("/"),
        LT("<"),
        GT(">"),
        EQ("=="),
        NOT_EQ("!="),
        LTE("<="),
        GTE(">="),
        AND("&&"),
        OR("||"),
        NOT("!"),

        COMMA(","),
        SEMICOLON(";"),
        COLON(":"),
        LPAREN("("),
        RPAREN(")"),
        LBRACE("{"),
        RBRACE("}"),
        LBRACKET("["),
        RBRACKET("]"),
        AT("@");

        private final String label;

        TokenType(String label) {
            this.label = label;
        }

        /**
         * Name used in diagnostics, e.g. {@code IDENT} or {@code {}.
         */
        public String label() {
            return label;
        }
    }

    @Override
    public String toString() {
        return type.label() + "('" + literal + "') at " + line + ":" + column;
    }
}
