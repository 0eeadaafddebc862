package com.zelang.compiler.parser;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.zelang.compiler.parser.Token.TokenType;

import lombok.experimental.UtilityClass;

/**
 * Keyword/identifier disambiguation table. Lookups are case-sensitive:
 * {@code Page} is a keyword, {@code page} is an identifier.
 */
@UtilityClass
public class Keywords {

    private final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("struct", TokenType.STRUCT),
        Map.entry("int", TokenType.INT_TYPE),
        Map.entry("float", TokenType.FLOAT_TYPE),
        Map.entry("string", TokenType.STRING_TYPE),
        Map.entry("bool", TokenType.BOOL_TYPE),
        Map.entry("date", TokenType.DATE),
        Map.entry("datetime", TokenType.DATETIME),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("for", TokenType.FOR),
        Map.entry("while", TokenType.WHILE),
        Map.entry("return", TokenType.RETURN),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("void", TokenType.VOID),
        Map.entry("Page", TokenType.PAGE),
        Map.entry("Section", TokenType.SECTION),
        Map.entry("Row", TokenType.ROW),
        Map.entry("Column", TokenType.COLUMN),
        Map.entry("Form", TokenType.FORM),
        Map.entry("Input", TokenType.INPUT),
        Map.entry("Button", TokenType.BUTTON),
        Map.entry("DataList", TokenType.DATALIST),
        Map.entry("handler", TokenType.HANDLER),
        Map.entry("Request", TokenType.REQUEST),
        Map.entry("Response", TokenType.RESPONSE)
    );

    private final Set<TokenType> PRIMITIVE_TYPES = EnumSet.of(
        TokenType.INT_TYPE, TokenType.FLOAT_TYPE, TokenType.STRING_TYPE,
        TokenType.BOOL_TYPE, TokenType.DATE, TokenType.DATETIME
    );

    public TokenType lookup(String text) {
        return KEYWORDS.getOrDefault(text, TokenType.IDENT);
    }

    public boolean isPrimitiveType(TokenType type) {
        return PRIMITIVE_TYPES.contains(type);
    }

    /**
     * Field types: any primitive keyword, or an identifier naming a custom type.
     */
    public boolean isFieldType(TokenType type) {
        return isPrimitiveType(type) || type == TokenType.IDENT;
    }

    public boolean isFunctionReturnType(TokenType type) {
        return isPrimitiveType(type) || type == TokenType.VOID;
    }
}
