package com.zelang.compiler.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zelang.compiler.model.BodySpan;
import com.zelang.compiler.model.Declaration;
import com.zelang.compiler.model.Decorator;
import com.zelang.compiler.model.FieldDecl;
import com.zelang.compiler.model.FunctionDecl;
import com.zelang.compiler.model.HandlerDecl;
import com.zelang.compiler.model.MainDecl;
import com.zelang.compiler.model.PageDecl;
import com.zelang.compiler.model.Parameter;
import com.zelang.compiler.model.Program;
import com.zelang.compiler.model.StructDecl;
import com.zelang.compiler.parser.Token.TokenType;

/**
 * Recursive-descent parser for ZeLang.
 *
 * Parsing only:
 * - Builds the AST
 * - Records diagnostics as {@code Line L:C: message}
 *
 * A construct that fails a structural check yields no node; the top-level loop
 * always advances at least one token, so any input terminates. Page, handler and
 * function bodies are skipped as brace-balanced spans.
 */
public class ZeParser {
    private static final Logger log = LoggerFactory.getLogger(ZeParser.class);

    private final ZeTokenizer tokenizer;
    private final List<String> diagnostics = new ArrayList<>();

    private Token current;
    private Token peek;

    public ZeParser(ZeTokenizer tokenizer) {
        this.tokenizer = tokenizer;
        // fill current and peek
        advance();
        advance();
    }

    public static ParseResult parse(String source) {
        return new ZeParser(new ZeTokenizer(source)).parseProgram();
    }

    public ParseResult parseProgram() {
        Program.ProgramBuilder program = Program.builder();

        while (!check(TokenType.EOF)) {
            Declaration declaration = parseStatement();
            if (declaration != null) {
                program.declaration(declaration);
            }
            advance();
        }

        return new ParseResult(program.build(), diagnostics);
    }

    private Declaration parseStatement() {
        TokenType type = current.getType();

        if (type == TokenType.AT) {
            return parseDecoratedStatement();
        }
        if (type == TokenType.STRUCT) {
            return parseStructDecl(List.of());
        }
        if (type == TokenType.PAGE) {
            return parsePageDecl(List.of());
        }
        if (type == TokenType.HANDLER) {
            return parseHandlerDecl(List.of());
        }
        if (Keywords.isFunctionReturnType(type)) {
            return parseFunctionDecl();
        }

        log.debug("Skipping top-level token {}", current);
        return null;
    }

    private Declaration parseDecoratedStatement() {
        List<Decorator> decorators = parseDecorators();

        switch (current.getType()) {
            case STRUCT:
                return parseStructDecl(decorators);
            case PAGE:
                return parsePageDecl(decorators);
            case HANDLER:
                return parseHandlerDecl(decorators);
            default:
                log.debug("Discarding {} decorator(s) not followed by struct, Page or handler at {}:{}",
                        decorators.size(), current.getLine(), current.getColumn());
                return null;
        }
    }

    /**
     * Parses a run of {@code @name} or {@code @name(arg, key: value, ...)}.
     * A missing {@code )} records a diagnostic and ends the run, keeping the
     * decorators completed so far.
     */
    private List<Decorator> parseDecorators() {
        List<Decorator> decorators = new ArrayList<>();

        while (check(TokenType.AT)) {
            advance();

            if (!check(TokenType.IDENT)) {
                return decorators;
            }

            Decorator.DecoratorBuilder decorator = Decorator.builder().name(current.getLiteral());
            advance();

            if (check(TokenType.LPAREN)) {
                advance();

                while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
                    if (isDecoratorLiteral(current.getType())) {
                        String arg = current.getLiteral();
                        advance();

                        if (check(TokenType.COLON)) {
                            advance();
                            decorator.kvArg(arg, current.getLiteral());
                            advance();
                        } else {
                            decorator.arg(arg);
                        }

                        if (check(TokenType.COMMA)) {
                            advance();
                        }
                    } else {
                        advance();
                    }
                }

                if (!check(TokenType.RPAREN)) {
                    error(current, "expected ')' after decorator arguments");
                    return decorators;
                }
                advance();
            }

            decorators.add(decorator.build());
        }

        return decorators;
    }

    private static boolean isDecoratorLiteral(TokenType type) {
        return type == TokenType.STRING || type == TokenType.INT
                || type == TokenType.FLOAT || type == TokenType.IDENT;
    }

    private StructDecl parseStructDecl(List<Decorator> decorators) {
        if (!expectPeek(TokenType.IDENT)) {
            return null;
        }
        StructDecl.StructDeclBuilder struct = StructDecl.builder()
                .name(current.getLiteral())
                .decorators(decorators);

        if (!expectPeek(TokenType.LBRACE)) {
            return null;
        }
        advance();

        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            FieldDecl field = parseFieldDecl();
            if (field != null) {
                struct.field(field);
            }
            advance();
        }

        StructDecl result = struct.build();
        log.debug("Parsed struct {} with {} field(s)", result.getName(), result.getFields().size());
        return result;
    }

    private FieldDecl parseFieldDecl() {
        List<Decorator> decorators = check(TokenType.AT) ? parseDecorators() : List.of();

        if (!Keywords.isFieldType(current.getType())) {
            return null;
        }
        FieldDecl.FieldDeclBuilder field = FieldDecl.builder()
                .type(current.getLiteral())
                .decorators(decorators);
        advance();

        if (check(TokenType.LBRACKET)) {
            field.array(true);
            if (!expectPeek(TokenType.RBRACKET)) {
                return null;
            }
            advance();
        }

        if (!check(TokenType.IDENT)) {
            return null;
        }
        field.name(current.getLiteral());
        advance();

        if (!check(TokenType.SEMICOLON)) {
            error(current, "expected ';' after field declaration");
            return null;
        }

        return field.build();
    }

    private PageDecl parsePageDecl(List<Decorator> decorators) {
        if (!expectPeek(TokenType.IDENT)) {
            return null;
        }
        String name = current.getLiteral();

        if (!expectPeek(TokenType.LBRACE)) {
            return null;
        }

        BodySpan span = skipOpaqueSpan();
        log.debug("Parsed Page {} (body skipped, lines {}-{})", name, span.getStartLine(), span.getEndLine());

        return PageDecl.builder()
                .name(name)
                .decorators(decorators)
                .span(span)
                .build();
    }

    private HandlerDecl parseHandlerDecl(List<Decorator> decorators) {
        advance();

        if (!check(TokenType.IDENT)) {
            return null;
        }
        HandlerDecl.HandlerDeclBuilder handler = HandlerDecl.builder()
                .name(current.getLiteral())
                .decorators(decorators);
        advance();

        if (!check(TokenType.LPAREN)) {
            return null;
        }
        List<Parameter> parameters = parseParameterList();
        if (parameters == null) {
            return null;
        }
        handler.parameters(parameters);
        advance();

        if (check(TokenType.LBRACE)) {
            handler.body(skipOpaqueSpan());
        }

        HandlerDecl result = handler.build();
        log.debug("Parsed handler {} with {} parameter(s)", result.getName(), result.getParameters().size());
        return result;
    }

    private Declaration parseFunctionDecl() {
        String returnType = current.getLiteral();
        advance();

        if (!check(TokenType.IDENT)) {
            return null;
        }
        String name = current.getLiteral();
        advance();

        List<Parameter> parameters = List.of();
        if (check(TokenType.LPAREN)) {
            parameters = parseParameterList();
            if (parameters == null) {
                return null;
            }
            advance();
        }

        if (!check(TokenType.LBRACE)) {
            log.debug("Ignoring {} {} without a body at {}:{}", returnType, name, current.getLine(), current.getColumn());
            return null;
        }
        BodySpan body = skipOpaqueSpan();

        if (MainDecl.NAME.equals(name)) {
            log.debug("Parsed main function");
            return MainDecl.builder()
                    .returnType(returnType)
                    .parameters(parameters)
                    .body(body)
                    .build();
        }

        log.debug("Parsed function {} returning {}", name, returnType);
        return FunctionDecl.builder()
                .returnType(returnType)
                .name(name)
                .parameters(parameters)
                .body(body)
                .build();
    }

    /**
     * Current token is {@code (}. Collects {@code type name} pairs; malformed
     * entries are dropped. Returns {@code null} if input ends before {@code )},
     * otherwise leaves the parser on the {@code )}.
     */
    private List<Parameter> parseParameterList() {
        List<Parameter> parameters = new ArrayList<>();
        advance();

        while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
            String type = current.getLiteral();
            advance();

            if (check(TokenType.IDENT)) {
                parameters.add(new Parameter(type, current.getLiteral()));
                advance();
            }

            if (check(TokenType.COMMA)) {
                advance();
            }
        }

        if (!check(TokenType.RPAREN)) {
            return null;
        }
        return parameters;
    }

    /**
     * Advances until brace depth returns to zero after an opening brace, or
     * until EOF, and leaves the parser on the closing brace.
     */
    private BodySpan skipOpaqueSpan() {
        int startLine = current.getLine();
        int depth = 0;
        int count = 0;

        while (!check(TokenType.EOF)) {
            if (check(TokenType.LBRACE)) {
                depth++;
            } else if (check(TokenType.RBRACE)) {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            count++;
            advance();
        }

        return new BodySpan(startLine, current.getLine(), count);
    }

    private boolean check(TokenType type) {
        return current.getType() == type;
    }

    private boolean peekIs(TokenType type) {
        return peek.getType() == type;
    }

    private void advance() {
        current = peek;
        peek = tokenizer.nextToken();
    }

    private boolean expectPeek(TokenType type) {
        if (peekIs(type)) {
            advance();
            return true;
        }
        peekError(type);
        return false;
    }

    private void peekError(TokenType expected) {
        error(peek, String.format("expected next token to be %s, got %s instead",
                expected.label(), peek.getType().label()));
    }

    private void error(Token at, String message) {
        String diagnostic = String.format("Line %d:%d: %s", at.getLine(), at.getColumn(), message);
        log.debug("Parse diagnostic: {}", diagnostic);
        diagnostics.add(diagnostic);
    }
}
