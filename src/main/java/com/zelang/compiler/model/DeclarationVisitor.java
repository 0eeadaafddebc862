package com.zelang.compiler.model;

/**
 * Visitor over top-level declarations.
 */
public interface DeclarationVisitor<R> {
    R visitStruct(StructDecl struct);
    R visitPage(PageDecl page);
    R visitHandler(HandlerDecl handler);
    R visitFunction(FunctionDecl function);
    R visitMain(MainDecl main);
}
