package com.zelang.compiler.model;

/**
 * A top-level ZeLang declaration.
 *
 * The hierarchy is closed: every consumer dispatches through
 * {@link DeclarationVisitor}, so adding a kind breaks each consumer until it
 * handles the new kind.
 */
public sealed interface Declaration permits StructDecl, PageDecl, HandlerDecl, FunctionDecl, MainDecl {

    String getName();

    <R> R accept(DeclarationVisitor<R> visitor);
}
