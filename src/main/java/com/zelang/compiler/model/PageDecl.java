package com.zelang.compiler.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A CRUD-backed web page. The parser currently skips the body, so
 * {@code properties} and {@code body} stay empty for parsed pages.
 */
@Value
@Builder
public class PageDecl implements Declaration, Decorated {
    @NonNull
    String name;

    @Singular
    List<Decorator> decorators;

    @Singular
    Map<String, String> properties;

    @Singular("child")
    List<UiNode> body;

    BodySpan span;

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitPage(this);
    }
}
