package com.zelang.compiler.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A request handler stub. The body is kept only as an opaque span.
 */
@Value
@Builder
public class HandlerDecl implements Declaration, Decorated {
    @NonNull
    String name;

    @Singular
    List<Parameter> parameters;

    @Singular
    List<Decorator> decorators;

    BodySpan body;

    public Optional<BodySpan> getBody() {
        return Optional.ofNullable(body);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitHandler(this);
    }
}
