package com.zelang.compiler.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FunctionDecl implements Declaration {
    @NonNull
    String returnType;

    @NonNull
    String name;

    @Singular
    List<Parameter> parameters;

    BodySpan body;

    public Optional<BodySpan> getBody() {
        return Optional.ofNullable(body);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
