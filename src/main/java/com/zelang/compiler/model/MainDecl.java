package com.zelang.compiler.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * The program's own {@code main} function, recognized by name.
 */
@Value
@Builder
public class MainDecl implements Declaration {
    public static final String NAME = "main";

    @NonNull
    String returnType;

    @Singular
    List<Parameter> parameters;

    BodySpan body;

    @Override
    public String getName() {
        return NAME;
    }

    public Optional<BodySpan> getBody() {
        return Optional.ofNullable(body);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitMain(this);
    }
}
