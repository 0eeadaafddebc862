package com.zelang.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One persisted record type.
 */
@Value
@Builder
public class StructDecl implements Declaration, Decorated {
    @NonNull
    String name;

    @Singular
    List<Decorator> decorators;

    @Singular
    List<FieldDecl> fields;

    /**
     * Fields that take part in storage and UI, in declaration order.
     */
    public List<FieldDecl> getScalarFields() {
        return fields.stream().filter(f -> !f.isArray()).toList();
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }
}
