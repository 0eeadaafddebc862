package com.zelang.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A struct member. Declaration order is the canonical order for every
 * generated artifact; array fields are left out of all of them.
 */
@Value
@Builder
public class FieldDecl implements Decorated {
    @NonNull
    String name;

    /**
     * Declared type as written: a primitive keyword or a custom type name.
     */
    @NonNull
    String type;

    boolean array;

    @Singular
    List<Decorator> decorators;
}
