package com.zelang.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Root of the AST: top-level declarations in source order.
 */
@Value
@Builder
public class Program {
    @Singular
    List<Declaration> declarations;

    public static Program empty() {
        return Program.builder().build();
    }

    public boolean isEmpty() {
        return declarations.isEmpty();
    }
}
