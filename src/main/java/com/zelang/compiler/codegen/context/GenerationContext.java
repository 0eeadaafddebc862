package com.zelang.compiler.codegen.context;

import java.util.List;
import java.util.Optional;

import com.zelang.compiler.model.HandlerDecl;
import com.zelang.compiler.model.PageDecl;
import com.zelang.compiler.model.StructDecl;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Declarations of one program grouped by kind, in source order. Built fresh
 * for every generation call.
 */
@Value
@Builder
public class GenerationContext {
    @NonNull
    GeneratorConfig config;

    @Singular
    List<StructDecl> structs;

    @Singular
    List<PageDecl> pages;

    @Singular
    List<HandlerDecl> handlers;

    int functionCount;

    boolean hasMain;

    /**
     * A program with any page or handler compiles to an HTTP server instead of
     * the console demo.
     */
    public boolean isWebMode() {
        return !pages.isEmpty() || !handlers.isEmpty();
    }

    /**
     * The struct the demo and the web page operate on.
     */
    public Optional<StructDecl> getPrimaryStruct() {
        return structs.stream().findFirst();
    }

    public Optional<PageDecl> getPrimaryPage() {
        return pages.stream().findFirst();
    }
}
