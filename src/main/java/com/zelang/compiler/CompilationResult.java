package com.zelang.compiler;

import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of compiling one ZeLang source.
 */
@Data
@Builder
public class CompilationResult {
    private boolean success;
    private String generatedSource;

    @Singular
    private List<String> diagnostics;

    private String errorMessage;

    private int structCount;
    private int pageCount;
    private int handlerCount;
    private boolean webMode;

    public boolean hasDiagnostics() {
        return diagnostics != null && !diagnostics.isEmpty();
    }

    public static CompilationResult failure(String errorMessage, List<String> diagnostics) {
        return CompilationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .diagnostics(diagnostics)
                .build();
    }
}
