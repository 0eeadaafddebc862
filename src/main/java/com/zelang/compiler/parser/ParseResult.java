package com.zelang.compiler.parser;

import java.util.List;

import com.zelang.compiler.model.Program;

import lombok.Value;

/**
 * Parsed program plus the diagnostics recorded on the way. Diagnostics never
 * stop parsing; callers decide whether they fail the build.
 */
@Value
public class ParseResult {
    Program program;
    List<String> diagnostics;

    public ParseResult(Program program, List<String> diagnostics) {
        this.program = program;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
