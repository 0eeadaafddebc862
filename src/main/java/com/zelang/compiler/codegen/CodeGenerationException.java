package com.zelang.compiler.codegen;

/**
 * Thrown when a template fails to load or render.
 */
public class CodeGenerationException extends RuntimeException {

    public CodeGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
