package com.zelang.compiler.codegen.model;

import lombok.Value;

/**
 * A declared handler, listed in the output as a comment.
 */
@Value
public class HandlerStubModel {
    String name;
    String signature;
}
