package com.zelang.compiler.model;

import lombok.Value;

/**
 * A {@code type name} pair in a handler or function signature.
 */
@Value
public class Parameter {
    String type;
    String name;
}
