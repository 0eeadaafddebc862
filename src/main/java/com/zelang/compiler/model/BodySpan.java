package com.zelang.compiler.model;

import lombok.Value;

/**
 * Location of a brace-balanced body the parser skipped without interpreting.
 */
@Value
public class BodySpan {
    int startLine;
    int endLine;
    int tokenCount;
}
