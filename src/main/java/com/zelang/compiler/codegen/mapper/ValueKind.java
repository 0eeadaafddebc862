package com.zelang.compiler.codegen.mapper;

/**
 * How a column value moves between C and SQLite: which bind call, which
 * column read, which printf conversion.
 */
public enum ValueKind {
    INT64,
    DOUBLE,
    TEXT,
    BOOL,
    /**
     * Custom or unknown type: passed through to C, never bound or read.
     */
    OPAQUE
}
