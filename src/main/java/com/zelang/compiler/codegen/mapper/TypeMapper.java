package com.zelang.compiler.codegen.mapper;

import lombok.experimental.UtilityClass;

/**
 * Maps ZeLang domain types to C types and SQLite column types.
 *
 * Unrecognized names pass through to C unchanged (so a field may name another
 * struct) and are stored as TEXT.
 */
@UtilityClass
public class TypeMapper {

    public String toNativeType(String domainType) {
        return switch (domainType) {
            case "int" -> "int64_t";
            case "float" -> "double";
            case "string", "date", "datetime" -> "char*";
            case "bool" -> "int";
            default -> domainType;
        };
    }

    public String toSqlType(String domainType) {
        return switch (domainType) {
            case "int", "bool" -> "INTEGER";
            case "float" -> "REAL";
            default -> "TEXT";
        };
    }

    public ValueKind toValueKind(String domainType) {
        return switch (domainType) {
            case "int" -> ValueKind.INT64;
            case "float" -> ValueKind.DOUBLE;
            case "string", "date", "datetime" -> ValueKind.TEXT;
            case "bool" -> ValueKind.BOOL;
            default -> ValueKind.OPAQUE;
        };
    }
}
