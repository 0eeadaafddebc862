package com.zelang.compiler.codegen.model;

import lombok.Builder;
import lombok.Value;

/**
 * One struct field as the templates see it.
 */
@Value
@Builder
public class FieldModel {
    String name;
    String nativeType;
    String sqlType;

    /**
     * SQL constraint suffix, possibly empty.
     */
    String constraints;

    /**
     * {@link com.zelang.compiler.codegen.mapper.ValueKind} name.
     */
    String kind;

    /**
     * Table header and form label.
     */
    String title;

    /**
     * Zero-based position among the non-array fields; -1 for arrays.
     */
    int columnIndex;

    boolean array;
    boolean createParam;
    boolean generatedIdentifier;
    boolean formField;
    boolean required;

    /**
     * Lowercase {@link com.zelang.compiler.codegen.util.DecoratorRules.InputKind} name.
     */
    String inputKind;
}
