package com.zelang.compiler.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the struct and CRUD templates need for one struct.
 */
@Value
@Builder
public class StructModel {
    String name;
    String tableName;

    /**
     * Lowercased struct name, used for demo variables.
     */
    String variableName;

    /**
     * Column used by find, delete and delete links.
     */
    String identifier;

    /**
     * The column named {@link #identifier}; null when the struct has none.
     */
    FieldModel identifierField;

    /**
     * All fields in declaration order, arrays included.
     */
    @Singular
    List<FieldModel> members;

    @Singular
    List<FieldModel> columns;

    @Singular
    List<FieldModel> createParams;

    @Singular
    List<FieldModel> formFields;

    /**
     * Create-time fields whose value is not supplied by the caller.
     */
    @Singular
    List<FieldModel> derivedFields;

    /**
     * Comma-separated column list for SELECT, {@code *} when there are none.
     */
    String selectList;

    /**
     * First text column, shown next to the id in the demo listing. May be null.
     */
    FieldModel labelColumn;

    String createPath;
    String deletePath;
}
