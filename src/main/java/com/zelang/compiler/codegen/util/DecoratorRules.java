package com.zelang.compiler.codegen.util;

import java.util.Map;

import com.zelang.compiler.model.FieldDecl;
import com.zelang.compiler.model.StructDecl;

import lombok.experimental.UtilityClass;

/**
 * The decorator names the generator understands and what they imply for a
 * field. Any other decorator is ignored.
 */
@UtilityClass
public class DecoratorRules {

    public final String PRIMARY = "primary";
    public final String AUTOINCREMENT = "autoincrement";
    public final String REQUIRED = "required";
    public final String UNIQUE = "unique";
    public final String TIMESTAMP = "timestamp";
    public final String TABLE = "table";

    public final String DEFAULT_IDENTIFIER = "id";

    private final Map<String, String> CONSTRAINTS = Map.of(
        PRIMARY, " PRIMARY KEY",
        AUTOINCREMENT, " AUTOINCREMENT",
        REQUIRED, " NOT NULL",
        UNIQUE, " UNIQUE"
    );

    /**
     * SQL constraint suffix, one entry per recognized decorator in the order
     * the decorators were written.
     */
    public String constraintSuffix(FieldDecl field) {
        StringBuilder sb = new StringBuilder();
        field.getDecorators().forEach(d -> {
            String constraint = CONSTRAINTS.get(d.getName());
            if (constraint != null) {
                sb.append(constraint);
            }
        });
        return sb.toString();
    }

    /**
     * Fields supplied by the caller of {@code create}.
     */
    public boolean isCreateParam(FieldDecl field) {
        return !field.isArray()
                && !field.hasDecorator(AUTOINCREMENT)
                && !field.hasDecorator(TIMESTAMP);
    }

    /**
     * Fields whose value after insert is the engine's generated row id.
     */
    public boolean isGeneratedIdentifier(FieldDecl field) {
        return field.hasDecorator(AUTOINCREMENT)
                && (field.hasDecorator(PRIMARY) || DEFAULT_IDENTIFIER.equals(field.getName()));
    }

    /**
     * Fields shown in the generated create form.
     */
    public boolean isFormField(FieldDecl field) {
        return !field.isArray()
                && !field.hasDecorator(AUTOINCREMENT)
                && !field.hasDecorator(PRIMARY);
    }

    public boolean isRequired(FieldDecl field) {
        return field.hasDecorator(REQUIRED);
    }

    /**
     * Column used for find, delete and delete links: the first non-array
     * {@code @primary} field, else {@code id}.
     */
    public String identifierColumn(StructDecl struct) {
        return struct.getScalarFields().stream()
                .filter(f -> f.hasDecorator(PRIMARY))
                .map(FieldDecl::getName)
                .findFirst()
                .orElse(DEFAULT_IDENTIFIER);
    }

    /**
     * Form control for a field: a field named {@code description} is a text
     * area whatever its type, then bool is a checkbox, int a number input, and
     * everything else a text input.
     */
    public InputKind inputKind(FieldDecl field) {
        if ("description".equals(field.getName())) {
            return InputKind.TEXTAREA;
        }
        if ("bool".equals(field.getType())) {
            return InputKind.CHECKBOX;
        }
        if ("int".equals(field.getType())) {
            return InputKind.NUMBER;
        }
        return InputKind.TEXT;
    }

    public enum InputKind {
        TEXTAREA,
        CHECKBOX,
        NUMBER,
        TEXT
    }
}
