package com.zelang.compiler.codegen.util;

import java.util.Locale;

import com.zelang.compiler.model.PageDecl;
import com.zelang.compiler.model.StructDecl;

/**
 * Names derived from declarations. Struct and field names are used verbatim;
 * nothing is sanitized.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Persisted table name: the {@code @table} argument (quotes stripped) if
     * present, else the lowercased struct name plus {@code s}.
     */
    public static String tableName(StructDecl struct) {
        return struct.findDecorator(DecoratorRules.TABLE)
                .flatMap(d -> d.firstArg())
                .orElseGet(() -> struct.getName().toLowerCase(Locale.ROOT) + "s");
    }

    public static String createPath(StructDecl struct) {
        return "/" + tableName(struct) + "/create";
    }

    public static String deletePath(StructDecl struct) {
        return "/" + tableName(struct) + "/delete";
    }

    public static String renderFunctionName(PageDecl page) {
        return "render_" + page.getName().toLowerCase(Locale.ROOT) + "_page";
    }

    /**
     * Upper-cases the first character, e.g. {@code created_at -> Created_at}.
     */
    public static String capitalize(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }
}
