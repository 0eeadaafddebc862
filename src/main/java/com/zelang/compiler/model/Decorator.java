package com.zelang.compiler.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An {@code @name(args)} annotation on a struct, field, page or handler.
 * Names are case-sensitive and never validated; consumers look up the names
 * they understand and ignore the rest.
 */
@Value
@Builder
public class Decorator {
    @NonNull
    String name;

    /**
     * Positional arguments in source order.
     */
    @Singular("arg")
    List<String> args;

    /**
     * {@code key: value} arguments in source order.
     */
    @Singular("kvArg")
    Map<String, String> kvArgs;

    public static Decorator of(String name, String... args) {
        return Decorator.builder().name(name).args(List.of(args)).build();
    }

    /**
     * First positional argument with surrounding double quotes removed.
     */
    public Optional<String> firstArg() {
        if (args.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(stripQuotes(args.get(0)));
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }
}
